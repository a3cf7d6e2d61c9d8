package com.aquacontrol.domain.tank.model.entity;

import com.aquacontrol.domain.tank.model.valobj.SensorId;
import com.aquacontrol.domain.tank.model.valobj.SensorSnapshot;
import com.aquacontrol.types.enums.SensorStatusEnum;
import com.aquacontrol.types.enums.SensorTypeEnum;
import com.aquacontrol.types.exception.ValidationException;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 传感器实体（鱼池聚合的子实体）
 * <p>
 * 传感器不单独持久化也不单独加载，所有变更都经由 {@link com.aquacontrol.domain.tank.model.aggregate.TankAggregate}
 * 的命令产生事件，再由聚合在回放时调用这里的 {@code applyXxx} 方法落到状态上。
 * </p>
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
@Getter
public class SensorEntity {

    private static final BigDecimal MAX_ACCURACY = BigDecimal.valueOf(100);

    /**
     * 传感器 ID
     */
    private final SensorId sensorId;

    /**
     * 传感器类型
     */
    private final SensorTypeEnum sensorType;

    /**
     * 型号
     */
    private final String model;

    /**
     * 厂商
     */
    private final String manufacturer;

    /**
     * 序列号
     */
    private final String serialNumber;

    /**
     * 精度百分比 (0,100]
     */
    private BigDecimal accuracy;

    /**
     * 量程下限
     */
    private BigDecimal minValue;

    /**
     * 量程上限
     */
    private BigDecimal maxValue;

    /**
     * 安装时间
     */
    private final LocalDateTime installationDate;

    /**
     * 最近校准时间
     */
    private LocalDateTime calibrationDate;

    /**
     * 下次校准时间
     */
    private LocalDateTime nextCalibrationDate;

    /**
     * 是否启用
     */
    private boolean active;

    /**
     * 运行状态
     */
    private SensorStatusEnum status;

    /**
     * 备注（停用时记录停用原因）
     */
    private String notes;

    private SensorEntity(SensorSnapshot snapshot) {
        this.sensorId = snapshot.sensorId();
        this.sensorType = snapshot.sensorType();
        this.model = snapshot.model();
        this.manufacturer = snapshot.manufacturer();
        this.serialNumber = snapshot.serialNumber();
        this.accuracy = snapshot.accuracy();
        this.minValue = snapshot.minValue();
        this.maxValue = snapshot.maxValue();
        this.installationDate = snapshot.installationDate();
        this.calibrationDate = snapshot.calibrationDate();
        this.nextCalibrationDate = snapshot.nextCalibrationDate();
        this.active = snapshot.active();
        this.status = snapshot.status();
        this.notes = snapshot.notes();
    }

    /**
     * 创建新传感器：启用、在线、按类型设置默认量程。
     */
    public static SensorEntity create(SensorTypeEnum sensorType, String model, String manufacturer,
                                      String serialNumber, BigDecimal accuracy) {
        if (sensorType == null) {
            throw new ValidationException("Sensor type cannot be null");
        }
        if (StringUtils.isBlank(model)) {
            throw new ValidationException("Model cannot be empty");
        }
        if (StringUtils.isBlank(manufacturer)) {
            throw new ValidationException("Manufacturer cannot be empty");
        }
        if (StringUtils.isBlank(serialNumber)) {
            throw new ValidationException("Serial number cannot be empty");
        }
        validateAccuracy(accuracy);

        BigDecimal[] range = defaultRange(sensorType);
        return new SensorEntity(new SensorSnapshot(SensorId.generate(), sensorType, model, manufacturer,
                serialNumber, accuracy, range[0], range[1], LocalDateTime.now(), null, null,
                true, SensorStatusEnum.ONLINE, null));
    }

    /**
     * 从事件或快照中携带的完整状态还原传感器，不做任何校验。
     */
    public static SensorEntity fromSnapshot(SensorSnapshot snapshot) {
        return new SensorEntity(snapshot);
    }

    public SensorSnapshot toSnapshot() {
        return new SensorSnapshot(sensorId, sensorType, model, manufacturer, serialNumber, accuracy,
                minValue, maxValue, installationDate, calibrationDate, nextCalibrationDate,
                active, status, notes);
    }

    public static void validateAccuracy(BigDecimal accuracy) {
        if (accuracy == null || accuracy.signum() <= 0 || accuracy.compareTo(MAX_ACCURACY) > 0) {
            throw new ValidationException("Accuracy must be between 0 and 100");
        }
    }

    public static void validateRange(BigDecimal minValue, BigDecimal maxValue) {
        if (minValue == null || maxValue == null) {
            throw new ValidationException("Min value and max value are required");
        }
        if (minValue.compareTo(maxValue) >= 0) {
            throw new ValidationException("Min value must be less than max value");
        }
    }

    /**
     * 按传感器类型计算下次校准时间。
     */
    public LocalDateTime nextCalibrationDateFrom(LocalDateTime calibrationDate) {
        return calibrationDate.plusMonths(calibrationIntervalMonths(sensorType));
    }

    public static int calibrationIntervalMonths(SensorTypeEnum sensorType) {
        switch (sensorType) {
            case PH:
            case TURBIDITY:
            case AMMONIA:
            case NITRITE:
                return 3;
            case TEMPERATURE:
                return 12;
            case DISSOLVED_OXYGEN:
            case SALINITY:
            case NITRATE:
            default:
                return 6;
        }
    }

    static BigDecimal[] defaultRange(SensorTypeEnum sensorType) {
        switch (sensorType) {
            case TEMPERATURE:
                return range(-10, 50);
            case PH:
                return range(0, 14);
            case DISSOLVED_OXYGEN:
                return range(0, 20);
            case SALINITY:
                return range(0, 50);
            case TURBIDITY:
                return range(0, 1000);
            case AMMONIA:
            case PHOSPHATE:
                return range(0, 10);
            case NITRITE:
                return range(0, 5);
            case NITRATE:
                return range(0, 100);
            case ALKALINITY:
                return range(0, 300);
            default:
                return range(0, 100);
        }
    }

    private static BigDecimal[] range(long min, long max) {
        return new BigDecimal[]{BigDecimal.valueOf(min), BigDecimal.valueOf(max)};
    }

    public boolean isCalibrationDue(LocalDateTime now) {
        return nextCalibrationDate != null && !nextCalibrationDate.isAfter(now);
    }

    /**
     * 未设置量程时视为任何读数都在范围内。
     */
    public boolean isValueInRange(BigDecimal value) {
        if (value == null) {
            return false;
        }
        if (minValue == null || maxValue == null) {
            return true;
        }
        return value.compareTo(minValue) >= 0 && value.compareTo(maxValue) <= 0;
    }

    public boolean hasRange(BigDecimal min, BigDecimal max) {
        return minValue != null && maxValue != null
                && minValue.compareTo(min) == 0 && maxValue.compareTo(max) == 0;
    }

    // ---- 以下方法只由聚合的 apply 调用 ----

    public void applyCalibrated(LocalDateTime calibrationDate, LocalDateTime nextCalibrationDate,
                                BigDecimal accuracy, String notes) {
        this.calibrationDate = calibrationDate;
        this.nextCalibrationDate = nextCalibrationDate;
        this.accuracy = accuracy;
        this.notes = notes;
    }

    public void applyRange(BigDecimal minValue, BigDecimal maxValue) {
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public void applyActivated() {
        this.active = true;
        this.status = SensorStatusEnum.ONLINE;
    }

    public void applyDeactivated(String reason) {
        this.active = false;
        this.status = SensorStatusEnum.OFFLINE;
        this.notes = reason;
    }

    public void applyStatus(SensorStatusEnum status) {
        this.status = status;
    }
}
