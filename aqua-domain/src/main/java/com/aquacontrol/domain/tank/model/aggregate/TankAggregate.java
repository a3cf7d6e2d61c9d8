package com.aquacontrol.domain.tank.model.aggregate;

import com.aquacontrol.domain.tank.model.entity.SensorEntity;
import com.aquacontrol.domain.tank.model.event.TankEvent;
import com.aquacontrol.domain.tank.model.event.TankEvent.SensorActivated;
import com.aquacontrol.domain.tank.model.event.TankEvent.SensorAddedToTank;
import com.aquacontrol.domain.tank.model.event.TankEvent.SensorCalibrated;
import com.aquacontrol.domain.tank.model.event.TankEvent.SensorDeactivated;
import com.aquacontrol.domain.tank.model.event.TankEvent.SensorRangeUpdated;
import com.aquacontrol.domain.tank.model.event.TankEvent.SensorRemovedFromTank;
import com.aquacontrol.domain.tank.model.event.TankEvent.SensorStatusChanged;
import com.aquacontrol.domain.tank.model.event.TankEvent.TankActivated;
import com.aquacontrol.domain.tank.model.event.TankEvent.TankCapacityChanged;
import com.aquacontrol.domain.tank.model.event.TankEvent.TankCreated;
import com.aquacontrol.domain.tank.model.event.TankEvent.TankDeactivated;
import com.aquacontrol.domain.tank.model.event.TankEvent.TankMaintenanceCompleted;
import com.aquacontrol.domain.tank.model.event.TankEvent.TankMaintenanceScheduled;
import com.aquacontrol.domain.tank.model.event.TankEvent.TankNameChanged;
import com.aquacontrol.domain.tank.model.event.TankEvent.TankOptimalParametersSet;
import com.aquacontrol.domain.tank.model.event.TankEvent.TankRelocated;
import com.aquacontrol.domain.tank.model.event.TankEvent.UnknownTankEvent;
import com.aquacontrol.domain.tank.model.valobj.Location;
import com.aquacontrol.domain.tank.model.valobj.SensorId;
import com.aquacontrol.domain.tank.model.valobj.SensorSnapshot;
import com.aquacontrol.domain.tank.model.valobj.StoredTankEvent;
import com.aquacontrol.domain.tank.model.valobj.TankCapacity;
import com.aquacontrol.domain.tank.model.valobj.TankId;
import com.aquacontrol.domain.tank.model.valobj.TankSnapshot;
import com.aquacontrol.domain.tank.model.valobj.WaterQualityParameters;
import com.aquacontrol.types.common.Constants;
import com.aquacontrol.types.enums.SensorStatusEnum;
import com.aquacontrol.types.enums.SensorTypeEnum;
import com.aquacontrol.types.enums.TankStatusEnum;
import com.aquacontrol.types.enums.TankTypeEnum;
import com.aquacontrol.types.exception.InvariantViolationException;
import com.aquacontrol.types.exception.ValidationException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 鱼池聚合根（事件溯源）
 * <p>
 * 命令方法只负责校验入参与业务不变量并构造事件，状态变更统一交给 {@link #apply(TankEvent)}，
 * 回放历史事件走的也是同一个 apply，因此“执行命令”与“回放事件”得到的状态完全一致。
 * 回放时不校验不变量也不产生新事件。
 * </p>
 * 业务不变量（仅在命令执行时校验）：
 * <ul>
 *   <li>传感器数量不超过 {@value Constants#MAX_SENSORS_PER_TANK}</li>
 *   <li>传感器 ID 在鱼池内唯一</li>
 *   <li>启用鱼池前至少有一个启用的传感器</li>
 *   <li>运行中的鱼池不能移除最后一个启用的传感器</li>
 * </ul>
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
@Slf4j
@Getter
public class TankAggregate {

    private TankId tankId;

    private String name;

    private TankCapacity capacity;

    private Location location;

    private TankTypeEnum tankType;

    private TankStatusEnum status;

    private WaterQualityParameters optimalParameters;

    private LocalDateTime lastMaintenanceDate;

    private LocalDateTime nextMaintenanceDate;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 已应用的事件数（含未持久化事件）
     */
    private long version;

    @Getter(AccessLevel.NONE)
    private final List<SensorEntity> sensors = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<TankEvent> pendingEvents = new ArrayList<>();

    private TankAggregate() {
    }

    // ==================== 创建与重建 ====================

    /**
     * 创建新鱼池，初始状态为未启用。
     */
    public static TankAggregate create(String name, TankCapacity capacity, Location location, TankTypeEnum tankType) {
        requireName(name);
        if (capacity == null) {
            throw new ValidationException("Tank capacity cannot be null");
        }
        if (location == null) {
            throw new ValidationException("Tank location cannot be null");
        }
        if (tankType == null) {
            throw new ValidationException("Tank type cannot be null");
        }
        TankAggregate tank = new TankAggregate();
        tank.raise(new TankCreated(UUID.randomUUID(), TankId.generate(), LocalDateTime.now(),
                name.trim(), capacity, location, tankType));
        return tank;
    }

    /**
     * 从零回放事件序列，版本号等于事件数。
     */
    public static TankAggregate replay(List<? extends TankEvent> events) {
        TankAggregate tank = new TankAggregate();
        for (TankEvent event : events) {
            tank.apply(event);
        }
        return tank;
    }

    /**
     * 从快照（可为空）开始，按顺序回放快照之后的事件。
     */
    public static TankAggregate rehydrate(TankSnapshot snapshot, List<StoredTankEvent> events) {
        TankAggregate tank = snapshot == null ? new TankAggregate() : fromSnapshot(snapshot);
        for (StoredTankEvent stored : events) {
            tank.apply(stored.event());
            tank.version = stored.version();
        }
        return tank;
    }

    public static TankAggregate fromSnapshot(TankSnapshot snapshot) {
        TankAggregate tank = new TankAggregate();
        tank.tankId = snapshot.tankId();
        tank.name = snapshot.name();
        tank.capacity = snapshot.capacity();
        tank.location = snapshot.location();
        tank.tankType = snapshot.tankType();
        tank.status = snapshot.status();
        tank.optimalParameters = snapshot.optimalParameters();
        tank.lastMaintenanceDate = snapshot.lastMaintenanceDate();
        tank.nextMaintenanceDate = snapshot.nextMaintenanceDate();
        tank.createdAt = snapshot.createdAt();
        tank.updatedAt = snapshot.updatedAt();
        tank.version = snapshot.version();
        for (SensorSnapshot sensor : snapshot.sensors()) {
            tank.sensors.add(SensorEntity.fromSnapshot(sensor));
        }
        return tank;
    }

    public TankSnapshot toSnapshot() {
        List<SensorSnapshot> sensorSnapshots = new ArrayList<>(sensors.size());
        for (SensorEntity sensor : sensors) {
            sensorSnapshots.add(sensor.toSnapshot());
        }
        return new TankSnapshot(tankId, version, name, capacity, location, tankType, status, optimalParameters,
                lastMaintenanceDate, nextMaintenanceDate, createdAt, updatedAt, sensorSnapshots);
    }

    // ==================== 鱼池命令 ====================

    public List<TankEvent> rename(String newName) {
        requireName(newName);
        String trimmed = newName.trim();
        if (trimmed.equals(name)) {
            return Collections.emptyList();
        }
        return raise(new TankNameChanged(UUID.randomUUID(), tankId, LocalDateTime.now(), name, trimmed));
    }

    public List<TankEvent> changeCapacity(TankCapacity newCapacity) {
        if (newCapacity == null) {
            throw new ValidationException("Tank capacity cannot be null");
        }
        if (newCapacity.equals(capacity)) {
            return Collections.emptyList();
        }
        return raise(new TankCapacityChanged(UUID.randomUUID(), tankId, LocalDateTime.now(), capacity, newCapacity));
    }

    public List<TankEvent> relocate(Location newLocation) {
        if (newLocation == null) {
            throw new ValidationException("Tank location cannot be null");
        }
        if (newLocation.equals(location)) {
            return Collections.emptyList();
        }
        return raise(new TankRelocated(UUID.randomUUID(), tankId, LocalDateTime.now(), location, newLocation));
    }

    public List<TankEvent> activate() {
        if (status == TankStatusEnum.ACTIVE) {
            return Collections.emptyList();
        }
        if (activeSensorCount() == 0) {
            throw new InvariantViolationException("Tank must have at least one active sensor to be activated");
        }
        return raise(new TankActivated(UUID.randomUUID(), tankId, LocalDateTime.now()));
    }

    public List<TankEvent> deactivate(String reason) {
        if (status == TankStatusEnum.INACTIVE) {
            return Collections.emptyList();
        }
        return raise(new TankDeactivated(UUID.randomUUID(), tankId, LocalDateTime.now(), reason));
    }

    public List<TankEvent> setOptimalParameters(WaterQualityParameters parameters) {
        if (parameters == null) {
            throw new ValidationException("Optimal parameters cannot be null");
        }
        if (parameters.equals(optimalParameters)) {
            return Collections.emptyList();
        }
        return raise(new TankOptimalParametersSet(UUID.randomUUID(), tankId, LocalDateTime.now(), parameters));
    }

    public List<TankEvent> scheduleMaintenance(LocalDateTime scheduledDate) {
        LocalDateTime now = LocalDateTime.now();
        if (scheduledDate == null || !scheduledDate.isAfter(now)) {
            throw new ValidationException("Maintenance date must be in the future");
        }
        if (scheduledDate.equals(nextMaintenanceDate)) {
            return Collections.emptyList();
        }
        return raise(new TankMaintenanceScheduled(UUID.randomUUID(), tankId, now, scheduledDate));
    }

    public List<TankEvent> completeMaintenance(LocalDateTime completionDate, String notes) {
        LocalDateTime now = LocalDateTime.now();
        if (completionDate == null || completionDate.isAfter(now)) {
            throw new ValidationException("Completion date cannot be in the future");
        }
        return raise(new TankMaintenanceCompleted(UUID.randomUUID(), tankId, now, completionDate, notes));
    }

    // ==================== 传感器命令 ====================

    public List<TankEvent> addSensor(SensorEntity sensor) {
        if (sensor == null) {
            throw new ValidationException("Sensor cannot be null");
        }
        if (findSensorEntity(sensor.getSensorId()).isPresent()) {
            throw new InvariantViolationException("Sensor " + sensor.getSensorId() + " already exists in tank");
        }
        if (sensors.size() >= Constants.MAX_SENSORS_PER_TANK) {
            throw new InvariantViolationException(
                    "Tank cannot have more than " + Constants.MAX_SENSORS_PER_TANK + " sensors");
        }
        return raise(new SensorAddedToTank(UUID.randomUUID(), tankId, LocalDateTime.now(), sensor.toSnapshot()));
    }

    public List<TankEvent> removeSensor(SensorId sensorId) {
        SensorEntity sensor = requireSensor(sensorId);
        if (status == TankStatusEnum.ACTIVE && sensor.isActive() && activeSensorCount() == 1) {
            throw new InvariantViolationException("Cannot remove the last active sensor from an active tank");
        }
        return raise(new SensorRemovedFromTank(UUID.randomUUID(), tankId, LocalDateTime.now(),
                sensorId, sensor.getSensorType()));
    }

    public List<TankEvent> calibrateSensor(SensorId sensorId, LocalDateTime calibrationDate,
                                           BigDecimal accuracy, String notes) {
        SensorEntity sensor = requireSensor(sensorId);
        LocalDateTime now = LocalDateTime.now();
        if (calibrationDate == null || calibrationDate.isAfter(now)) {
            throw new ValidationException("Calibration date cannot be in the future");
        }
        SensorEntity.validateAccuracy(accuracy);
        return raise(new SensorCalibrated(UUID.randomUUID(), tankId, now, sensorId, calibrationDate,
                sensor.nextCalibrationDateFrom(calibrationDate), accuracy, notes));
    }

    public List<TankEvent> updateSensorRange(SensorId sensorId, BigDecimal minValue, BigDecimal maxValue) {
        SensorEntity sensor = requireSensor(sensorId);
        SensorEntity.validateRange(minValue, maxValue);
        if (sensor.hasRange(minValue, maxValue)) {
            return Collections.emptyList();
        }
        return raise(new SensorRangeUpdated(UUID.randomUUID(), tankId, LocalDateTime.now(),
                sensorId, minValue, maxValue));
    }

    public List<TankEvent> activateSensor(SensorId sensorId) {
        SensorEntity sensor = requireSensor(sensorId);
        if (sensor.isActive()) {
            return Collections.emptyList();
        }
        return raise(new SensorActivated(UUID.randomUUID(), tankId, LocalDateTime.now(), sensorId));
    }

    public List<TankEvent> deactivateSensor(SensorId sensorId, String reason) {
        SensorEntity sensor = requireSensor(sensorId);
        if (!sensor.isActive()) {
            return Collections.emptyList();
        }
        return raise(new SensorDeactivated(UUID.randomUUID(), tankId, LocalDateTime.now(), sensorId, reason));
    }

    public List<TankEvent> changeSensorStatus(SensorId sensorId, SensorStatusEnum newStatus) {
        SensorEntity sensor = requireSensor(sensorId);
        if (newStatus == null) {
            throw new ValidationException("Sensor status cannot be null");
        }
        if (sensor.getStatus() == newStatus) {
            return Collections.emptyList();
        }
        return raise(new SensorStatusChanged(UUID.randomUUID(), tankId, LocalDateTime.now(),
                sensorId, sensor.getStatus(), newStatus));
    }

    // ==================== 状态迁移 ====================

    /**
     * 唯一的状态变更入口，命令与回放共用。
     * <p>
     * 事件携带的都是变更后的完整取值，这里不做任何校验；无法识别的事件记录告警后跳过，版本号照常递增。
     * </p>
     */
    private void apply(TankEvent event) {
        if (tankId == null) {
            tankId = event.tankId();
        }
        if (event instanceof TankCreated e) {
            name = e.name();
            capacity = e.capacity();
            location = e.location();
            tankType = e.tankType();
            status = TankStatusEnum.INACTIVE;
            createdAt = e.occurredAt();
        } else if (event instanceof TankNameChanged e) {
            name = e.newName();
        } else if (event instanceof TankCapacityChanged e) {
            capacity = e.newCapacity();
        } else if (event instanceof TankRelocated e) {
            location = e.newLocation();
        } else if (event instanceof TankActivated) {
            status = TankStatusEnum.ACTIVE;
        } else if (event instanceof TankDeactivated) {
            status = TankStatusEnum.INACTIVE;
        } else if (event instanceof TankOptimalParametersSet e) {
            optimalParameters = e.parameters();
        } else if (event instanceof TankMaintenanceScheduled e) {
            nextMaintenanceDate = e.scheduledDate();
        } else if (event instanceof TankMaintenanceCompleted e) {
            lastMaintenanceDate = e.completionDate();
            nextMaintenanceDate = null;
        } else if (event instanceof SensorAddedToTank e) {
            // 幂等：重复的添加事件不改变状态
            if (findSensorEntity(e.sensor().sensorId()).isEmpty()) {
                sensors.add(SensorEntity.fromSnapshot(e.sensor()));
            }
        } else if (event instanceof SensorRemovedFromTank e) {
            sensors.removeIf(s -> s.getSensorId().equals(e.sensorId()));
        } else if (event instanceof SensorCalibrated e) {
            findSensorEntity(e.sensorId()).ifPresent(s -> s.applyCalibrated(
                    e.calibrationDate(), e.nextCalibrationDate(), e.accuracy(), e.notes()));
        } else if (event instanceof SensorRangeUpdated e) {
            findSensorEntity(e.sensorId()).ifPresent(s -> s.applyRange(e.minValue(), e.maxValue()));
        } else if (event instanceof SensorActivated e) {
            findSensorEntity(e.sensorId()).ifPresent(SensorEntity::applyActivated);
        } else if (event instanceof SensorDeactivated e) {
            findSensorEntity(e.sensorId()).ifPresent(s -> s.applyDeactivated(e.reason()));
        } else if (event instanceof SensorStatusChanged e) {
            findSensorEntity(e.sensorId()).ifPresent(s -> s.applyStatus(e.newStatus()));
        } else if (event instanceof UnknownTankEvent e) {
            log.warn("Skip unknown tank event. tankId={}, eventId={}, typeTag={}, version={}",
                    tankId, e.eventId(), e.typeTag(), version + 1);
        } else {
            throw new IllegalStateException("Unhandled tank event: " + event.getClass().getName());
        }
        if (!(event instanceof UnknownTankEvent) && event.occurredAt() != null) {
            updatedAt = event.occurredAt();
        }
        version++;
    }

    private List<TankEvent> raise(TankEvent event) {
        apply(event);
        pendingEvents.add(event);
        return List.of(event);
    }

    // ==================== 待提交事件 ====================

    public List<TankEvent> getPendingEvents() {
        return Collections.unmodifiableList(new ArrayList<>(pendingEvents));
    }

    public boolean hasPendingEvents() {
        return !pendingEvents.isEmpty();
    }

    /**
     * 存储中的版本，即追加待提交事件时的期望版本。
     */
    public long getPersistedVersion() {
        return version - pendingEvents.size();
    }

    public void markEventsCommitted() {
        pendingEvents.clear();
    }

    // ==================== 查询 ====================

    /**
     * 传感器的只读副本，对副本的修改不会影响聚合。
     */
    public List<SensorEntity> getSensors() {
        List<SensorEntity> copies = new ArrayList<>(sensors.size());
        for (SensorEntity sensor : sensors) {
            copies.add(SensorEntity.fromSnapshot(sensor.toSnapshot()));
        }
        return Collections.unmodifiableList(copies);
    }

    public Optional<SensorEntity> findSensor(SensorId sensorId) {
        return findSensorEntity(sensorId).map(s -> SensorEntity.fromSnapshot(s.toSnapshot()));
    }

    public List<SensorEntity> getActiveSensors() {
        List<SensorEntity> active = new ArrayList<>();
        for (SensorEntity sensor : getSensors()) {
            if (sensor.isActive()) {
                active.add(sensor);
            }
        }
        return Collections.unmodifiableList(active);
    }

    public int getSensorCount() {
        return sensors.size();
    }

    public boolean hasActiveSensorOfType(SensorTypeEnum sensorType) {
        for (SensorEntity sensor : sensors) {
            if (sensor.isActive() && sensor.getSensorType() == sensorType) {
                return true;
            }
        }
        return false;
    }

    public boolean isActive() {
        return status == TankStatusEnum.ACTIVE;
    }

    public boolean isMaintenanceDue(LocalDateTime now) {
        return nextMaintenanceDate != null && !nextMaintenanceDate.isAfter(now);
    }

    public Optional<Duration> timeSinceLastMaintenance(LocalDateTime now) {
        if (lastMaintenanceDate == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(lastMaintenanceDate, now));
    }

    private Optional<SensorEntity> findSensorEntity(SensorId sensorId) {
        if (sensorId == null) {
            return Optional.empty();
        }
        for (SensorEntity sensor : sensors) {
            if (Objects.equals(sensor.getSensorId(), sensorId)) {
                return Optional.of(sensor);
            }
        }
        return Optional.empty();
    }

    private SensorEntity requireSensor(SensorId sensorId) {
        if (sensorId == null) {
            throw new ValidationException("Sensor id cannot be null");
        }
        return findSensorEntity(sensorId)
                .orElseThrow(() -> new ValidationException("Sensor " + sensorId + " not found in tank"));
    }

    private long activeSensorCount() {
        long count = 0;
        for (SensorEntity sensor : sensors) {
            if (sensor.isActive()) {
                count++;
            }
        }
        return count;
    }

    private static void requireName(String name) {
        if (StringUtils.isBlank(name)) {
            throw new ValidationException("Tank name cannot be empty");
        }
    }

    @Override
    public String toString() {
        return "TankAggregate{tankId=" + tankId + ", name=" + name + ", status=" + status
                + ", version=" + version + ", sensors=" + sensors.size() + "}";
    }
}
