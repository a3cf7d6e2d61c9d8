package com.aquacontrol.domain.tank.model.valobj;

import com.aquacontrol.types.enums.SensorStatusEnum;
import com.aquacontrol.types.enums.SensorTypeEnum;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 传感器完整状态快照，用于添加传感器事件与聚合快照。
 */
public record SensorSnapshot(SensorId sensorId,
                             SensorTypeEnum sensorType,
                             String model,
                             String manufacturer,
                             String serialNumber,
                             BigDecimal accuracy,
                             BigDecimal minValue,
                             BigDecimal maxValue,
                             LocalDateTime installationDate,
                             LocalDateTime calibrationDate,
                             LocalDateTime nextCalibrationDate,
                             boolean active,
                             SensorStatusEnum status,
                             String notes) {
}
