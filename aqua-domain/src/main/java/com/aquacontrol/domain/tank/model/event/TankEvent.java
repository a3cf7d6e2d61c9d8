package com.aquacontrol.domain.tank.model.event;

import com.aquacontrol.domain.tank.model.valobj.Location;
import com.aquacontrol.domain.tank.model.valobj.SensorId;
import com.aquacontrol.domain.tank.model.valobj.SensorSnapshot;
import com.aquacontrol.domain.tank.model.valobj.TankCapacity;
import com.aquacontrol.domain.tank.model.valobj.TankId;
import com.aquacontrol.domain.tank.model.valobj.WaterQualityParameters;
import com.aquacontrol.types.enums.SensorStatusEnum;
import com.aquacontrol.types.enums.SensorTypeEnum;
import com.aquacontrol.types.enums.TankEventTypeEnum;
import com.aquacontrol.types.enums.TankTypeEnum;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 鱼池领域事件。
 * <p>
 * 封闭的事件集合，每种状态迁移对应一个不可变记录，记录中携带重建状态所需的完整“变更后”取值，
 * 回放时无需读取聚合之前的状态。{@link UnknownTankEvent} 承载日志中无法识别的类型标签，
 * 使较新生产者写入的事件不会阻断回放。
 * </p>
 */
public sealed interface TankEvent {

    UUID eventId();

    TankId tankId();

    LocalDateTime occurredAt();

    /**
     * 事件日志中的类型标签。
     */
    String eventName();

    record TankCreated(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                       String name, TankCapacity capacity, Location location,
                       TankTypeEnum tankType) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.TANK_CREATED.getEventName();
        }
    }

    record TankNameChanged(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                           String oldName, String newName) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.TANK_NAME_CHANGED.getEventName();
        }
    }

    record TankCapacityChanged(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                               TankCapacity oldCapacity, TankCapacity newCapacity) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.TANK_CAPACITY_CHANGED.getEventName();
        }
    }

    record TankRelocated(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                         Location oldLocation, Location newLocation) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.TANK_RELOCATED.getEventName();
        }
    }

    record TankActivated(UUID eventId, TankId tankId, LocalDateTime occurredAt) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.TANK_ACTIVATED.getEventName();
        }
    }

    record TankDeactivated(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                           String reason) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.TANK_DEACTIVATED.getEventName();
        }
    }

    record TankOptimalParametersSet(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                                    WaterQualityParameters parameters) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.TANK_OPTIMAL_PARAMETERS_SET.getEventName();
        }
    }

    record TankMaintenanceScheduled(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                                    LocalDateTime scheduledDate) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.TANK_MAINTENANCE_SCHEDULED.getEventName();
        }
    }

    record TankMaintenanceCompleted(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                                    LocalDateTime completionDate, String notes) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.TANK_MAINTENANCE_COMPLETED.getEventName();
        }
    }

    record SensorAddedToTank(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                             SensorSnapshot sensor) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.SENSOR_ADDED_TO_TANK.getEventName();
        }
    }

    record SensorRemovedFromTank(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                                 SensorId sensorId, SensorTypeEnum sensorType) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.SENSOR_REMOVED_FROM_TANK.getEventName();
        }
    }

    record SensorCalibrated(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                            SensorId sensorId, LocalDateTime calibrationDate,
                            LocalDateTime nextCalibrationDate, BigDecimal accuracy,
                            String notes) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.SENSOR_CALIBRATED.getEventName();
        }
    }

    record SensorRangeUpdated(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                              SensorId sensorId, BigDecimal minValue, BigDecimal maxValue) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.SENSOR_RANGE_UPDATED.getEventName();
        }
    }

    record SensorActivated(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                           SensorId sensorId) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.SENSOR_ACTIVATED.getEventName();
        }
    }

    record SensorDeactivated(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                             SensorId sensorId, String reason) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.SENSOR_DEACTIVATED.getEventName();
        }
    }

    record SensorStatusChanged(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                               SensorId sensorId, SensorStatusEnum oldStatus,
                               SensorStatusEnum newStatus) implements TankEvent {
        @Override
        public String eventName() {
            return TankEventTypeEnum.SENSOR_STATUS_CHANGED.getEventName();
        }
    }

    /**
     * 日志中无法识别类型标签的事件，保留原始标签与载荷。
     */
    record UnknownTankEvent(UUID eventId, TankId tankId, LocalDateTime occurredAt,
                            String typeTag, String payload) implements TankEvent {
        @Override
        public String eventName() {
            return typeTag;
        }
    }
}
