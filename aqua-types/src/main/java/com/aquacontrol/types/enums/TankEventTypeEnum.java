package com.aquacontrol.types.enums;

/**
 * 鱼池事件类型（事件日志中的类型标签）。
 */
public enum TankEventTypeEnum {

    TANK_CREATED("TankCreated"),
    TANK_NAME_CHANGED("TankNameChanged"),
    TANK_CAPACITY_CHANGED("TankCapacityChanged"),
    TANK_RELOCATED("TankRelocated"),
    TANK_ACTIVATED("TankActivated"),
    TANK_DEACTIVATED("TankDeactivated"),
    TANK_OPTIMAL_PARAMETERS_SET("TankOptimalParametersSet"),
    TANK_MAINTENANCE_SCHEDULED("TankMaintenanceScheduled"),
    TANK_MAINTENANCE_COMPLETED("TankMaintenanceCompleted"),
    SENSOR_ADDED_TO_TANK("SensorAddedToTank"),
    SENSOR_REMOVED_FROM_TANK("SensorRemovedFromTank"),
    SENSOR_CALIBRATED("SensorCalibrated"),
    SENSOR_RANGE_UPDATED("SensorRangeUpdated"),
    SENSOR_ACTIVATED("SensorActivated"),
    SENSOR_DEACTIVATED("SensorDeactivated"),
    SENSOR_STATUS_CHANGED("SensorStatusChanged");

    private final String eventName;

    TankEventTypeEnum(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    /**
     * 按事件名查找，未知标签返回 null（用于前向兼容）。
     */
    public static TankEventTypeEnum fromEventName(String eventName) {
        if (eventName == null) {
            return null;
        }
        for (TankEventTypeEnum type : TankEventTypeEnum.values()) {
            if (type.eventName.equals(eventName)) {
                return type;
            }
        }
        return null;
    }
}
