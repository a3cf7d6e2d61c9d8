package com.aquacontrol.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 传感器运行状态枚举
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
public enum SensorStatusEnum {

    /**
     * 在线 - 正常上报读数
     */
    ONLINE("online"),

    /**
     * 离线 - 停用或失联
     */
    OFFLINE("offline"),

    /**
     * 校准中
     */
    CALIBRATING("calibrating"),

    /**
     * 故障
     */
    ERROR("error"),

    /**
     * 维护中
     */
    MAINTENANCE("maintenance");

    private final String code;

    SensorStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static SensorStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SensorStatusEnum status : SensorStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown sensor status code: " + code);
    }
}
