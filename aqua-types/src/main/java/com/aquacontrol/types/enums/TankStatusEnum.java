package com.aquacontrol.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 鱼池状态枚举
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
public enum TankStatusEnum {

    /**
     * 未启用 - 新建鱼池的初始状态
     */
    INACTIVE("inactive"),

    /**
     * 运行中 - 至少有一个在线传感器时才能进入
     */
    ACTIVE("active");

    private final String code;

    TankStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TankStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TankStatusEnum status : TankStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown tank status code: " + code);
    }
}
