package com.aquacontrol.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 鱼池类型枚举
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
public enum TankTypeEnum {

    FRESHWATER("freshwater"),
    SALTWATER("saltwater"),
    BREEDING("breeding"),
    QUARANTINE("quarantine"),
    NURSERY("nursery"),
    GROW_OUT("grow_out"),
    BROODSTOCK("broodstock");

    private final String code;

    TankTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TankTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TankTypeEnum type : TankTypeEnum.values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown tank type code: " + code);
    }
}
