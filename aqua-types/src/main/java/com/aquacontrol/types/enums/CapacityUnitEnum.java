package com.aquacontrol.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 容量单位枚举。
 */
public enum CapacityUnitEnum {

    L("L"),
    ML("ML"),
    GAL("GAL");

    private final String code;

    CapacityUnitEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 按单位代码解析，大小写不敏感。
     */
    public static CapacityUnitEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (CapacityUnitEnum unit : CapacityUnitEnum.values()) {
            if (unit.code.equalsIgnoreCase(code.trim())) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown capacity unit code: " + code);
    }
}
