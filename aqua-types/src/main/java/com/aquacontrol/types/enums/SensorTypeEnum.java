package com.aquacontrol.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 传感器类型枚举
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
public enum SensorTypeEnum {

    /** 水温（摄氏度） */
    TEMPERATURE("temperature"),

    /** 酸碱度 */
    PH("ph"),

    /** 溶解氧（mg/L） */
    DISSOLVED_OXYGEN("dissolved_oxygen"),

    /** 盐度（ppt） */
    SALINITY("salinity"),

    /** 浊度（NTU） */
    TURBIDITY("turbidity"),

    /** 氨氮（mg/L） */
    AMMONIA("ammonia"),

    /** 亚硝酸盐（mg/L） */
    NITRITE("nitrite"),

    /** 硝酸盐（mg/L） */
    NITRATE("nitrate"),

    /** 磷酸盐（mg/L） */
    PHOSPHATE("phosphate"),

    /** 碱度（mg/L CaCO3） */
    ALKALINITY("alkalinity");

    private final String code;

    SensorTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static SensorTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SensorTypeEnum type : SensorTypeEnum.values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown sensor type code: " + code);
    }
}
