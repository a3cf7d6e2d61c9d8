package com.aquacontrol.domain.tank.model.valobj;

import com.aquacontrol.types.enums.CapacityUnitEnum;
import com.aquacontrol.types.exception.ValidationException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * 鱼池容量值对象。
 * <p>
 * 数值必须为正；相等性按数值大小（忽略精度位数）与单位判断。
 * </p>
 */
public record TankCapacity(BigDecimal value, CapacityUnitEnum unit) {

    private static final BigDecimal ML_PER_L = new BigDecimal("1000");
    private static final BigDecimal GAL_PER_L = new BigDecimal("0.264172");

    public TankCapacity {
        if (value == null || value.signum() <= 0) {
            throw new ValidationException("Tank capacity must be positive");
        }
        if (unit == null) {
            throw new ValidationException("Capacity unit cannot be null");
        }
    }

    public static TankCapacity of(BigDecimal value, CapacityUnitEnum unit) {
        return new TankCapacity(value, unit);
    }

    public static TankCapacity liters(long value) {
        return new TankCapacity(BigDecimal.valueOf(value), CapacityUnitEnum.L);
    }

    /**
     * 按单位代码构造，代码大小写不敏感，默认升。
     */
    public static TankCapacity parse(BigDecimal value, String unitCode) {
        if (unitCode == null || unitCode.isBlank()) {
            return new TankCapacity(value, CapacityUnitEnum.L);
        }
        try {
            return new TankCapacity(value, CapacityUnitEnum.fromCode(unitCode));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(ex.getMessage());
        }
    }

    /**
     * 换算为目标单位，返回新实例。
     */
    public TankCapacity convertTo(CapacityUnitEnum targetUnit) {
        if (targetUnit == null) {
            throw new ValidationException("Target unit cannot be null");
        }
        if (targetUnit == unit) {
            return this;
        }
        BigDecimal liters = toLiters();
        BigDecimal converted = switch (targetUnit) {
            case L -> liters;
            case ML -> liters.multiply(ML_PER_L);
            case GAL -> liters.multiply(GAL_PER_L);
        };
        return new TankCapacity(converted, targetUnit);
    }

    private BigDecimal toLiters() {
        return switch (unit) {
            case L -> value;
            case ML -> value.divide(ML_PER_L, MathContext.DECIMAL64);
            case GAL -> value.divide(GAL_PER_L, MathContext.DECIMAL64);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TankCapacity other)) {
            return false;
        }
        return unit == other.unit && value.compareTo(other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value.stripTrailingZeros(), unit);
    }

    @Override
    public String toString() {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString() + " " + unit.getCode();
    }
}
