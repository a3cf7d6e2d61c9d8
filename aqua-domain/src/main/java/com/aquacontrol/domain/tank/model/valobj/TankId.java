package com.aquacontrol.domain.tank.model.valobj;

import com.aquacontrol.types.exception.ValidationException;

import java.util.UUID;

/**
 * 鱼池聚合标识。
 * <p>
 * 只能通过显式工厂方法构造、通过 {@link #value()} 取值，不与裸 UUID 互相隐式转换，
 * 防止把传感器标识误传为鱼池标识。
 * </p>
 */
public record TankId(UUID value) {

    public TankId {
        if (value == null) {
            throw new ValidationException("Tank id cannot be null");
        }
    }

    public static TankId of(UUID value) {
        return new TankId(value);
    }

    public static TankId of(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Tank id cannot be empty");
        }
        try {
            return new TankId(UUID.fromString(value.trim()));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Invalid tank id: " + value);
        }
    }

    public static TankId generate() {
        return new TankId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
