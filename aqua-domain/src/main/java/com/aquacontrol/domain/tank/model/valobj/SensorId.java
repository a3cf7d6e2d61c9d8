package com.aquacontrol.domain.tank.model.valobj;

import com.aquacontrol.types.exception.ValidationException;

import java.util.UUID;

/**
 * 传感器标识，仅在所属鱼池内唯一有意义。
 */
public record SensorId(UUID value) {

    public SensorId {
        if (value == null) {
            throw new ValidationException("Sensor id cannot be null");
        }
    }

    public static SensorId of(UUID value) {
        return new SensorId(value);
    }

    public static SensorId of(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Sensor id cannot be empty");
        }
        try {
            return new SensorId(UUID.fromString(value.trim()));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Invalid sensor id: " + value);
        }
    }

    public static SensorId generate() {
        return new SensorId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
