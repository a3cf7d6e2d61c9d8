package com.aquacontrol.domain.tank.model.valobj;

import com.aquacontrol.types.exception.ValidationException;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * 水质参数值对象：温度、pH、溶解氧、盐度的最优值与上下限。
 * <p>
 * 所有字段可选；同一指标的上下限同时存在时要求下限严格小于上限。
 * </p>
 */
@Builder
public record WaterQualityParameters(BigDecimal optimalTemperature,
                                     BigDecimal minTemperature,
                                     BigDecimal maxTemperature,
                                     BigDecimal optimalPh,
                                     BigDecimal minPh,
                                     BigDecimal maxPh,
                                     BigDecimal optimalOxygen,
                                     BigDecimal minOxygen,
                                     BigDecimal maxOxygen,
                                     BigDecimal optimalSalinity,
                                     BigDecimal minSalinity,
                                     BigDecimal maxSalinity) {

    public WaterQualityParameters {
        requireOrdered(minTemperature, maxTemperature, "Min temperature must be less than max temperature");
        requireOrdered(minPh, maxPh, "Min pH must be less than max pH");
        requireOrdered(minOxygen, maxOxygen, "Min oxygen must be less than max oxygen");
        requireOrdered(minSalinity, maxSalinity, "Min salinity must be less than max salinity");
    }

    public boolean isTemperatureInRange(BigDecimal temperature) {
        return withinBounds(temperature, minTemperature, maxTemperature);
    }

    public boolean isPhInRange(BigDecimal ph) {
        return withinBounds(ph, minPh, maxPh);
    }

    public boolean isOxygenSufficient(BigDecimal oxygen) {
        return minOxygen == null || (oxygen != null && oxygen.compareTo(minOxygen) >= 0);
    }

    public boolean isOxygenInRange(BigDecimal oxygen) {
        return withinBounds(oxygen, minOxygen, maxOxygen);
    }

    public boolean isSalinityInRange(BigDecimal salinity) {
        return withinBounds(salinity, minSalinity, maxSalinity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WaterQualityParameters other)) {
            return false;
        }
        List<BigDecimal> left = components();
        List<BigDecimal> right = other.components();
        for (int i = 0; i < left.size(); i++) {
            BigDecimal a = left.get(i);
            BigDecimal b = right.get(i);
            if (a == null || b == null) {
                if (a != b) {
                    return false;
                }
            } else if (a.compareTo(b) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(components().stream()
                .map(value -> value == null ? null : value.stripTrailingZeros())
                .toArray());
    }

    private List<BigDecimal> components() {
        return Arrays.asList(optimalTemperature, minTemperature, maxTemperature,
                optimalPh, minPh, maxPh,
                optimalOxygen, minOxygen, maxOxygen,
                optimalSalinity, minSalinity, maxSalinity);
    }

    private static void requireOrdered(BigDecimal min, BigDecimal max, String message) {
        if (min != null && max != null && min.compareTo(max) >= 0) {
            throw new ValidationException(message);
        }
    }

    private static boolean withinBounds(BigDecimal value, BigDecimal min, BigDecimal max) {
        if (value == null) {
            return false;
        }
        if (min != null && value.compareTo(min) < 0) {
            return false;
        }
        return max == null || value.compareTo(max) <= 0;
    }
}
