package com.aquacontrol.domain.tank.model.valobj;

import com.aquacontrol.types.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * 鱼池物理位置值对象。
 * <p>
 * 楼栋、房间必填；经纬度可选但必须在合法范围内。文本字段的相等性忽略大小写，
 * 缺省分区与空白分区视为相同。
 * </p>
 */
public record Location(String building,
                       String room,
                       String zone,
                       BigDecimal latitude,
                       BigDecimal longitude) {

    private static final BigDecimal MAX_LATITUDE = BigDecimal.valueOf(90);
    private static final BigDecimal MAX_LONGITUDE = BigDecimal.valueOf(180);
    private static final double EARTH_RADIUS_KM = 6371D;

    public Location {
        if (StringUtils.isBlank(building)) {
            throw new ValidationException("Building cannot be empty");
        }
        if (StringUtils.isBlank(room)) {
            throw new ValidationException("Room cannot be empty");
        }
        if (latitude != null && latitude.abs().compareTo(MAX_LATITUDE) > 0) {
            throw new ValidationException("Latitude must be between -90 and 90");
        }
        if (longitude != null && longitude.abs().compareTo(MAX_LONGITUDE) > 0) {
            throw new ValidationException("Longitude must be between -180 and 180");
        }
    }

    public static Location of(String building, String room) {
        return new Location(building, room, null, null, null);
    }

    public static Location of(String building, String room, String zone) {
        return new Location(building, room, zone, null, null);
    }

    /**
     * 拼接完整地址：楼栋, 房间[, 分区]。
     */
    public String fullAddress() {
        List<String> parts = new ArrayList<>();
        parts.add(building);
        parts.add(room);
        if (StringUtils.isNotBlank(zone)) {
            parts.add(zone);
        }
        return String.join(", ", parts);
    }

    /**
     * 计算两点间的球面距离（米），任一方缺少坐标时返回空。
     */
    public Optional<Double> distanceMetersTo(Location other) {
        if (other == null || latitude == null || longitude == null
                || other.latitude == null || other.longitude == null) {
            return Optional.empty();
        }
        double lat1 = Math.toRadians(latitude.doubleValue());
        double lat2 = Math.toRadians(other.latitude.doubleValue());
        double deltaLat = Math.toRadians(other.latitude.doubleValue() - latitude.doubleValue());
        double deltaLon = Math.toRadians(other.longitude.doubleValue() - longitude.doubleValue());
        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return Optional.of(EARTH_RADIUS_KM * c * 1000D);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Location other)) {
            return false;
        }
        return normalize(building).equals(normalize(other.building))
                && normalize(room).equals(normalize(other.room))
                && normalize(zone).equals(normalize(other.zone))
                && sameNumber(latitude, other.latitude)
                && sameNumber(longitude, other.longitude);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalize(building), normalize(room), normalize(zone),
                latitude == null ? null : latitude.stripTrailingZeros(),
                longitude == null ? null : longitude.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return fullAddress();
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().toUpperCase(Locale.ROOT);
    }

    private static boolean sameNumber(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return left == right;
        }
        return left.compareTo(right) == 0;
    }
}
