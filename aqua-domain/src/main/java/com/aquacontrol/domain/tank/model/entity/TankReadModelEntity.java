package com.aquacontrol.domain.tank.model.entity;

import com.aquacontrol.domain.tank.model.aggregate.TankAggregate;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 鱼池读模型实体（列表、搜索用的扁平投影）
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
@Data
public class TankReadModelEntity {

    /**
     * 鱼池 ID
     */
    private String tankId;

    /**
     * 名称
     */
    private String name;

    /**
     * 容量数值
     */
    private BigDecimal capacityValue;

    /**
     * 容量单位编码
     */
    private String capacityUnit;

    private String building;

    private String room;

    private String zone;

    private BigDecimal latitude;

    private BigDecimal longitude;

    /**
     * 鱼池类型编码
     */
    private String tankType;

    /**
     * 状态编码
     */
    private String status;

    /**
     * 传感器总数
     */
    private Integer sensorCount;

    /**
     * 启用的传感器数
     */
    private Integer activeSensorCount;

    private LocalDateTime lastMaintenanceDate;

    private LocalDateTime nextMaintenanceDate;

    /**
     * 投影对应的聚合版本
     */
    private Long version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 由聚合当前状态生成投影
     */
    public static TankReadModelEntity from(TankAggregate tank) {
        TankReadModelEntity entity = new TankReadModelEntity();
        entity.setTankId(tank.getTankId().toString());
        entity.setName(tank.getName());
        if (tank.getCapacity() != null) {
            entity.setCapacityValue(tank.getCapacity().value());
            entity.setCapacityUnit(tank.getCapacity().unit().getCode());
        }
        if (tank.getLocation() != null) {
            entity.setBuilding(tank.getLocation().building());
            entity.setRoom(tank.getLocation().room());
            entity.setZone(tank.getLocation().zone());
            entity.setLatitude(tank.getLocation().latitude());
            entity.setLongitude(tank.getLocation().longitude());
        }
        entity.setTankType(tank.getTankType() == null ? null : tank.getTankType().getCode());
        entity.setStatus(tank.getStatus() == null ? null : tank.getStatus().getCode());
        entity.setSensorCount(tank.getSensorCount());
        entity.setActiveSensorCount(tank.getActiveSensors().size());
        entity.setLastMaintenanceDate(tank.getLastMaintenanceDate());
        entity.setNextMaintenanceDate(tank.getNextMaintenanceDate());
        entity.setVersion(tank.getVersion());
        entity.setCreatedAt(tank.getCreatedAt());
        entity.setUpdatedAt(tank.getUpdatedAt());
        return entity;
    }
}
