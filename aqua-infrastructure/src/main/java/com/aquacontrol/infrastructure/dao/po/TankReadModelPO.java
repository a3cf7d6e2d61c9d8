package com.aquacontrol.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 鱼池读模型 PO（tank_read_model 表）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TankReadModelPO {

    private String tankId;
    private String name;
    private BigDecimal capacityValue;
    private String capacityUnit;
    private String building;
    private String room;
    private String zone;
    private BigDecimal latitude;
    private BigDecimal longitude;
    private String tankType;
    private String status;
    private Integer sensorCount;
    private Integer activeSensorCount;
    private LocalDateTime lastMaintenanceDate;
    private LocalDateTime nextMaintenanceDate;
    private Long version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
