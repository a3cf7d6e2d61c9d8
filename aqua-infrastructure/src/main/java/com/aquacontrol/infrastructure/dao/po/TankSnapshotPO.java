package com.aquacontrol.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 鱼池快照 PO（tank_snapshot 表，每个聚合一行）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TankSnapshotPO {

    private String aggregateId;
    private String aggregateType;
    private Long version;
    private String payload;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
