package com.aquacontrol.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 鱼池事件 PO（tank_event 表）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TankEventPO {

    private Long id;
    private String eventId;
    private String aggregateId;
    private String aggregateType;
    private Long version;
    private String eventType;
    private String payload;
    private LocalDateTime occurredAt;
    private LocalDateTime createdAt;
}
