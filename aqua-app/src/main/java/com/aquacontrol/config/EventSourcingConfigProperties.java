package com.aquacontrol.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 事件溯源配置属性，前缀 aqua.event-sourcing。
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
@Data
@ConfigurationProperties(prefix = "aqua.event-sourcing", ignoreInvalidFields = true)
public class EventSourcingConfigProperties {

    /** 单次加载回放的事件数达到该值时补写快照，默认10 */
    private Integer snapshotThreshold = 10;

}
