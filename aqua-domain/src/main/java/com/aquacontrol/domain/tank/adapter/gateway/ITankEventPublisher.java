package com.aquacontrol.domain.tank.adapter.gateway;

import com.aquacontrol.domain.tank.model.event.TankEvent;

/**
 * 鱼池领域事件发布端口。
 */
public interface ITankEventPublisher {

    void publish(TankEvent event);
}
