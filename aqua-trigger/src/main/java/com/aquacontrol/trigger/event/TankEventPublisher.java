package com.aquacontrol.trigger.event;

import com.aquacontrol.domain.tank.adapter.gateway.ITankEventPublisher;
import com.aquacontrol.domain.tank.model.event.TankEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * 鱼池事件发布器：进程内按订阅者分发。
 * <p>
 * 单个订阅者抛出的异常只记录日志，不影响其它订阅者。
 * </p>
 */
@Slf4j
@Component
public class TankEventPublisher implements ITankEventPublisher {

    private final ConcurrentMap<String, Consumer<TankEvent>> subscribers = new ConcurrentHashMap<>();

    @Override
    public void publish(TankEvent event) {
        if (event == null || subscribers.isEmpty()) {
            return;
        }
        for (Map.Entry<String, Consumer<TankEvent>> entry : subscribers.entrySet()) {
            try {
                entry.getValue().accept(event);
            } catch (Exception ex) {
                log.warn("Tank event dispatch failed. subscriberId={}, tankId={}, eventId={}, eventType={}, error={}",
                        entry.getKey(), event.tankId(), event.eventId(), event.eventName(), ex.getMessage());
            }
        }
    }

    public void subscribe(String subscriberId, Consumer<TankEvent> consumer) {
        if (subscriberId == null || consumer == null) {
            return;
        }
        subscribers.put(subscriberId, consumer);
    }

    public void unsubscribe(String subscriberId) {
        if (subscriberId == null) {
            return;
        }
        subscribers.remove(subscriberId);
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
