package com.aquacontrol.test.trigger;

import com.aquacontrol.domain.tank.model.event.TankEvent;
import com.aquacontrol.test.support.TankFixtures;
import com.aquacontrol.trigger.event.TankEventPublisher;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class TankEventPublisherTest {

    @Test
    public void shouldDeliverToAllSubscribersDespiteFailure() {
        TankEventPublisher publisher = new TankEventPublisher();
        List<TankEvent> received = new ArrayList<>();
        publisher.subscribe("broken", event -> {
            throw new IllegalStateException("subscriber down");
        });
        publisher.subscribe("audit", received::add);
        TankEvent event = TankFixtures.newTank("Tank A").getPendingEvents().get(0);

        Assertions.assertDoesNotThrow(() -> publisher.publish(event));
        Assertions.assertEquals(List.of(event), received);
    }

    @Test
    public void shouldStopDeliveringAfterUnsubscribe() {
        TankEventPublisher publisher = new TankEventPublisher();
        List<TankEvent> received = new ArrayList<>();
        publisher.subscribe("audit", received::add);
        publisher.subscribe(null, received::add);
        Assertions.assertEquals(1, publisher.subscriberCount());

        publisher.unsubscribe("audit");
        publisher.publish(TankFixtures.newTank("Tank A").getPendingEvents().get(0));

        Assertions.assertEquals(0, publisher.subscriberCount());
        Assertions.assertTrue(received.isEmpty());
    }
}
