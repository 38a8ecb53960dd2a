package com.hubbridge.plugin.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BridgeEventBusTest {

    @Test
    void publish_deliversOnlyToSubscribersOfThatType() {
        BridgeEventBus bus = new BridgeEventBus();
        List<String> received = new ArrayList<>();
        bus.subscribe(BridgeEvent.Shutdown.class, e -> received.add("shutdown:" + e.reason()));
        bus.subscribe(BridgeEvent.Restart.class, e -> received.add("restart:" + e.reason()));

        int delivered = bus.publish(new BridgeEvent.Shutdown("bye"));

        assertEquals(1, delivered);
        assertEquals(List.of("shutdown:bye"), received);
    }

    @Test
    void publish_continuesAfterFailingSubscriber() {
        BridgeEventBus bus = new BridgeEventBus();
        List<String> received = new ArrayList<>();
        bus.subscribe(BridgeEvent.StartDynamicPlatform.class, e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(BridgeEvent.StartDynamicPlatform.class, e -> received.add(e.pluginName()));

        bus.publish(new BridgeEvent.StartDynamicPlatform("plugin-a"));

        assertEquals(List.of("plugin-a"), received);
    }

    @Test
    void unsubscribe_stopsDelivery() {
        BridgeEventBus bus = new BridgeEventBus();
        List<BridgeEvent> received = new ArrayList<>();
        BridgeEventBus.Subscription subscription = bus.subscribe(BridgeEvent.Update.class, received::add);

        subscription.unsubscribe();
        bus.publish(new BridgeEvent.Update("updating..."));

        assertEquals(0, received.size());
        assertEquals(0, bus.subscriberCount(BridgeEvent.Update.class));
    }
}
