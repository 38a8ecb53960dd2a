package com.hubbridge.plugin.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory typed pub/sub bus for {@link BridgeEvent}s.
 * <p>
 * Subscribers register for one event type; delivery is synchronous on the publishing thread and
 * in subscription order. A subscriber that throws is logged and does not stop delivery to the others.
 */
public final class BridgeEventBus {

    private static final Logger log = LoggerFactory.getLogger(BridgeEventBus.class);

    private final Map<Class<? extends BridgeEvent>, List<Consumer<? super BridgeEvent>>> subscribers =
            new ConcurrentHashMap<>();

    /**
     * Subscribe to one kind of event.
     *
     * @param type     event record class, e.g. {@code BridgeEvent.Shutdown.class}
     * @param consumer callback invoked for each published event of that type
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public <E extends BridgeEvent> Subscription subscribe(Class<E> type, Consumer<? super E> consumer) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(consumer, "consumer");
        Consumer<? super BridgeEvent> adapter = event -> consumer.accept(type.cast(event));
        subscribers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(adapter);
        log.debug("Subscribed to {}", type.getSimpleName());
        return () -> {
            List<Consumer<? super BridgeEvent>> subs = subscribers.get(type);
            if (subs != null) {
                subs.remove(adapter);
            }
        };
    }

    /**
     * Publish an event to every subscriber of its type.
     *
     * @return number of subscribers the event was delivered to
     */
    public int publish(BridgeEvent event) {
        Objects.requireNonNull(event, "event");
        List<Consumer<? super BridgeEvent>> subs = subscribers.get(event.getClass());
        log.debug("Publishing {}", event);
        if (subs == null || subs.isEmpty()) {
            return 0;
        }
        for (Consumer<? super BridgeEvent> subscriber : subs) {
            deliverSafely(subscriber, event);
        }
        return subs.size();
    }

    /** Number of subscribers for an event type. */
    public int subscriberCount(Class<? extends BridgeEvent> type) {
        List<Consumer<? super BridgeEvent>> subs = subscribers.get(type);
        return subs != null ? subs.size() : 0;
    }

    /** Removes every subscription. */
    public void clear() {
        subscribers.clear();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<? super BridgeEvent> subscriber, BridgeEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {}: {}",
                    event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
