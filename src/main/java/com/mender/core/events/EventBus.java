package com.mender.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub for mission lifecycle, fix and analytics events.
 * <p>
 * Delivery is synchronous on the publishing thread. A subscriber that throws is
 * logged and does not affect the others or the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** A registered consumer; {@code missionKey} is null for subscribers to every event. */
    private record Subscriber(String missionKey, Consumer<MenderEvent> consumer) {

        boolean accepts(MenderEvent event) {
            return missionKey == null || missionKey.equals(event.missionKey());
        }
    }

    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    public void publish(MenderEvent event) {
        log.debug("Publishing {} for mission {}", event.eventType(), event.missionKey());
        for (Subscriber subscriber : subscribers) {
            if (subscriber.accepts(event)) {
                deliver(subscriber, event);
            }
        }
    }

    /**
     * Receive only the events of one mission.
     */
    public Subscription subscribe(String missionKey, Consumer<MenderEvent> consumer) {
        if (missionKey == null) {
            throw new IllegalArgumentException("missionKey is required; use subscribeAll for every event");
        }
        return register(new Subscriber(missionKey, consumer));
    }

    /**
     * Receive every event, including those not tied to a mission.
     */
    public Subscription subscribeAll(Consumer<MenderEvent> consumer) {
        return register(new Subscriber(null, consumer));
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private Subscription register(Subscriber subscriber) {
        subscribers.add(subscriber);
        log.debug("Subscribed to {}", subscriber.missionKey() != null ? subscriber.missionKey() : "all events");
        return () -> subscribers.remove(subscriber);
    }

    private void deliver(Subscriber subscriber, MenderEvent event) {
        try {
            subscriber.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
