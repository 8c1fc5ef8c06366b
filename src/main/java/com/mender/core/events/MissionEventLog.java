package com.mender.core.events;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the most recent events of recently active missions so operators can see
 * how a mission progressed. Fed by a global {@link EventBus} subscription.
 * <p>
 * Bounded on both axes: at most {@link #MAX_EVENTS_PER_MISSION} events per mission,
 * and at most {@link #MAX_MISSIONS} missions, evicting the least recently updated.
 */
@Component
public class MissionEventLog {

    private static final Logger log = LoggerFactory.getLogger(MissionEventLog.class);

    static final int MAX_EVENTS_PER_MISSION = 50;
    static final int MAX_MISSIONS = 500;

    private final EventBus eventBus;
    private final Map<String, Deque<MenderEvent>> byMission =
            new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Deque<MenderEvent>> eldest) {
                    return size() > MAX_MISSIONS;
                }
            };
    private EventBus.Subscription subscription;

    public MissionEventLog(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    public void start() {
        subscription = eventBus.subscribeAll(this::record);
        log.debug("Mission event log subscribed");
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    /** Events without a mission key are ignored. */
    void record(MenderEvent event) {
        if (event.missionKey() == null) {
            return;
        }
        synchronized (byMission) {
            Deque<MenderEvent> events = byMission.computeIfAbsent(event.missionKey(), k -> new ArrayDeque<>());
            if (events.size() == MAX_EVENTS_PER_MISSION) {
                events.removeFirst();
            }
            events.addLast(event);
        }
    }

    /**
     * Recorded events for a mission, oldest first; empty when none are retained.
     */
    public List<MenderEvent> eventsFor(String missionKey) {
        synchronized (byMission) {
            Deque<MenderEvent> events = byMission.get(missionKey);
            return events == null ? List.of() : List.copyOf(events);
        }
    }
}
