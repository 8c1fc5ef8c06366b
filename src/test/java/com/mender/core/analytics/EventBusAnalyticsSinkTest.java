package com.mender.core.analytics;

import com.mender.core.events.EventBus;
import com.mender.core.events.MenderEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class EventBusAnalyticsSinkTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    @DisplayName("track republishes the event under the analytics prefix, keyed to the mission")
    void republishes() {
        var eventBus = new EventBus();
        List<MenderEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(received::add);
        var sink = new EventBusAnalyticsSink(eventBus, Clock.fixed(NOW, ZoneOffset.UTC));

        sink.track(new AnalyticsEvent(AnalyticsEvent.HEALING_COMPLETED, Map.of(
                "missionId", "a-1",
                "fixId", "fix_1_abc",
                "confidence", 96.0)));

        assertEquals(1, received.size());
        MenderEvent event = received.get(0);
        assertEquals("analytics.autonomous_healing_completed", event.eventType());
        assertEquals("healing_mission:a-1", event.missionKey());
        assertEquals("fix_1_abc", event.fixId());
        assertEquals(96.0, event.payload().get("confidence"));
        assertEquals(NOW, event.timestamp());
    }

    @Test
    @DisplayName("events without a mission id still reach global subscribers")
    void noMissionId() {
        var eventBus = new EventBus();
        List<MenderEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(received::add);
        var sink = new EventBusAnalyticsSink(eventBus, Clock.systemUTC());

        sink.track(new AnalyticsEvent("something_else", null));

        assertEquals(1, received.size());
        assertNull(received.get(0).missionKey());
        assertTrue(received.get(0).payload().isEmpty());
    }

    @Test
    @DisplayName("AnalyticsEvent rejects null property values")
    void rejectsNullValues() {
        var properties = new HashMap<String, Object>();
        properties.put("fixId", null);
        assertThrows(NullPointerException.class, () -> new AnalyticsEvent("x", properties));
    }
}
