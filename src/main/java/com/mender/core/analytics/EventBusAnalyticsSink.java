package com.mender.core.analytics;

import com.mender.core.events.EventBus;
import com.mender.core.events.MenderEvent;
import com.mender.core.store.MissionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Logs analytics events and republishes them on the {@link EventBus} as
 * {@code analytics.<event>}. The {@code missionId} property (the anomaly id)
 * is mapped back to the mission's store key so the event lands in that
 * mission's event log.
 */
@Component
public class EventBusAnalyticsSink implements AnalyticsSink {

    private static final Logger log = LoggerFactory.getLogger(EventBusAnalyticsSink.class);

    private final EventBus eventBus;
    private final Clock clock;

    public EventBusAnalyticsSink(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public void track(AnalyticsEvent event) {
        log.info("Analytics event {}: {}", event.event(), event.properties());
        Object missionId = event.properties().get("missionId");
        Object fixId = event.properties().get("fixId");
        eventBus.publish(new MenderEvent(
                "analytics." + event.event(),
                missionId != null ? MissionStore.missionKey(missionId.toString()) : null,
                fixId != null ? fixId.toString() : null,
                Map.copyOf(event.properties()),
                clock.instant()));
    }
}
