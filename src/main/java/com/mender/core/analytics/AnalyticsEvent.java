package com.mender.core.analytics;

import java.util.Map;

/**
 * A named analytics event with flat properties.
 */
public record AnalyticsEvent(String event, Map<String, Object> properties) {

    public static final String HEALING_COMPLETED = "autonomous_healing_completed";

    public AnalyticsEvent {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
}
