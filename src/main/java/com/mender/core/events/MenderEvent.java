package com.mender.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a mission is processed.
 *
 * @param eventType  event type (e.g. "mission.analyzing", "fix.applied", "analytics.autonomous_healing_completed")
 * @param missionKey store key of the mission this event belongs to
 * @param fixId      the fix this event relates to (nullable for mission-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record MenderEvent(
    String eventType,
    String missionKey,
    String fixId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
