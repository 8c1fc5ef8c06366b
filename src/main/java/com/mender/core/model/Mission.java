package com.mender.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;

/**
 * A unit of remediation work tied to one detected anomaly.
 * <p>
 * Records written by the detector may omit {@code status} (read as pending) and
 * {@code priority} (read as medium). A missing {@code createdAt} is filled in by
 * {@link com.mender.core.store.MissionStore} when the record is loaded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Mission(
    String key,
    String goal,
    MissionPriority priority,
    AnomalyRef anomaly,
    MissionStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) implements Serializable {

    public Mission {
        if (priority == null) priority = MissionPriority.MEDIUM;
        if (status == null) status = MissionStatus.PENDING;
    }

    public static Mission pending(String key, String goal, MissionPriority priority,
                                  AnomalyRef anomaly, Instant createdAt) {
        return new Mission(key, goal, priority, anomaly, MissionStatus.PENDING, createdAt, null, null);
    }

    public Mission withKey(String newKey) {
        return new Mission(newKey, goal, priority, anomaly, status, createdAt, startedAt, completedAt);
    }

    public Mission withCreatedAt(Instant created) {
        return new Mission(key, goal, priority, anomaly, status, created, startedAt, completedAt);
    }

    /**
     * Returns a pending copy of a mission interrupted mid-run, so it can be processed
     * again from analysis. {@code startedAt} is kept.
     *
     * @throws IllegalStateException if the mission is terminal
     */
    public Mission restarted() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Mission %s already %s".formatted(key, status.value()));
        }
        return new Mission(key, goal, priority, anomaly, MissionStatus.PENDING, createdAt, startedAt, null);
    }

    /**
     * Moves the mission to {@code next}, stamping {@code startedAt} when it first
     * leaves pending and {@code completedAt} when it reaches a terminal status.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public Mission transitionTo(MissionStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Mission %s cannot move from %s to %s".formatted(key, status.value(), next.value()));
        }
        Instant started = startedAt;
        if (started == null && status == MissionStatus.PENDING) {
            started = now;
        }
        Instant completed = next.isTerminal() ? now : completedAt;
        return new Mission(key, goal, priority, anomaly, next, createdAt, started, completed);
    }
}
