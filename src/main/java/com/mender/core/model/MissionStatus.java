package com.mender.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a healing mission.
 * <p>
 * {@link #TESTING} is a named marker for downstream collaborators; the
 * orchestrator itself moves straight from {@link #FIXING} to a terminal state.
 */
public enum MissionStatus {
    PENDING("pending"),
    ANALYZING("analyzing"),
    FIXING("fixing"),
    TESTING("testing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    MissionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a mission in this status may move to {@code next}.
     * Any non-terminal status may fail.
     */
    public boolean canTransitionTo(MissionStatus next) {
        if (isTerminal()) return false;
        if (next == FAILED) return true;
        return allowedSuccessors().contains(next);
    }

    private Set<MissionStatus> allowedSuccessors() {
        return switch (this) {
            case PENDING -> EnumSet.of(ANALYZING);
            case ANALYZING -> EnumSet.of(FIXING, COMPLETED);
            case FIXING -> EnumSet.of(TESTING, COMPLETED);
            case TESTING -> EnumSet.of(COMPLETED);
            default -> EnumSet.noneOf(MissionStatus.class);
        };
    }

    @JsonCreator
    public static MissionStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        for (MissionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown mission status: " + value);
    }
}
