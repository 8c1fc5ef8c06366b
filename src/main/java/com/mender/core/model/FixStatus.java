package com.mender.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a synthesized fix.
 * <p>
 * Transitions only move forward, except for {@link #REVERTED}, which is
 * reachable from {@link #APPLIED} or {@link #TESTED}. {@code TESTED} and
 * {@code DEPLOYED} are set by downstream collaborators.
 */
public enum FixStatus {
    GENERATED,
    APPLIED,
    TESTED,
    DEPLOYED,
    REVERTED,
    FAILED;

    public boolean canTransitionTo(FixStatus next) {
        return switch (this) {
            case GENERATED -> next == APPLIED || next == FAILED;
            case APPLIED -> next == TESTED || next == DEPLOYED || next == REVERTED || next == FAILED;
            case TESTED -> next == DEPLOYED || next == REVERTED || next == FAILED;
            case DEPLOYED, REVERTED, FAILED -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static FixStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
