package com.mender.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk of acting on a finding or applying a fix. Declaration order is severity order.
 */
public enum RiskLevel {
    LOW(0),
    MEDIUM(-10),
    HIGH(-20);

    private final int confidenceAdjustment;

    RiskLevel(int confidenceAdjustment) {
        this.confidenceAdjustment = confidenceAdjustment;
    }

    /** Points added to a fix's mean finding confidence at this risk level. */
    public int confidenceAdjustment() {
        return confidenceAdjustment;
    }

    /** The more severe of the two levels. */
    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static RiskLevel fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
