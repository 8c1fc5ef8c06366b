package com.mender.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Aggregated risk of applying a fix.
 */
public record RiskAssessment(
    RiskLevel level,
    List<String> concerns,
    List<String> mitigations
) implements Serializable {

    public RiskAssessment {
        if (level == null) {
            throw new IllegalArgumentException("Risk level is required");
        }
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
        mitigations = mitigations == null ? List.of() : List.copyOf(mitigations);
    }
}
