package com.mender.core.model;

import java.io.Serializable;

/**
 * Result of the decision gate for a fix.
 *
 * @param decision                  whether the fix may be applied unattended
 * @param aggregateConfidence       mean finding confidence plus the risk adjustment, clamped to 0-100
 * @param allFindingsHighConfidence whether every finding cleared the per-finding threshold
 * @param reason                    human-readable explanation, used in logs and review bodies
 */
public record GateDecision(
    FixDecision decision,
    double aggregateConfidence,
    boolean allFindingsHighConfidence,
    String reason
) implements Serializable {

    public boolean autoApply() {
        return decision == FixDecision.AUTO_APPLY;
    }
}
