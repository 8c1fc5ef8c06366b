package com.mender.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A synthesized, reviewable remediation derived from one or more findings.
 *
 * @param id             unique id generated at synthesis time
 * @param missionRef     id of the anomaly the fix addresses
 * @param description    one-line summary used for review titles
 * @param findings       findings the fix addresses, in analyzer order; never empty
 * @param changes        file operations, applied in order
 * @param testPlan       human-readable verification steps
 * @param riskAssessment aggregated risk
 * @param status         lifecycle status
 * @param createdAt      synthesis time
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Fix(
    String id,
    String missionRef,
    String description,
    List<Finding> findings,
    List<FileChange> changes,
    List<String> testPlan,
    RiskAssessment riskAssessment,
    FixStatus status,
    Instant createdAt
) implements Serializable {

    public Fix {
        if (findings == null || findings.isEmpty()) {
            throw new IllegalArgumentException("Fix " + id + " must reference at least one finding");
        }
        findings = List.copyOf(findings);
        changes = changes == null ? List.of() : List.copyOf(changes);
        testPlan = testPlan == null ? List.of() : List.copyOf(testPlan);
        if (status == null) status = FixStatus.GENERATED;
    }

    /**
     * Returns a copy in status {@code next}.
     *
     * @throws IllegalStateException if the lifecycle does not allow the transition
     */
    public Fix withStatus(FixStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Fix %s cannot move from %s to %s".formatted(id, status.value(), next.value()));
        }
        return new Fix(id, missionRef, description, findings, changes, testPlan,
                riskAssessment, next, createdAt);
    }
}
