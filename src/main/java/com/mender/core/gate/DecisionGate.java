package com.mender.core.gate;

import com.mender.core.model.Finding;
import com.mender.core.model.Fix;
import com.mender.core.model.FixDecision;
import com.mender.core.model.GateDecision;
import com.mender.core.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether a synthesized fix may be applied without a human.
 * <p>
 * A fix is auto-applied only when all three hold:
 * <ul>
 *   <li>its aggregate confidence reaches the auto-apply threshold</li>
 *   <li>its overall risk is low</li>
 *   <li>every finding individually reaches the high-confidence threshold</li>
 * </ul>
 * The aggregate is the mean finding confidence plus the risk adjustment of the
 * fix's overall level, clamped to 0-100. Everything else goes to human review.
 */
@Service
public class DecisionGate {

    private static final Logger log = LoggerFactory.getLogger(DecisionGate.class);

    private final GateProperties properties;

    public DecisionGate(GateProperties properties) {
        this.properties = properties;
    }

    public GateDecision evaluate(Fix fix) {
        double aggregate = aggregateConfidence(fix);
        RiskLevel level = riskLevelOf(fix);
        boolean allHigh = fix.findings().stream()
                .allMatch(f -> f.confidence() >= properties.getHighConfidenceThreshold());

        boolean autoApply = aggregate >= properties.getAutoApplyThreshold()
                && level == RiskLevel.LOW
                && allHigh;

        String reason;
        if (autoApply) {
            reason = "Aggregate confidence %.1f%% with low risk, all findings at or above %d%%"
                    .formatted(aggregate, properties.getHighConfidenceThreshold());
            log.info("Fix {} approved for auto-apply: {}", fix.id(), reason);
            return new GateDecision(FixDecision.AUTO_APPLY, aggregate, true, reason);
        }

        reason = denialReason(aggregate, level, allHigh);
        log.info("Fix {} requires human review: {}", fix.id(), reason);
        return new GateDecision(FixDecision.HUMAN_REVIEW, aggregate, allHigh, reason);
    }

    /**
     * Mean finding confidence adjusted by the fix's risk level, clamped to 0-100.
     */
    public double aggregateConfidence(Fix fix) {
        double mean = fix.findings().stream()
                .mapToInt(Finding::confidence)
                .average()
                .orElse(0);
        double adjusted = mean + riskLevelOf(fix).confidenceAdjustment();
        return Math.max(0, Math.min(100, adjusted));
    }

    private String denialReason(double aggregate, RiskLevel level, boolean allHigh) {
        var sb = new StringBuilder();
        if (aggregate < properties.getAutoApplyThreshold()) {
            sb.append("aggregate confidence %.1f%% below %d%%"
                    .formatted(aggregate, properties.getAutoApplyThreshold()));
        }
        if (level != RiskLevel.LOW) {
            if (!sb.isEmpty()) sb.append("; ");
            sb.append("risk level is ").append(level.value());
        }
        if (!allHigh) {
            if (!sb.isEmpty()) sb.append("; ");
            sb.append("not every finding reaches ").append(properties.getHighConfidenceThreshold()).append('%');
        }
        return sb.toString();
    }

    private static RiskLevel riskLevelOf(Fix fix) {
        if (fix.riskAssessment() != null && fix.riskAssessment().level() != null) {
            return fix.riskAssessment().level();
        }
        return fix.findings().stream()
                .map(Finding::riskLevel)
                .reduce(RiskLevel.LOW, RiskLevel::max);
    }
}
