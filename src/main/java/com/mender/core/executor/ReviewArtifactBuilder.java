package com.mender.core.executor;

import com.mender.core.model.FileChange;
import com.mender.core.model.Finding;
import com.mender.core.model.Fix;
import com.mender.core.model.GateDecision;
import com.mender.core.model.Mission;
import com.mender.core.model.ReviewArtifact;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders the markdown review description for a fix. The output depends only on
 * its inputs, so the same fix always produces the same review.
 */
@Component
public class ReviewArtifactBuilder {

    public ReviewArtifact build(Mission mission, Fix fix, GateDecision decision) {
        String title = "Autonomous fix: " + mission.goal();

        var sb = new StringBuilder();
        sb.append("## Autonomous Fix\n\n");
        sb.append("**Goal:** ").append(mission.goal()).append("\n");
        sb.append("**Mission:** ").append(mission.key()).append("\n");
        sb.append("**Fix:** ").append(fix.id()).append("\n\n");
        sb.append(fix.description()).append("\n\n");

        sb.append("### Analysis\n\n");
        appendFindings(sb, fix.findings());

        sb.append("\n### Changes\n\n");
        if (fix.changes().isEmpty()) {
            sb.append("No automatic changes; the findings above need a manual fix.\n");
        } else {
            appendChanges(sb, fix.changes());
        }

        sb.append("\n### Risk Assessment\n\n");
        sb.append("**Level:** ").append(fix.riskAssessment().level().value()).append("\n\n");
        appendList(sb, "Concerns", fix.riskAssessment().concerns());
        appendList(sb, "Mitigations", fix.riskAssessment().mitigations());

        if (decision != null) {
            sb.append("### Decision Gate\n\n");
            sb.append("**Aggregate confidence:** ")
              .append(String.format(Locale.ROOT, "%.1f%%", decision.aggregateConfidence())).append("\n");
            sb.append("**Routed for review because:** ").append(decision.reason()).append("\n\n");
        }

        sb.append("### Test Plan\n\n");
        for (String step : fix.testPlan()) {
            sb.append("- [ ] ").append(step).append("\n");
        }

        return new ReviewArtifact(fix.id(), title, sb.toString());
    }

    private static void appendFindings(StringBuilder sb, List<Finding> findings) {
        for (int i = 0; i < findings.size(); i++) {
            Finding f = findings.get(i);
            sb.append(i + 1).append(". **").append(f.filePath()).append("**");
            if (f.lineNumber() != null) {
                sb.append(" (line ").append(f.lineNumber()).append(")");
            }
            sb.append(": ").append(f.description()).append("\n");
            sb.append("   - Type: ").append(f.issueType().value())
              .append(", confidence ").append(f.confidence()).append("%")
              .append(", risk ").append(f.riskLevel().value()).append("\n");
            if (f.suggestedFix() != null && !f.suggestedFix().isBlank()) {
                sb.append("   - Suggested fix: ").append(f.suggestedFix()).append("\n");
            }
        }
    }

    private static void appendChanges(StringBuilder sb, List<FileChange> changes) {
        for (int i = 0; i < changes.size(); i++) {
            FileChange c = changes.get(i);
            sb.append(i + 1).append(". `").append(c.operation().value()).append("` ")
              .append(c.path()).append(": ").append(c.reasoning()).append("\n");
        }
    }

    private static void appendList(StringBuilder sb, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append("**").append(heading).append(":**\n");
        for (String item : items) {
            sb.append("- ").append(item).append("\n");
        }
        sb.append("\n");
    }
}
