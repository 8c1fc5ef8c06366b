package com.mender.core.synthesis;

import com.mender.core.analyzer.AnalyzerProperties;
import com.mender.core.analyzer.EndpointFailureAnalyzer;
import com.mender.core.model.ChangeOperation;
import com.mender.core.model.FileChange;
import com.mender.core.model.Finding;
import com.mender.core.model.Fix;
import com.mender.core.model.FixStatus;
import com.mender.core.model.IssueType;
import com.mender.core.model.Mission;
import com.mender.core.model.RiskAssessment;
import com.mender.core.model.RiskLevel;
import com.mender.workspace.WorkspaceFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Turns a mission's findings into a single reviewable {@link Fix}.
 * <p>
 * Remediable findings contribute changes:
 * <ul>
 *   <li>{@code missing_file}: create the file from the route-handler scaffold</li>
 *   <li>{@code logic_error} on a source that links to the failing endpoint: rewrite
 *       the link to the fallback route, recording the current content for stale-fix checks</li>
 * </ul>
 * Every other finding is carried into the fix for the reviewer but changes nothing.
 */
@Service
public class FixSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(FixSynthesizer.class);

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final WorkspaceFileSystem workspace;
    private final AnalyzerProperties analyzerProperties;
    private final Clock clock;

    @Autowired
    public FixSynthesizer(WorkspaceFileSystem workspace, AnalyzerProperties analyzerProperties) {
        this(workspace, analyzerProperties, Clock.systemUTC());
    }

    public FixSynthesizer(WorkspaceFileSystem workspace, AnalyzerProperties analyzerProperties, Clock clock) {
        this.workspace = workspace;
        this.analyzerProperties = analyzerProperties;
        this.clock = clock;
    }

    /**
     * Synthesizes a fix for {@code findings}. Findings are not modified.
     *
     * @throws IllegalArgumentException if {@code findings} is empty
     */
    public Fix synthesize(Mission mission, List<Finding> findings) {
        if (findings == null || findings.isEmpty()) {
            throw new IllegalArgumentException("Cannot synthesize a fix without findings for " + mission.key());
        }
        log.info("Generating fix for {} identified issue(s)", findings.size());

        Instant now = clock.instant();
        String fixId = generateFixId(now);
        String endpoint = mission.anomaly() != null ? mission.anomaly().affectedEndpoint() : null;

        var changes = new ArrayList<FileChange>();
        var concerns = new LinkedHashSet<String>();
        var mitigations = new LinkedHashSet<String>();
        var testPlan = new LinkedHashSet<String>();
        RiskLevel level = RiskLevel.LOW;

        for (Finding finding : findings) {
            level = RiskLevel.max(level, finding.riskLevel());

            Optional<FileChange> change = changeFor(finding, mission, endpoint);
            if (change.isEmpty()) {
                concerns.add("No automatic remediation for %s in %s: %s"
                        .formatted(finding.issueType().value(), finding.filePath(), finding.description()));
                continue;
            }
            changes.add(change.get());
            describe(change.get(), endpoint, concerns, mitigations, testPlan);
        }

        if (!changes.isEmpty()) {
            if (endpoint != null) {
                testPlan.add("Check error rates for " + endpoint + " return to normal");
            }
            testPlan.add("Validate the affected user journey end to end");
            mitigations.add("Changes are reversible through version control");
        } else {
            testPlan.add("Reproduce the anomaly and confirm the diagnosed root cause manually");
        }

        String anomalyType = mission.anomaly() != null ? mission.anomaly().type() : "unknown";
        var fix = new Fix(
                fixId,
                mission.anomaly() != null ? mission.anomaly().id() : null,
                "Autonomous fix for %s: %d file(s) changed".formatted(anomalyType, changes.size()),
                findings,
                changes,
                List.copyOf(testPlan),
                new RiskAssessment(level, List.copyOf(concerns), List.copyOf(mitigations)),
                FixStatus.GENERATED,
                now);

        log.info("Generated fix {} with {} file change(s), risk {}", fixId, changes.size(), level.value());
        return fix;
    }

    private Optional<FileChange> changeFor(Finding finding, Mission mission, String endpoint) {
        if (finding.issueType() == IssueType.MISSING_FILE) {
            if (endpoint == null || endpoint.isBlank()) {
                return Optional.empty();
            }
            String content = RouteHandlerTemplate.render(
                    endpoint, analyzerProperties.getFallbackRoute(), mission.anomaly().id());
            return Optional.of(new FileChange(finding.filePath(), ChangeOperation.CREATE, null, content,
                    "Create missing route handler so requests to " + endpoint + " stop failing"));
        }

        if (finding.issueType() == IssueType.LOGIC_ERROR && endpoint != null && !endpoint.isBlank()) {
            String brokenLink = EndpointFailureAnalyzer.linkTo(endpoint);
            String fixedLink = EndpointFailureAnalyzer.linkTo(analyzerProperties.getFallbackRoute());
            return workspace.read(finding.filePath())
                    .filter(current -> current.contains(brokenLink))
                    .map(current -> new FileChange(finding.filePath(), ChangeOperation.MODIFY, current,
                            current.replace(brokenLink, fixedLink),
                            "Redirect users to " + analyzerProperties.getFallbackRoute()
                                    + " instead of the API endpoint " + endpoint));
        }

        return Optional.empty();
    }

    private void describe(FileChange change, String endpoint, LinkedHashSet<String> concerns,
                          LinkedHashSet<String> mitigations, LinkedHashSet<String> testPlan) {
        switch (change.operation()) {
            case CREATE -> {
                concerns.add("New handler at " + change.path() + " is a placeholder and needs a real implementation");
                mitigations.add("Placeholder handler degrades gracefully instead of failing");
                testPlan.add("Verify " + endpoint + " responds without a server error");
            }
            case MODIFY -> {
                concerns.add("Redirecting links in " + change.path() + " may change the user workflow");
                mitigations.add("Original content of " + change.path() + " is recorded and checked before writing");
                testPlan.add("Verify navigation from " + change.path() + " reaches "
                        + analyzerProperties.getFallbackRoute());
            }
            case DELETE -> {
                concerns.add("Deleting " + change.path() + " removes code other modules may reference");
                testPlan.add("Verify nothing references " + change.path());
            }
        }
    }

    private String generateFixId(Instant now) {
        var random = ThreadLocalRandom.current();
        var suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "fix_" + now.toEpochMilli() + "_" + suffix;
    }
}
