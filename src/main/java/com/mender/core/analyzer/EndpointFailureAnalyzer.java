package com.mender.core.analyzer;

import com.mender.core.model.AnomalyRef;
import com.mender.core.model.Finding;
import com.mender.core.model.IssueType;
import com.mender.core.model.RiskLevel;
import com.mender.workspace.WorkspaceFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rule-based analyzer for failing endpoints and error-rate anomalies.
 * <p>
 * Rules, in output order:
 * <ol>
 *   <li>{@code endpoint_failure}: the endpoint's route handler file is missing</li>
 *   <li>{@code endpoint_failure}: UI sources link straight to the failing endpoint</li>
 *   <li>{@code error_spike} / {@code high_error_rate}: a generic, medium-risk investigation finding</li>
 * </ol>
 */
@Service
public class EndpointFailureAnalyzer implements CodebaseAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(EndpointFailureAnalyzer.class);

    static final String ENDPOINT_FAILURE = "endpoint_failure";
    static final Set<String> ERROR_RATE_TYPES = Set.of("error_spike", "high_error_rate");

    static final int MISSING_ROUTE_CONFIDENCE = 95;
    static final int BROKEN_LINK_CONFIDENCE = 90;
    static final int ERROR_RATE_CONFIDENCE = 60;

    private final WorkspaceFileSystem workspace;
    private final AnalyzerProperties properties;

    public EndpointFailureAnalyzer(WorkspaceFileSystem workspace, AnalyzerProperties properties) {
        this.workspace = workspace;
        this.properties = properties;
    }

    /** The exact attribute text a UI source uses to link to {@code route}. */
    public static String linkTo(String route) {
        return "href=\"" + route + "\"";
    }

    @Override
    public List<Finding> analyze(AnomalyRef anomaly, AnalysisContext context) {
        log.info("Analyzing codebase for {} on {}", anomaly.type(),
                anomaly.hasEndpoint() ? anomaly.affectedEndpoint() : "(no endpoint)");

        var findings = new ArrayList<Finding>();

        if (ENDPOINT_FAILURE.equals(anomaly.type()) && anomaly.hasEndpoint()) {
            String endpoint = anomaly.affectedEndpoint();
            checkRouteHandler(endpoint, findings);
            checkLinksTo(endpoint, findings);
        }

        if (ERROR_RATE_TYPES.contains(anomaly.type())) {
            findings.add(new Finding(
                    "Multiple files",
                    IssueType.LOGIC_ERROR,
                    "High error rate detected - requires investigation of error patterns",
                    null,
                    "Multiple endpoints showing increased error rates",
                    "Add comprehensive error handling and logging",
                    ERROR_RATE_CONFIDENCE,
                    RiskLevel.MEDIUM));
        }

        log.info("Found {} issue(s) to address", findings.size());
        return findings;
    }

    private void checkRouteHandler(String endpoint, List<Finding> findings) {
        String routeFile = properties.routeFileFor(endpoint);
        if (workspace.exists(routeFile)) {
            log.debug("Route handler {} present for {}", routeFile, endpoint);
            return;
        }
        findings.add(new Finding(
                routeFile,
                IssueType.MISSING_FILE,
                "API route handler missing - every request to " + endpoint + " fails",
                null,
                "Handlers are resolved from " + properties.getRouteFileTemplate()
                        + "; nothing exists at " + routeFile,
                "Create " + routeFile + " with GET/POST handlers for " + endpoint,
                MISSING_ROUTE_CONFIDENCE,
                RiskLevel.LOW));
    }

    private void checkLinksTo(String endpoint, List<Finding> findings) {
        String link = linkTo(endpoint);
        for (String source : workspace.list(properties.getUiSources())) {
            String content = workspace.read(source).orElse("");
            int line = lineOf(content, link);
            if (line < 0) continue;

            findings.add(new Finding(
                    source,
                    IssueType.LOGIC_ERROR,
                    "Link points to API endpoint " + endpoint + " instead of a page",
                    line,
                    "Users following this link land on " + endpoint + " directly and receive an error",
                    "Change href from \"" + endpoint + "\" to \"" + properties.getFallbackRoute() + "\"",
                    BROKEN_LINK_CONFIDENCE,
                    RiskLevel.LOW));
        }
    }

    /** 1-based line of the first occurrence of {@code needle}, or -1. */
    static int lineOf(String content, String needle) {
        int index = content.indexOf(needle);
        if (index < 0) return -1;
        int line = 1;
        for (int i = 0; i < index; i++) {
            if (content.charAt(i) == '\n') line++;
        }
        return line;
    }
}
