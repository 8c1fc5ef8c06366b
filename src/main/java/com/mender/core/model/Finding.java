package com.mender.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * One diagnosed root-cause candidate produced by a codebase analyzer.
 *
 * @param filePath     file the issue lives in (or a placeholder such as "Multiple files")
 * @param issueType    category of the issue
 * @param description  what is wrong
 * @param lineNumber   1-based line, when known
 * @param context      why the issue matters in this codebase
 * @param suggestedFix human-readable remediation hint
 * @param confidence   0-100 certainty that the finding is correct and relevant
 * @param riskLevel    risk of acting on this finding alone
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Finding(
    String filePath,
    IssueType issueType,
    String description,
    Integer lineNumber,
    String context,
    String suggestedFix,
    int confidence,
    RiskLevel riskLevel
) implements Serializable {

    public Finding {
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("Finding confidence must be within 0-100, got " + confidence);
        }
        if (issueType == null) {
            throw new IllegalArgumentException("Finding issueType is required");
        }
        if (riskLevel == null) {
            throw new IllegalArgumentException("Finding riskLevel is required");
        }
    }
}
