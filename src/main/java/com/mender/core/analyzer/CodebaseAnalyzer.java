package com.mender.core.analyzer;

import com.mender.core.model.AnomalyRef;
import com.mender.core.model.Finding;

import java.util.List;

/**
 * Maps an anomaly to candidate root causes in the codebase.
 * <p>
 * Implementations must be deterministic: the same anomaly against the same
 * code state yields the same findings in the same order. An empty list means
 * nothing actionable was found and completes the mission as a no-op.
 */
public interface CodebaseAnalyzer {

    List<Finding> analyze(AnomalyRef anomaly, AnalysisContext context);
}
