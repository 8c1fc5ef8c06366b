package com.mender.core.model;

/**
 * Outcome of the decision gate for a fix.
 */
public enum FixDecision {
    AUTO_APPLY,
    HUMAN_REVIEW
}
