package com.mender.core.model;

/**
 * Aggregate counts over the mission and fix records in the store.
 */
public record MissionStats(
    int total,
    int completed,
    int failed,
    int active,
    double avgConfidence
) {}
