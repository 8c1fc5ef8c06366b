package com.mender.dispatch.api;

import com.mender.core.model.AnomalyRef;

/**
 * Manual trigger for a healing mission.
 *
 * @param anomaly  the anomaly to heal; {@code id} and {@code type} are required
 * @param priority low, medium, high or critical (default medium)
 * @param goal     optional goal; derived from the anomaly description when absent
 */
public record MissionRequest(AnomalyRef anomaly, String priority, String goal) {}
