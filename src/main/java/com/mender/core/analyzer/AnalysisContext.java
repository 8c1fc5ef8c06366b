package com.mender.core.analyzer;

import com.mender.core.model.Mission;
import com.mender.core.model.MissionPriority;

/**
 * Mission-level context handed to an analyzer alongside the anomaly.
 */
public record AnalysisContext(
    String missionKey,
    String goal,
    MissionPriority priority
) {

    public static AnalysisContext of(Mission mission) {
        return new AnalysisContext(mission.key(), mission.goal(), mission.priority());
    }
}
