package com.mender.core.query;

import com.mender.core.gate.DecisionGate;
import com.mender.core.model.Fix;
import com.mender.core.model.Mission;
import com.mender.core.model.MissionStats;
import com.mender.core.model.MissionStatus;
import com.mender.core.store.MissionStore;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Read-only views over mission and fix records for operators.
 */
@Service
public class HealingQueryService {

    private final MissionStore missionStore;
    private final DecisionGate gate;

    public HealingQueryService(MissionStore missionStore, DecisionGate gate) {
        this.missionStore = missionStore;
        this.gate = gate;
    }

    /** Missions that have not reached a terminal status. */
    public List<Mission> listActiveMissions() {
        return missionStore.loadAllMissions().stream()
                .filter(m -> !m.status().isTerminal())
                .sorted(Comparator.comparing(Mission::createdAt))
                .toList();
    }

    /** Up to {@code limit} stored fixes, newest first. */
    public List<Fix> listRecentFixes(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return missionStore.loadAllFixes().stream()
                .sorted(Comparator.comparing(Fix::createdAt).reversed())
                .limit(limit)
                .toList();
    }

    /**
     * Counts over all stored missions plus the mean gate confidence of stored fixes (0 when none).
     */
    public MissionStats getMissionStats() {
        List<Mission> missions = missionStore.loadAllMissions();
        List<Fix> fixes = missionStore.loadAllFixes();

        int completed = (int) missions.stream().filter(m -> m.status() == MissionStatus.COMPLETED).count();
        int failed = (int) missions.stream().filter(m -> m.status() == MissionStatus.FAILED).count();
        int active = (int) missions.stream().filter(m -> !m.status().isTerminal()).count();
        double avgConfidence = fixes.stream()
                .mapToDouble(gate::aggregateConfidence)
                .average()
                .orElse(0);

        return new MissionStats(missions.size(), completed, failed, active, avgConfidence);
    }
}
