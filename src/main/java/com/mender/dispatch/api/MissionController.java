package com.mender.dispatch.api;

import com.mender.core.events.MenderEvent;
import com.mender.core.events.MissionEventLog;
import com.mender.core.model.AnomalyRef;
import com.mender.core.model.Mission;
import com.mender.core.model.MissionPriority;
import com.mender.core.model.MissionStats;
import com.mender.core.query.HealingQueryService;
import com.mender.core.store.MissionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for healing missions.
 */
@RestController
@RequestMapping("/api/v1/missions")
public class MissionController {

    private static final Logger log = LoggerFactory.getLogger(MissionController.class);

    private final HealingQueryService queryService;
    private final MissionStore missionStore;
    private final MissionEventLog eventLog;
    private final Clock clock;

    public MissionController(HealingQueryService queryService, MissionStore missionStore,
                             MissionEventLog eventLog, Clock clock) {
        this.queryService = queryService;
        this.missionStore = missionStore;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    /**
     * POST /api/v1/missions: Queue a pending mission for an anomaly.
     * The poller picks it up on its next cycle.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submitMission(@RequestBody MissionRequest request) {
        AnomalyRef anomaly = request.anomaly();
        if (anomaly == null || isBlank(anomaly.id()) || isBlank(anomaly.type())) {
            return ResponseEntity.badRequest().body(Map.of("error", "anomaly.id and anomaly.type are required"));
        }

        MissionPriority priority;
        try {
            priority = MissionPriority.fromValue(request.priority());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid priority: " + request.priority()));
        }

        String key = MissionStore.missionKey(anomaly.id());
        var existing = missionStore.loadMission(key);
        if (existing.isPresent() && !existing.get().status().isTerminal()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", "Mission already in progress",
                    "mission_key", key,
                    "status", existing.get().status().value()));
        }

        String goal = !isBlank(request.goal())
                ? request.goal()
                : "Fix production anomaly: " + (anomaly.description() != null ? anomaly.description() : anomaly.type());
        Mission mission = Mission.pending(key, goal, priority, anomaly, clock.instant());
        missionStore.saveMission(mission);
        log.info("Queued mission {} ({}) via API", key, priority.value());

        var body = new LinkedHashMap<String, String>();
        body.put("mission_key", key);
        body.put("status", mission.status().value());
        return ResponseEntity.accepted().body(body);
    }

    /**
     * GET /api/v1/missions/active: Missions not yet completed or failed.
     */
    @GetMapping("/active")
    public List<Mission> activeMissions() {
        return queryService.listActiveMissions();
    }

    /**
     * GET /api/v1/missions/stats
     */
    @GetMapping("/stats")
    public MissionStats stats() {
        return queryService.getMissionStats();
    }

    /**
     * GET /api/v1/missions/{anomalyId}/events: Recent events of one mission, oldest first.
     * Only events seen by this process are retained.
     */
    @GetMapping("/{anomalyId}/events")
    public ResponseEntity<List<MenderEvent>> missionEvents(@PathVariable String anomalyId) {
        List<MenderEvent> events = eventLog.eventsFor(MissionStore.missionKey(anomalyId));
        if (events.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(events);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
