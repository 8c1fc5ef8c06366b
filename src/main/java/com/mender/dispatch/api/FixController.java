package com.mender.dispatch.api;

import com.mender.core.model.Fix;
import com.mender.core.query.HealingQueryService;
import com.mender.core.store.MissionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the fix audit trail.
 */
@RestController
@RequestMapping("/api/v1/fixes")
public class FixController {

    private final HealingQueryService queryService;
    private final MissionStore missionStore;

    public FixController(HealingQueryService queryService, MissionStore missionStore) {
        this.queryService = queryService;
        this.missionStore = missionStore;
    }

    /**
     * GET /api/v1/fixes?limit=10: Most recent fixes, newest first.
     */
    @GetMapping
    public List<Fix> recentFixes(@RequestParam(defaultValue = "10") int limit) {
        return queryService.listRecentFixes(limit);
    }

    /**
     * GET /api/v1/fixes/{fixId}
     */
    @GetMapping("/{fixId}")
    public ResponseEntity<Fix> getFix(@PathVariable String fixId) {
        return missionStore.loadFix(fixId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
