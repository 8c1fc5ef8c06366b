package com.mender.core.health;

import com.mender.core.scheduler.MissionPoller;
import com.mender.core.store.KeyValueStore;
import com.mender.core.store.MissionStore;
import com.mender.review.ReviewRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final KeyValueStore store;
    private final MissionPoller poller;
    private final ReviewRouter reviewRouter;

    public HealthCheckService(KeyValueStore store, MissionPoller poller, ReviewRouter reviewRouter) {
        this.store = store;
        this.poller = poller;
        this.reviewRouter = reviewRouter;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkPoller());
        results.add(checkReview());
        return results;
    }

    /** True unless some component is DOWN. */
    public boolean isHealthy(List<HealthStatus> statuses) {
        return statuses.stream().noneMatch(s -> s.status() == HealthStatus.Status.DOWN);
    }

    private HealthStatus checkStore() {
        try {
            int missions = store.listKeys(MissionStore.MISSION_PREFIX).size();
            return new HealthStatus("store", HealthStatus.Status.UP,
                    "Store reachable (" + store.getClass().getSimpleName() + ")",
                    Map.of("missions", String.valueOf(missions)));
        } catch (Exception e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkPoller() {
        var metadata = Map.of("active", String.valueOf(poller.activeCount()));
        if (poller.isRunning()) {
            return new HealthStatus("poller", HealthStatus.Status.UP, "Polling for missions", metadata);
        }
        return new HealthStatus("poller", HealthStatus.Status.DEGRADED,
                "Poller disabled or stopping; no new missions will start", metadata);
    }

    private HealthStatus checkReview() {
        return new HealthStatus("review", HealthStatus.Status.UP,
                "Review hand-off via " + reviewRouter.name(), Map.of());
    }
}
