package com.mender.core.scheduler;

import com.mender.core.engine.MenderProperties;
import com.mender.core.engine.MissionOrchestrator;
import com.mender.core.metrics.MenderMetrics;
import com.mender.core.model.Mission;
import com.mender.core.model.MissionStatus;
import com.mender.core.store.MissionStore;
import com.mender.core.store.StoreException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Discovers pending missions in the store and starts them, never running more
 * than {@code mender.poller.max-concurrent-missions} at once.
 * <p>
 * Each admitted mission is claimed before it is submitted to the mission pool;
 * the orchestration releases the claim when it finishes. Completed and failed
 * records are left alone; unclaimed in-flight records are resumed.
 */
@Component
public class MissionPoller {

    private static final Logger log = LoggerFactory.getLogger(MissionPoller.class);

    private final MissionStore missionStore;
    private final ClaimTable claimTable;
    private final MissionOrchestrator orchestrator;
    private final AsyncTaskExecutor missionExecutor;
    private final MenderProperties properties;
    private final MenderMetrics metrics;
    private final Clock clock;

    private volatile boolean shuttingDown = false;

    public MissionPoller(MissionStore missionStore,
                         ClaimTable claimTable,
                         MissionOrchestrator orchestrator,
                         @Qualifier("missionExecutor") AsyncTaskExecutor missionExecutor,
                         MenderProperties properties,
                         MenderMetrics metrics,
                         Clock clock) {
        this.missionStore = missionStore;
        this.claimTable = claimTable;
        this.orchestrator = orchestrator;
        this.missionExecutor = missionExecutor;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${mender.poller.interval-ms:10000}")
    public void scheduledPoll() {
        if (!properties.isPollerEnabled()) {
            return;
        }
        poll();
    }

    /**
     * Runs one polling cycle. Errors are logged, never thrown.
     *
     * @return the number of missions admitted in this cycle
     */
    public int poll() {
        if (shuttingDown) {
            return 0;
        }
        int cap = properties.getMaxConcurrentMissions();
        if (claimTable.size() >= cap) {
            log.debug("At capacity ({}/{} missions), skipping poll", claimTable.size(), cap);
            metrics.recordPollCycle("skipped");
            return 0;
        }

        int admitted = 0;
        try {
            for (String key : missionStore.listMissionKeys()) {
                if (claimTable.size() >= cap) {
                    log.debug("Reached capacity ({}), deferring remaining missions", cap);
                    break;
                }
                if (claimTable.contains(key)) {
                    continue;
                }
                Optional<Mission> mission = readRunnable(key);
                if (mission.isPresent() && admit(key, mission.get())) {
                    admitted++;
                }
            }
        } catch (RuntimeException e) {
            log.error("Mission poll cycle failed: {}", e.getMessage(), e);
            metrics.recordPollCycle("error");
            return admitted;
        }

        metrics.recordPollCycle("admitted");
        if (admitted > 0) {
            log.info("Admitted {} mission(s), {} active", admitted, claimTable.size());
        }
        return admitted;
    }

    /** Number of missions currently claimed by this process. */
    public int activeCount() {
        return claimTable.size();
    }

    public boolean isRunning() {
        return properties.isPollerEnabled() && !shuttingDown;
    }

    /**
     * Stops admitting missions and waits for in-flight ones, up to the shutdown timeout.
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.getShutdownTimeoutSeconds());
        log.info("Mission poller stopping, waiting for {} in-flight mission(s)", claimTable.size());

        for (ClaimTable.Claim claim : claimTable.claims()) {
            Optional<Future<?>> task = claim.getTask();
            if (task.isEmpty()) {
                continue;
            }
            long remaining = deadline - System.nanoTime();
            try {
                task.get().get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                log.warn("Mission {} still running at shutdown", claim.getMissionKey());
            } catch (ExecutionException e) {
                log.warn("Mission {} ended abnormally: {}", claim.getMissionKey(), e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while draining missions");
                return;
            }
        }
        log.info("Mission poller stopped");
    }

    /**
     * Reads a record that still needs work. Non-terminal records other than pending
     * were interrupted by a restart: the claim table is in-memory, so an unclaimed
     * in-flight record has no owner and is resumed.
     */
    private Optional<Mission> readRunnable(String key) {
        Optional<Mission> mission;
        try {
            mission = missionStore.loadMission(key);
        } catch (StoreException e) {
            log.warn("Skipping unreadable mission record {}: {}", key, e.getMessage());
            return Optional.empty();
        }
        if (mission.isEmpty()) {
            return Optional.empty();
        }
        if (mission.get().status().isTerminal()) {
            log.debug("Skipping mission {} in status {}", key, mission.get().status().value());
            return Optional.empty();
        }
        if (mission.get().status() != MissionStatus.PENDING) {
            log.warn("Mission {} was left in status {} by an earlier run, resuming",
                    key, mission.get().status().value());
        }
        return mission;
    }

    private boolean admit(String key, Mission mission) {
        if (claimTable.tryClaim(key, clock.instant()).isEmpty()) {
            return false;
        }
        try {
            Future<?> task = missionExecutor.submit(() -> orchestrator.process(key, mission));
            claimTable.attach(key, task);
            log.info("Started mission {} (priority {}): {}", key, mission.priority().value(), mission.goal());
            return true;
        } catch (TaskRejectedException e) {
            claimTable.release(key);
            log.warn("Mission pool rejected {}, will retry next cycle: {}", key, e.getMessage());
            return false;
        }
    }
}
