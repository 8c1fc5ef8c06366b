package com.mender.core.metrics;

import com.mender.core.model.FixDecision;
import com.mender.core.model.MissionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for mission processing.
 */
@Service
public class MenderMetrics {

    private final MeterRegistry registry;

    public MenderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordMissionResult(MissionStatus status) {
        Counter.builder("mender.missions.total")
                .tag("status", status.value())
                .register(registry)
                .increment();
    }

    public void recordMissionDuration(long ms) {
        Timer.builder("mender.mission.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGateDecision(FixDecision decision, double aggregateConfidence) {
        Counter.builder("mender.gate.decisions")
                .tag("decision", decision.name().toLowerCase())
                .register(registry)
                .increment();

        DistributionSummary.builder("mender.gate.aggregate_confidence")
                .description("Aggregate fix confidence seen by the decision gate")
                .register(registry)
                .record(aggregateConfidence);
    }

    /**
     * @param result "applied", "failed" or "review"
     */
    public void recordFixOutcome(String result) {
        Counter.builder("mender.fixes.applied")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    /**
     * @param result "admitted", "skipped" (at capacity) or "error"
     */
    public void recordPollCycle(String result) {
        Counter.builder("mender.poll.cycles")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
