package com.mender.core.metrics;

import com.mender.core.model.FixDecision;
import com.mender.core.model.MissionStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MenderMetricsTest {

    private SimpleMeterRegistry registry;
    private MenderMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MenderMetrics(registry);
    }

    @Test
    @DisplayName("recordMissionResult counts by status")
    void missionResults() {
        metrics.recordMissionResult(MissionStatus.COMPLETED);
        metrics.recordMissionResult(MissionStatus.COMPLETED);
        metrics.recordMissionResult(MissionStatus.FAILED);

        assertEquals(2.0, registry.find("mender.missions.total").tag("status", "completed").counter().count());
        assertEquals(1.0, registry.find("mender.missions.total").tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("recordGateDecision counts decisions and records confidence")
    void gateDecisions() {
        metrics.recordGateDecision(FixDecision.AUTO_APPLY, 95);
        metrics.recordGateDecision(FixDecision.HUMAN_REVIEW, 80);

        assertEquals(1.0, registry.find("mender.gate.decisions").tag("decision", "auto_apply").counter().count());
        assertEquals(1.0, registry.find("mender.gate.decisions").tag("decision", "human_review").counter().count());
        var summary = registry.find("mender.gate.aggregate_confidence").summary();
        assertNotNull(summary);
        assertEquals(175.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordMissionDuration creates a timer")
    void missionDuration() {
        metrics.recordMissionDuration(1500);
        var timer = registry.find("mender.mission.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("fix outcomes and poll cycles are tagged by result")
    void taggedCounters() {
        metrics.recordFixOutcome("applied");
        metrics.recordPollCycle("skipped");

        assertNotNull(registry.find("mender.fixes.applied").tag("result", "applied").counter());
        assertNotNull(registry.find("mender.poll.cycles").tag("result", "skipped").counter());
    }
}
