package com.mender.core.engine;

import com.mender.core.analytics.AnalyticsEvent;
import com.mender.core.analytics.AnalyticsSink;
import com.mender.core.analyzer.AnalysisContext;
import com.mender.core.analyzer.CodebaseAnalyzer;
import com.mender.core.events.EventBus;
import com.mender.core.events.MenderEvent;
import com.mender.core.executor.FixExecutor;
import com.mender.core.gate.DecisionGate;
import com.mender.core.logging.MdcContext;
import com.mender.core.metrics.MenderMetrics;
import com.mender.core.model.Finding;
import com.mender.core.model.Fix;
import com.mender.core.model.GateDecision;
import com.mender.core.model.Mission;
import com.mender.core.model.MissionStatus;
import com.mender.core.scheduler.ClaimTable;
import com.mender.core.store.MissionStore;
import com.mender.core.synthesis.FixSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one mission from {@code pending} to {@code completed} or {@code failed}.
 * <p>
 * Steps, each bounded by the collaborator timeout:
 * <ol>
 *   <li>analyze the anomaly; no findings completes the mission without a fix</li>
 *   <li>synthesize a fix from the findings</li>
 *   <li>gate the fix, then apply it or route it for review</li>
 * </ol>
 * Every transition is persisted before the next step starts. Errors never leave
 * {@link #process}: they fail the mission, and the claim is always released.
 */
@Service
public class MissionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MissionOrchestrator.class);

    private final CodebaseAnalyzer analyzer;
    private final FixSynthesizer synthesizer;
    private final DecisionGate gate;
    private final FixExecutor executor;
    private final MissionStore missionStore;
    private final ClaimTable claimTable;
    private final CollaboratorInvoker invoker;
    private final AnalyticsSink analytics;
    private final EventBus eventBus;
    private final MenderMetrics metrics;
    private final Clock clock;

    public MissionOrchestrator(CodebaseAnalyzer analyzer,
                               FixSynthesizer synthesizer,
                               DecisionGate gate,
                               FixExecutor executor,
                               MissionStore missionStore,
                               ClaimTable claimTable,
                               CollaboratorInvoker invoker,
                               AnalyticsSink analytics,
                               EventBus eventBus,
                               MenderMetrics metrics,
                               Clock clock) {
        this.analyzer = analyzer;
        this.synthesizer = synthesizer;
        this.gate = gate;
        this.executor = executor;
        this.missionStore = missionStore;
        this.claimTable = claimTable;
        this.invoker = invoker;
        this.analytics = analytics;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Processes a claimed mission. Never throws.
     *
     * @return the mission in its final persisted state
     */
    public Mission process(String missionKey, Mission mission) {
        MdcContext.setMission(missionKey);
        Instant started = clock.instant();
        Mission current = mission.withKey(missionKey);
        try {
            log.info("Processing mission {}: {}", missionKey, current.goal());
            if (current.anomaly() == null) {
                throw new IllegalArgumentException("Mission " + missionKey + " carries no anomaly");
            }
            if (current.status() != MissionStatus.PENDING) {
                log.info("Restarting mission {} from status {}", missionKey, current.status().value());
                current = current.restarted();
            }

            current = advance(current, MissionStatus.ANALYZING, Map.of());
            final Mission analyzing = current;
            List<Finding> findings = invoker.invoke("analysis",
                    () -> analyzer.analyze(analyzing.anomaly(), AnalysisContext.of(analyzing)));
            log.info("Analysis of {} produced {} finding(s)", missionKey, findings.size());

            if (findings.isEmpty()) {
                current = advance(current, MissionStatus.COMPLETED, Map.of("findings", 0));
                log.info("Mission {} completed: no actionable findings", missionKey);
                return current;
            }

            current = advance(current, MissionStatus.FIXING, Map.of("findings", findings.size()));
            final Mission fixing = current;
            Fix fix = invoker.invoke("synthesis", () -> synthesizer.synthesize(fixing, findings));
            MdcContext.setFix(missionKey, fix.id());

            GateDecision decision = gate.evaluate(fix);
            metrics.recordGateDecision(decision.decision(), decision.aggregateConfidence());
            publish(missionKey, fix.id(), "fix.generated", Map.of(
                    "decision", decision.decision().name(),
                    "aggregateConfidence", decision.aggregateConfidence(),
                    "changes", fix.changes().size()));

            Fix result = invoker.invoke("execution", () -> executor.execute(fixing, fix, decision));
            publish(missionKey, fix.id(), decision.autoApply() ? "fix.applied" : "fix.review_requested",
                    Map.of("status", result.status().value()));

            current = advance(current, MissionStatus.COMPLETED, Map.of("fixId", fix.id()));
            log.info("Mission {} completed with fix {} ({})",
                    missionKey, fix.id(), decision.autoApply() ? "auto-applied" : "routed for review");
            trackCompletion(current, result, decision);
            return current;
        } catch (Exception e) {
            log.error("Mission {} failed: {}", missionKey, e.getMessage(), e);
            return fail(current, e);
        } finally {
            claimTable.release(missionKey);
            metrics.recordMissionDuration(Duration.between(started, clock.instant()).toMillis());
            MdcContext.clear();
        }
    }

    private Mission advance(Mission mission, MissionStatus next, Map<String, Object> payload) {
        Mission moved = mission.transitionTo(next, clock.instant());
        missionStore.saveMission(moved);
        log.info("Mission {} {} -> {}", mission.key(), mission.status().value(), next.value());
        publish(mission.key(), null, "mission." + next.value(), payload);
        if (next.isTerminal()) {
            metrics.recordMissionResult(next);
        }
        return moved;
    }

    private Mission fail(Mission mission, Exception cause) {
        if (mission.status().isTerminal()) {
            return mission;
        }
        Mission failed = mission.transitionTo(MissionStatus.FAILED, clock.instant());
        metrics.recordMissionResult(MissionStatus.FAILED);
        try {
            missionStore.saveMission(failed);
        } catch (RuntimeException e) {
            log.error("Could not persist failure of mission {}: {}", mission.key(), e.getMessage(), e);
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("error", cause.getClass().getSimpleName());
        payload.put("message", String.valueOf(cause.getMessage()));
        publish(mission.key(), null, "mission.failed", payload);
        return failed;
    }

    private void trackCompletion(Mission mission, Fix fix, GateDecision decision) {
        var properties = new LinkedHashMap<String, Object>();
        properties.put("missionId", mission.anomaly().id());
        properties.put("anomalyType", mission.anomaly().type());
        properties.put("fixId", fix.id());
        properties.put("confidence", decision.aggregateConfidence());
        properties.put("riskLevel", fix.riskAssessment().level().value());
        properties.put("filesChanged", fix.changes().size());
        properties.put("autoApplied", decision.autoApply());
        properties.values().removeIf(v -> v == null);
        try {
            analytics.track(new AnalyticsEvent(AnalyticsEvent.HEALING_COMPLETED, properties));
        } catch (RuntimeException e) {
            log.warn("Could not record analytics for mission {}: {}", mission.key(), e.getMessage());
        }
    }

    private void publish(String missionKey, String fixId, String type, Map<String, Object> payload) {
        eventBus.publish(new MenderEvent(type, missionKey, fixId, payload, clock.instant()));
    }
}
