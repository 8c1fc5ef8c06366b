package com.mender.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mender.core.analytics.AnalyticsEvent;
import com.mender.core.analytics.AnalyticsSink;
import com.mender.core.analyzer.AnalyzerProperties;
import com.mender.core.analyzer.CodebaseAnalyzer;
import com.mender.core.analyzer.EndpointFailureAnalyzer;
import com.mender.core.events.EventBus;
import com.mender.core.events.MenderEvent;
import com.mender.core.executor.FixExecutor;
import com.mender.core.executor.ReviewArtifactBuilder;
import com.mender.core.gate.DecisionGate;
import com.mender.core.gate.GateProperties;
import com.mender.core.metrics.MenderMetrics;
import com.mender.core.model.AnomalyRef;
import com.mender.core.model.Finding;
import com.mender.core.model.Fix;
import com.mender.core.model.FixStatus;
import com.mender.core.model.IssueType;
import com.mender.core.model.Mission;
import com.mender.core.model.MissionPriority;
import com.mender.core.model.MissionStatus;
import com.mender.core.model.RiskLevel;
import com.mender.core.scheduler.ClaimTable;
import com.mender.core.store.InMemoryKeyValueStore;
import com.mender.core.store.MissionStore;
import com.mender.core.synthesis.FixSynthesizer;
import com.mender.review.ReviewRouter;
import com.mender.workspace.LocalWorkspaceFileSystem;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MissionOrchestratorTest {

    private static final String KEY = "healing_mission:anom-1";
    private static final String ENDPOINT = "/api/analysis/website/scan";
    private static final String ROUTE = "src/app/api/analysis/website/scan/route.ts";

    @TempDir
    Path root;

    private LocalWorkspaceFileSystem workspace;
    private MissionStore missionStore;
    private ClaimTable claimTable;
    private ReviewRouter reviewRouter;
    private AnalyticsSink analytics;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private List<MenderEvent> events;

    @BeforeEach
    void setUp() {
        workspace = new LocalWorkspaceFileSystem(root);
        missionStore = new MissionStore(new InMemoryKeyValueStore(), new ObjectMapper());
        claimTable = new ClaimTable();
        reviewRouter = mock(ReviewRouter.class);
        when(reviewRouter.name()).thenReturn("mock");
        analytics = mock(AnalyticsSink.class);
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
    }

    private MissionOrchestrator orchestrator(CodebaseAnalyzer analyzer, CollaboratorInvoker invoker) {
        var metrics = new MenderMetrics(registry);
        var executor = new FixExecutor(workspace, reviewRouter, new ReviewArtifactBuilder(), missionStore, metrics);
        return new MissionOrchestrator(analyzer,
                new FixSynthesizer(workspace, new AnalyzerProperties()),
                new DecisionGate(new GateProperties()),
                executor, missionStore, claimTable, invoker, analytics, eventBus, metrics,
                Clock.systemUTC());
    }

    private MissionOrchestrator orchestrator(CodebaseAnalyzer analyzer) {
        return orchestrator(analyzer, new CollaboratorInvoker(Runnable::run, Duration.ofSeconds(5)));
    }

    private static CodebaseAnalyzer returning(Finding... findings) {
        return (anomaly, context) -> List.of(findings);
    }

    private static Finding finding(int confidence, RiskLevel risk) {
        return new Finding("Multiple files", IssueType.LOGIC_ERROR, "investigate", null, null, null,
                confidence, risk);
    }

    private Mission claimedMission(String anomalyType) {
        var mission = Mission.pending(KEY, "Fix production anomaly: scan fails", MissionPriority.CRITICAL,
                new AnomalyRef("anom-1", anomalyType, ENDPOINT), Instant.now());
        missionStore.saveMission(mission);
        claimTable.tryClaim(KEY, Instant.now());
        return mission;
    }

    private List<Fix> storedFixes() {
        return missionStore.loadAllFixes();
    }

    private List<String> eventTypes() {
        return events.stream().map(MenderEvent::eventType).toList();
    }

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        @DisplayName("zero findings completes the mission without a fix")
        void zeroFindings() {
            Mission result = orchestrator(returning()).process(KEY, claimedMission("endpoint_failure"));

            assertEquals(MissionStatus.COMPLETED, result.status());
            assertNotNull(result.startedAt());
            assertNotNull(result.completedAt());
            assertTrue(storedFixes().isEmpty());
            assertEquals(MissionStatus.COMPLETED, missionStore.loadMission(KEY).orElseThrow().status());
            verifyNoInteractions(analytics);
            assertFalse(claimTable.contains(KEY));
        }

        @Test
        @DisplayName("missing route at 95% low risk is auto-applied and the mission completes")
        void autoApplied() {
            var analyzer = new EndpointFailureAnalyzer(workspace, new AnalyzerProperties());

            Mission result = orchestrator(analyzer).process(KEY, claimedMission("endpoint_failure"));

            assertEquals(MissionStatus.COMPLETED, result.status());
            assertTrue(Files.exists(root.resolve(ROUTE)));
            Fix fix = storedFixes().get(0);
            assertEquals(FixStatus.APPLIED, fix.status());
            verifyNoInteractions(reviewRouter);
            assertEquals(List.of("mission.analyzing", "mission.fixing", "fix.generated", "fix.applied",
                    "mission.completed"), eventTypes());

            var captor = ArgumentCaptor.forClass(AnalyticsEvent.class);
            verify(analytics).track(captor.capture());
            var props = captor.getValue().properties();
            assertEquals(AnalyticsEvent.HEALING_COMPLETED, captor.getValue().event());
            assertEquals("anom-1", props.get("missionId"));
            assertEquals("endpoint_failure", props.get("anomalyType"));
            assertEquals(fix.id(), props.get("fixId"));
            assertEquals(95.0, props.get("confidence"));
            assertEquals("low", props.get("riskLevel"));
            assertEquals(1, props.get("filesChanged"));
            assertEquals(true, props.get("autoApplied"));
        }

        @Test
        @DisplayName("90% medium-risk finding is routed for review and the fix stays generated")
        void mediumRiskReview() {
            Mission result = orchestrator(returning(finding(90, RiskLevel.MEDIUM)))
                    .process(KEY, claimedMission("error_spike"));

            assertEquals(MissionStatus.COMPLETED, result.status());
            assertEquals(FixStatus.GENERATED, storedFixes().get(0).status());
            verify(reviewRouter).submitForReview(anyString(), anyString(), anyString());

            var captor = ArgumentCaptor.forClass(AnalyticsEvent.class);
            verify(analytics).track(captor.capture());
            assertEquals(80.0, captor.getValue().properties().get("confidence"));
            assertEquals(false, captor.getValue().properties().get("autoApplied"));
        }

        @Test
        @DisplayName("a mission interrupted mid-run restarts from analysis and completes")
        void restartsInterruptedMission() {
            var analyzer = new EndpointFailureAnalyzer(workspace, new AnalyzerProperties());
            Instant firstStart = Instant.parse("2026-03-01T10:00:00Z");
            var interrupted = new Mission(KEY, "Fix production anomaly: scan fails", MissionPriority.CRITICAL,
                    new AnomalyRef("anom-1", "endpoint_failure", ENDPOINT), MissionStatus.FIXING,
                    firstStart.minusSeconds(5), firstStart, null);
            missionStore.saveMission(interrupted);
            claimTable.tryClaim(KEY, Instant.now());

            Mission result = orchestrator(analyzer).process(KEY, interrupted);

            assertEquals(MissionStatus.COMPLETED, result.status());
            assertEquals(firstStart, result.startedAt());
            assertTrue(Files.exists(root.resolve(ROUTE)));
            assertEquals(MissionStatus.COMPLETED, missionStore.loadMission(KEY).orElseThrow().status());
            assertEquals("mission.analyzing", eventTypes().get(0));
            assertFalse(claimTable.contains(KEY));
        }

        @Test
        @DisplayName("one low-confidence finding sends an otherwise strong fix to review")
        void perFindingGate() {
            Mission result = orchestrator(returning(finding(96, RiskLevel.LOW), finding(80, RiskLevel.LOW)))
                    .process(KEY, claimedMission("error_spike"));

            assertEquals(MissionStatus.COMPLETED, result.status());
            verify(reviewRouter).submitForReview(anyString(), anyString(), anyString());
            assertEquals(FixStatus.GENERATED, storedFixes().get(0).status());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("analyzer error fails the mission, persists it and releases the claim")
        void analyzerError() {
            CodebaseAnalyzer broken = (anomaly, context) -> {
                throw new IllegalStateException("index unavailable");
            };

            Mission result = orchestrator(broken).process(KEY, claimedMission("endpoint_failure"));

            assertEquals(MissionStatus.FAILED, result.status());
            assertNotNull(result.completedAt());
            assertEquals(MissionStatus.FAILED, missionStore.loadMission(KEY).orElseThrow().status());
            assertFalse(claimTable.contains(KEY));
            assertTrue(eventTypes().contains("mission.failed"));
            assertEquals(1.0, registry.find("mender.missions.total").tag("status", "failed").counter().count());
        }

        @Test
        @DisplayName("conflicting workspace fails both the fix and the mission")
        void executionConflict() throws IOException {
            Files.createDirectories(root.resolve(ROUTE).getParent());
            Files.writeString(root.resolve(ROUTE), "someone created it meanwhile");
            var stale = new Finding(ROUTE, IssueType.MISSING_FILE, "missing", null, null, null, 95, RiskLevel.LOW);

            Mission result = orchestrator(returning(stale)).process(KEY, claimedMission("endpoint_failure"));

            assertEquals(MissionStatus.FAILED, result.status());
            assertEquals(FixStatus.FAILED, storedFixes().get(0).status());
            assertEquals("someone created it meanwhile", Files.readString(root.resolve(ROUTE)));
            verifyNoInteractions(analytics);
        }

        @Test
        @DisplayName("collaborator call exceeding the timeout fails the mission")
        void collaboratorTimeout() {
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                CodebaseAnalyzer slow = (anomaly, context) -> {
                    try {
                        Thread.sleep(2_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return List.of();
                };
                var invoker = new CollaboratorInvoker(pool, Duration.ofMillis(100));

                Mission result = orchestrator(slow, invoker).process(KEY, claimedMission("endpoint_failure"));

                assertEquals(MissionStatus.FAILED, result.status());
                assertFalse(claimTable.contains(KEY));
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("analytics failure after completion does not fail the mission")
        void analyticsFailure() {
            doThrow(new RuntimeException("sink offline")).when(analytics).track(any());

            Mission result = orchestrator(returning(finding(90, RiskLevel.MEDIUM)))
                    .process(KEY, claimedMission("error_spike"));

            assertEquals(MissionStatus.COMPLETED, result.status());
            assertEquals(MissionStatus.COMPLETED, missionStore.loadMission(KEY).orElseThrow().status());
        }

        @Test
        @DisplayName("mission without an anomaly fails instead of throwing")
        void missingAnomaly() {
            var mission = Mission.pending(KEY, "goal", MissionPriority.LOW, null, Instant.now());

            Mission result = orchestrator(returning()).process(KEY, mission);

            assertEquals(MissionStatus.FAILED, result.status());
        }
    }
}
