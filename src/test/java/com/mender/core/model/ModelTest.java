package com.mender.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    static Finding finding(int confidence, RiskLevel risk) {
        return new Finding("src/app/api/scan/route.ts", IssueType.MISSING_FILE, "missing",
                null, null, null, confidence, risk);
    }

    static Fix fix(List<Finding> findings) {
        return new Fix("fix_1_abc", "a-1", "desc", findings, List.of(), List.of(),
                new RiskAssessment(RiskLevel.LOW, List.of(), List.of()), null, T0);
    }

    @Nested
    @DisplayName("MissionStatus")
    class MissionStatusTests {

        @Test
        @DisplayName("missing status reads as pending")
        void nullReadsAsPending() {
            assertEquals(MissionStatus.PENDING, MissionStatus.fromValue(null));
            assertEquals(MissionStatus.PENDING, MissionStatus.fromValue(""));
            assertEquals(MissionStatus.FIXING, MissionStatus.fromValue("fixing"));
        }

        @Test
        @DisplayName("terminal statuses cannot move anywhere")
        void terminalStatusesAreFinal() {
            for (MissionStatus next : MissionStatus.values()) {
                assertFalse(MissionStatus.COMPLETED.canTransitionTo(next));
                assertFalse(MissionStatus.FAILED.canTransitionTo(next));
            }
        }

        @Test
        @DisplayName("every non-terminal status can fail")
        void anyActiveStatusCanFail() {
            for (MissionStatus status : MissionStatus.values()) {
                if (!status.isTerminal()) {
                    assertTrue(status.canTransitionTo(MissionStatus.FAILED), status.name());
                }
            }
        }

        @Test
        @DisplayName("pending cannot skip straight to fixing")
        void pendingCannotSkipAnalysis() {
            assertFalse(MissionStatus.PENDING.canTransitionTo(MissionStatus.FIXING));
            assertTrue(MissionStatus.PENDING.canTransitionTo(MissionStatus.ANALYZING));
            assertTrue(MissionStatus.ANALYZING.canTransitionTo(MissionStatus.COMPLETED));
        }
    }

    @Nested
    @DisplayName("Mission")
    class MissionTests {

        @Test
        @DisplayName("detector records default priority and status")
        void defaultsApplied() {
            var mission = new Mission("healing_mission:a-1", "goal", null,
                    new AnomalyRef("a-1", "endpoint_failure", "/api/x"), null, null, null, null);

            assertEquals(MissionPriority.MEDIUM, mission.priority());
            assertEquals(MissionStatus.PENDING, mission.status());
            assertNull(mission.createdAt());
        }

        @Test
        @DisplayName("restarted keeps startedAt and returns an in-flight mission to pending")
        void restartedMission() {
            var fixing = new Mission("healing_mission:a-1", "goal", MissionPriority.HIGH,
                    new AnomalyRef("a-1", "endpoint_failure", "/api/x"), MissionStatus.FIXING,
                    T0, T0.plusSeconds(1), null);

            var restarted = fixing.restarted();

            assertEquals(MissionStatus.PENDING, restarted.status());
            assertEquals(T0.plusSeconds(1), restarted.startedAt());
            assertEquals(MissionStatus.ANALYZING,
                    restarted.transitionTo(MissionStatus.ANALYZING, T0.plusSeconds(9)).status());
            assertEquals(T0.plusSeconds(1),
                    restarted.transitionTo(MissionStatus.ANALYZING, T0.plusSeconds(9)).startedAt());
        }

        @Test
        @DisplayName("restarted refuses terminal missions")
        void restartedRejectsTerminal() {
            var done = new Mission("healing_mission:a-1", "goal", MissionPriority.HIGH,
                    new AnomalyRef("a-1", "endpoint_failure", "/api/x"), MissionStatus.COMPLETED,
                    T0, T0, T0);

            assertThrows(IllegalStateException.class, done::restarted);
        }

        @Test
        @DisplayName("leaving pending stamps startedAt, terminal status stamps completedAt")
        void timestampsOnTransition() {
            var pending = Mission.pending("healing_mission:a-1", "goal", MissionPriority.HIGH,
                    new AnomalyRef("a-1", "endpoint_failure", "/api/x"), T0);

            var analyzing = pending.transitionTo(MissionStatus.ANALYZING, T0.plusSeconds(1));
            assertEquals(T0.plusSeconds(1), analyzing.startedAt());
            assertNull(analyzing.completedAt());

            var fixing = analyzing.transitionTo(MissionStatus.FIXING, T0.plusSeconds(2));
            assertEquals(T0.plusSeconds(1), fixing.startedAt());

            var done = fixing.transitionTo(MissionStatus.COMPLETED, T0.plusSeconds(3));
            assertEquals(T0.plusSeconds(3), done.completedAt());
            assertEquals(T0, done.createdAt());
        }

        @Test
        @DisplayName("illegal transition throws")
        void illegalTransitionThrows() {
            var pending = Mission.pending("healing_mission:a-1", "goal", MissionPriority.LOW, null, T0);
            assertThrows(IllegalStateException.class,
                    () -> pending.transitionTo(MissionStatus.COMPLETED, T0));
        }
    }

    @Nested
    @DisplayName("Finding")
    class FindingTests {

        @Test
        @DisplayName("confidence outside 0-100 is rejected")
        void confidenceBounds() {
            assertThrows(IllegalArgumentException.class, () -> finding(101, RiskLevel.LOW));
            assertThrows(IllegalArgumentException.class, () -> finding(-1, RiskLevel.LOW));
            assertEquals(0, finding(0, RiskLevel.LOW).confidence());
            assertEquals(100, finding(100, RiskLevel.LOW).confidence());
        }
    }

    @Nested
    @DisplayName("Fix")
    class FixTests {

        @Test
        @DisplayName("a fix needs at least one finding")
        void requiresFinding() {
            assertThrows(IllegalArgumentException.class, () -> fix(List.of()));
        }

        @Test
        @DisplayName("new fixes start generated and copy their findings")
        void startsGeneratedWithDefensiveCopy() {
            var findings = new ArrayList<>(List.of(finding(95, RiskLevel.LOW)));
            var fix = fix(findings);
            findings.clear();

            assertEquals(FixStatus.GENERATED, fix.status());
            assertEquals(1, fix.findings().size());
        }

        @Test
        @DisplayName("status moves forward only, with reverted as the exit")
        void statusLifecycle() {
            var applied = fix(List.of(finding(95, RiskLevel.LOW))).withStatus(FixStatus.APPLIED);
            var tested = applied.withStatus(FixStatus.TESTED);

            assertEquals(FixStatus.REVERTED, tested.withStatus(FixStatus.REVERTED).status());
            assertThrows(IllegalStateException.class, () -> tested.withStatus(FixStatus.APPLIED));
            assertThrows(IllegalStateException.class,
                    () -> tested.withStatus(FixStatus.DEPLOYED).withStatus(FixStatus.FAILED));
            assertFalse(FixStatus.GENERATED.canTransitionTo(FixStatus.REVERTED));
        }

        @Test
        @DisplayName("modify changes must record the original content")
        void modifyNeedsOriginal() {
            assertThrows(IllegalArgumentException.class,
                    () -> new FileChange("a.tsx", ChangeOperation.MODIFY, null, "x", "r"));
            assertEquals("", new FileChange("a.tsx", ChangeOperation.DELETE, null, null, "r").newContent());
        }
    }

    @Test
    @DisplayName("RiskLevel.max prefers the more severe level")
    void riskMax() {
        assertEquals(RiskLevel.HIGH, RiskLevel.max(RiskLevel.LOW, RiskLevel.HIGH));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.max(RiskLevel.MEDIUM, RiskLevel.LOW));
        assertEquals(-20, RiskLevel.HIGH.confidenceAdjustment());
    }
}
