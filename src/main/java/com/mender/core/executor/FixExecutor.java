package com.mender.core.executor;

import com.mender.core.logging.MdcContext;
import com.mender.core.metrics.MenderMetrics;
import com.mender.core.model.FileChange;
import com.mender.core.model.Fix;
import com.mender.core.model.FixStatus;
import com.mender.core.model.GateDecision;
import com.mender.core.model.Mission;
import com.mender.core.model.ReviewArtifact;
import com.mender.core.store.MissionStore;
import com.mender.review.ReviewRouter;
import com.mender.workspace.WorkspaceFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Carries out a gated fix: applies it to the workspace or hands it to a reviewer.
 * <p>
 * Changes are applied in order and each is checked against the workspace first.
 * The first conflict stops the fix, which is then persisted as {@code failed};
 * changes already written are left in place.
 */
@Service
public class FixExecutor {

    private static final Logger log = LoggerFactory.getLogger(FixExecutor.class);

    private final WorkspaceFileSystem workspace;
    private final ReviewRouter reviewRouter;
    private final ReviewArtifactBuilder artifactBuilder;
    private final MissionStore missionStore;
    private final MenderMetrics metrics;

    public FixExecutor(WorkspaceFileSystem workspace,
                       ReviewRouter reviewRouter,
                       ReviewArtifactBuilder artifactBuilder,
                       MissionStore missionStore,
                       MenderMetrics metrics) {
        this.workspace = workspace;
        this.reviewRouter = reviewRouter;
        this.artifactBuilder = artifactBuilder;
        this.missionStore = missionStore;
        this.metrics = metrics;
    }

    /**
     * Applies or routes {@code fix} according to {@code decision}.
     *
     * @return the fix in its resulting status: {@code applied} or {@code generated}
     * @throws FixConflictException if a change conflicts with the workspace
     */
    public Fix execute(Mission mission, Fix fix, GateDecision decision) {
        MdcContext.setFix(mission.key(), fix.id());
        if (decision.autoApply()) {
            return apply(fix);
        }
        return routeForReview(mission, fix, decision);
    }

    /**
     * Applies every change of {@code fix} and persists it as {@code applied}.
     */
    public Fix apply(Fix fix) {
        log.info("Applying fix {} ({} change(s))", fix.id(), fix.changes().size());
        for (FileChange change : fix.changes()) {
            try {
                applyChange(change);
            } catch (RuntimeException e) {
                log.error("Fix {} failed on {} {}: {}",
                        fix.id(), change.operation().value(), change.path(), e.getMessage());
                missionStore.saveFix(fix.withStatus(FixStatus.FAILED));
                metrics.recordFixOutcome("failed");
                throw e;
            }
        }

        Fix applied = fix.withStatus(FixStatus.APPLIED);
        missionStore.saveFix(applied);
        metrics.recordFixOutcome("applied");
        log.info("Fix {} applied", fix.id());
        return applied;
    }

    /**
     * Submits {@code fix} for human review. The fix stays {@code generated}.
     */
    public Fix routeForReview(Mission mission, Fix fix, GateDecision decision) {
        ReviewArtifact artifact = artifactBuilder.build(mission, fix, decision);
        log.info("Routing fix {} for review via {}", fix.id(), reviewRouter.name());
        reviewRouter.submitForReview(artifact.fixId(), artifact.title(), artifact.body());
        missionStore.saveFix(fix);
        metrics.recordFixOutcome("review");
        return fix;
    }

    private void applyChange(FileChange change) {
        String path = change.path();
        switch (change.operation()) {
            case CREATE -> {
                if (workspace.exists(path)) {
                    throw new AlreadyExistsException(path);
                }
                workspace.write(path, change.newContent());
                log.info("Created {}", path);
            }
            case MODIFY -> {
                String current = workspace.read(path)
                        .orElseThrow(() -> new NotFoundException(path, change.operation()));
                if (!current.equals(change.originalContent())) {
                    throw new ContentMismatchException(path);
                }
                workspace.write(path, change.newContent());
                log.info("Modified {}", path);
            }
            case DELETE -> {
                if (!workspace.delete(path)) {
                    throw new NotFoundException(path, change.operation());
                }
                log.info("Deleted {}", path);
            }
        }
    }
}
