package com.mender.review;

import com.mender.workspace.LocalWorkspaceFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the {@link ReviewRouter} from {@code mender.review.provider}.
 */
@Configuration
public class ReviewConfig {

    private static final Logger log = LoggerFactory.getLogger(ReviewConfig.class);

    @Bean
    @ConditionalOnProperty(name = "mender.review.provider", havingValue = "log", matchIfMissing = true)
    public ReviewRouter loggingReviewRouter() {
        log.info("Review hand-off: application log");
        return new LoggingReviewRouter();
    }

    @Bean
    @ConditionalOnProperty(name = "mender.review.provider", havingValue = "git")
    public ReviewRouter gitReviewRouter(LocalWorkspaceFileSystem workspace, ReviewProperties properties) {
        log.info("Review hand-off: git branches in {} (remote '{}', push {})",
                workspace.getRoot(), properties.getRemote(), properties.isPush());
        return new GitReviewRouter(workspace.getRoot(), properties);
    }
}
