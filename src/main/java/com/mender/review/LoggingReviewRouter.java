package com.mender.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records review requests in the application log. Used when no review system is configured.
 */
public class LoggingReviewRouter implements ReviewRouter {

    private static final Logger log = LoggerFactory.getLogger(LoggingReviewRouter.class);

    @Override
    public void submitForReview(String fixId, String title, String body) {
        log.info("Review requested for fix {}: {}", fixId, title);
        log.info("Review body for fix {}:\n{}", fixId, body);
    }

    @Override
    public String name() {
        return "log";
    }
}
