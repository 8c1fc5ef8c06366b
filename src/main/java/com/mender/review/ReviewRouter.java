package com.mender.review;

/**
 * Hands a fix that needs a human to the team's review system.
 */
public interface ReviewRouter {

    /**
     * Submits the fix for review.
     *
     * @param fixId id of the fix being reviewed
     * @param title short review title
     * @param body  full review description
     * @throws ReviewRoutingException if the review system rejects the submission
     */
    void submitForReview(String fixId, String title, String body);

    /** Short name of the router, reported by health checks and logs. */
    String name();
}
