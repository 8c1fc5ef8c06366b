package com.mender.review;

/**
 * Thrown when a fix cannot be handed off for review.
 */
public class ReviewRoutingException extends RuntimeException {

    public ReviewRoutingException(String message) {
        super(message);
    }

    public ReviewRoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
