package com.mender.core.engine;

import java.time.Duration;

/**
 * A collaborator call did not finish within the configured bound.
 */
public class CollaboratorTimeoutException extends RuntimeException {

    private final String step;

    public CollaboratorTimeoutException(String step, Duration timeout) {
        super("%s did not complete within %d s".formatted(step, timeout.toSeconds()));
        this.step = step;
    }

    public String getStep() {
        return step;
    }
}
