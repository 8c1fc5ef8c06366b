package com.mender.core.executor;

import com.mender.core.model.ChangeOperation;

/**
 * Raised when a file change cannot be applied because the workspace no longer
 * looks the way the fix expects.
 */
public abstract class FixConflictException extends RuntimeException {

    private final String path;
    private final ChangeOperation operation;

    protected FixConflictException(String path, ChangeOperation operation, String message) {
        super(message);
        this.path = path;
        this.operation = operation;
    }

    public String getPath() {
        return path;
    }

    public ChangeOperation getOperation() {
        return operation;
    }
}
