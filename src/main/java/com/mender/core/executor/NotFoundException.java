package com.mender.core.executor;

import com.mender.core.model.ChangeOperation;

public class NotFoundException extends FixConflictException {

    public NotFoundException(String path, ChangeOperation operation) {
        super(path, operation, "Cannot %s %s: file not found".formatted(operation.name().toLowerCase(), path));
    }
}
