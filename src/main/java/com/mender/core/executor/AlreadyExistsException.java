package com.mender.core.executor;

import com.mender.core.model.ChangeOperation;

/** A create change targets a path that already has content. */
public class AlreadyExistsException extends FixConflictException {

    public AlreadyExistsException(String path) {
        super(path, ChangeOperation.CREATE, "Cannot create " + path + ": file already exists");
    }
}
