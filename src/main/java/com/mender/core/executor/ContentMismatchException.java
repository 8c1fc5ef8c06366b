package com.mender.core.executor;

import com.mender.core.model.ChangeOperation;

/** A modify change was synthesized against content that has since changed. */
public class ContentMismatchException extends FixConflictException {

    public ContentMismatchException(String path) {
        super(path, ChangeOperation.MODIFY,
                "Cannot modify " + path + ": current content differs from the content the fix was built against");
    }
}
