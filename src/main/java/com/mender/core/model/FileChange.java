package com.mender.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * A single file operation within a fix.
 *
 * @param path            workspace-relative path
 * @param operation       create, modify or delete
 * @param originalContent expected current content; required for modify
 * @param newContent      content after the change (empty for delete)
 * @param reasoning       why the change addresses its finding
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileChange(
    String path,
    ChangeOperation operation,
    String originalContent,
    String newContent,
    String reasoning
) implements Serializable {

    public FileChange {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("FileChange path is required");
        }
        if (operation == null) {
            throw new IllegalArgumentException("FileChange operation is required");
        }
        if (operation == ChangeOperation.MODIFY && originalContent == null) {
            throw new IllegalArgumentException("Modify of " + path + " requires originalContent");
        }
        if (newContent == null) newContent = "";
    }
}
