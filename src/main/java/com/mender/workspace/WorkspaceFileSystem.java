package com.mender.workspace;

import java.util.List;
import java.util.Optional;

/**
 * File access to the codebase being healed.
 * <p>
 * Paths are workspace-relative; a leading slash is tolerated and still resolves
 * inside the workspace. Paths escaping the workspace are rejected with
 * {@link IllegalArgumentException}.
 */
public interface WorkspaceFileSystem {

    /** Current content of {@code path}, or empty when the file does not exist. */
    Optional<String> read(String path);

    boolean exists(String path);

    /** Creates or overwrites {@code path}, creating parent directories as needed. */
    void write(String path, String content);

    /**
     * Deletes {@code path}.
     *
     * @return false if there was nothing to delete
     */
    boolean delete(String path);

    /**
     * Workspace-relative paths of regular files matching any of the glob patterns, sorted.
     */
    List<String> list(List<String> globs);
}
