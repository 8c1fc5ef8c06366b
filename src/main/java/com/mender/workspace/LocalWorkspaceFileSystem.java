package com.mender.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * {@link WorkspaceFileSystem} over a directory on the local disk.
 * <p>
 * Build-tool and VCS directories (e.g. {@code .git}, {@code node_modules})
 * are skipped when listing.
 */
@Component
public class LocalWorkspaceFileSystem implements WorkspaceFileSystem {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkspaceFileSystem.class);

    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            ".gradle", "dist", "out", ".mvn", ".next"
    );

    private final Path root;

    @Autowired
    public LocalWorkspaceFileSystem(WorkspaceProperties properties) {
        this(Path.of(properties.getRoot()));
    }

    public LocalWorkspaceFileSystem(Path root) {
        this.root = root.toAbsolutePath().normalize();
        log.info("Workspace root: {}", this.root);
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public Optional<String> read(String path) {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    @Override
    public void write(String path, String content) {
        Path file = resolve(path);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} chars)", path, content.length());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    @Override
    public boolean delete(String path) {
        try {
            return Files.deleteIfExists(resolve(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + path, e);
        }
    }

    @Override
    public List<String> list(List<String> globs) {
        if (globs == null || globs.isEmpty() || !Files.isDirectory(root)) {
            return List.of();
        }
        var matchers = new ArrayList<PathMatcher>();
        for (String glob : globs) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(relative -> !inIgnoredDir(relative))
                    .filter(relative -> matchers.stream().anyMatch(m -> m.matches(relative)))
                    .map(relative -> relative.toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list workspace files under " + root, e);
        }
    }

    /**
     * Resolves a workspace-relative path, rejecting anything that escapes the root.
     */
    Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path is required");
        }
        String relative = path.startsWith("/") ? path.substring(1) : path;
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes workspace: " + path);
        }
        return resolved;
    }

    private boolean inIgnoredDir(Path relative) {
        for (Path part : relative) {
            if (IGNORE_DIRS.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }
}
