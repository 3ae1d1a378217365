package com.libragraph.checkpoint.core.checkpoint;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Normal form for file paths inside a checkpoint: relative, {@code /}-separated,
 * no empty, {@code .} or {@code ..} segments.
 */
final class RelativePaths {

    private RelativePaths() {
    }

    static String validate(String path) {
        Objects.requireNonNull(path, "path cannot be null");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path cannot be empty");
        }
        if (path.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("path must use '/' separators: " + path);
        }
        if (path.startsWith("/")) {
            throw new IllegalArgumentException("path must be relative: " + path);
        }
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("Invalid path segment in: " + path);
            }
        }
        return path;
    }

    static String of(Path root, Path file) {
        Path relative = root.relativize(file);
        StringBuilder sb = new StringBuilder();
        for (Path part : relative) {
            if (sb.length() > 0) sb.append('/');
            sb.append(part.toString());
        }
        return sb.toString();
    }

    static Path resolve(Path root, String path) {
        Path resolved = root;
        for (String segment : validate(path).split("/")) {
            resolved = resolved.resolve(segment);
        }
        return resolved;
    }
}
