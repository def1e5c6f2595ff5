package com.autosort.models;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Per-file result handed back to callers. Always carries a non-empty path.
 */
public final class ResolutionOutcome {

    public static final String SENTINEL = "Uncategorized";

    private final Path file;
    private final String path;
    private final ResolutionStatus status;
    private final String detail;

    private ResolutionOutcome(Path file, String path, ResolutionStatus status, String detail) {
        this.file = file;
        this.path = path == null || path.isBlank() ? SENTINEL : path;
        this.status = Objects.requireNonNull(status, "status");
        this.detail = detail;
    }

    public static ResolutionOutcome resolved(Path file, String path, ResolutionStatus status) {
        return new ResolutionOutcome(file, path, status, null);
    }

    public static ResolutionOutcome cacheHit(Path file, String path) {
        return new ResolutionOutcome(file, path, ResolutionStatus.CACHED, null);
    }

    public static ResolutionOutcome cancelled(Path file) {
        return new ResolutionOutcome(file, SENTINEL, ResolutionStatus.CANCELLED, null);
    }

    public static ResolutionOutcome failed(Path file, String path, String detail) {
        return new ResolutionOutcome(file, path, ResolutionStatus.FAILED, detail);
    }

    public Path getFile() {
        return file;
    }

    public String getPath() {
        return path;
    }

    public ResolutionStatus getStatus() {
        return status;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isCancelled() {
        return status == ResolutionStatus.CANCELLED;
    }

    @Override
    public String toString() {
        return file + " -> " + path + " (" + status.getLabel() + ")";
    }
}
