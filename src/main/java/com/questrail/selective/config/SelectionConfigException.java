package com.questrail.selective.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Indicates that a selection file could not be loaded.
 *
 * This is fatal to startup: a run must not begin without a valid (possibly
 * empty) {@link SelectionSpec}. Malformed file <em>content</em> never raises
 * this exception; it degrades to {@link UnknownEntry} diagnostics instead.
 */
public final class SelectionConfigException extends RuntimeException
{
    /**
     * Why a selection file could not be loaded.
     */
    public enum Reason {
        /** The path does not exist. */
        NOT_FOUND,

        /** The path exists but could not be read, a directory included. */
        READ_FAILED
    }

    private final Reason reason;
    private final Path path;

    public SelectionConfigException(Reason reason, Path path, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.path = Objects.requireNonNull(path, "path");
    }

    public SelectionConfigException(Reason reason, Path path, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.path = Objects.requireNonNull(path, "path");
    }

    public static SelectionConfigException notFound(Path path) {
        return new SelectionConfigException(Reason.NOT_FOUND, path,
                "Selection file not found: " + path);
    }

    public static SelectionConfigException readFailed(Path path, Throwable cause) {
        return new SelectionConfigException(Reason.READ_FAILED, path,
                "Failed to read selection file: " + path, cause);
    }

    public Reason reason() {
        return reason;
    }

    public Path path() {
        return path;
    }
}
