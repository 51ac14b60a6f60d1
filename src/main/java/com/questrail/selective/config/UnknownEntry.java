package com.questrail.selective.config;

import java.util.Objects;

/**
 * An unrecognised selection line, kept for diagnostic display only.
 *
 * @param rawLine    the trimmed line as read
 * @param sourceFile the file (or source name) it was read from
 */
public record UnknownEntry(String rawLine, String sourceFile)
{
    public UnknownEntry {
        Objects.requireNonNull(rawLine, "rawLine");
        Objects.requireNonNull(sourceFile, "sourceFile");
    }
}
