package com.questrail.selective.config;

import java.util.Optional;

/**
 * SelectionKind
 * -----------------------------------------------------------------------------
 * The four kinds of selection entry, each bound to the case-sensitive line
 * prefix that introduces it in a selection file.
 *
 * <pre>
 *   utb:&lt;name&gt;     include test block
 *   xutb:&lt;name&gt;    exclude test block
 *   utm:&lt;name&gt;     include module
 *   xutm:&lt;name&gt;    exclude module
 * </pre>
 */
public enum SelectionKind
{
    TEST_INCLUDE("utb:"),
    TEST_EXCLUDE("xutb:"),
    MODULE_INCLUDE("utm:"),
    MODULE_EXCLUDE("xutm:");

    private final String prefix;

    SelectionKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Returns the kind whose prefix starts the given (already trimmed) line.
     * <p>
     * The prefixes never overlap ({@code xutb:} does not start with
     * {@code utb:}), so at most one kind matches.
     */
    public static Optional<SelectionKind> ofLine(String line) {
        for (SelectionKind kind : values()) {
            if (line.startsWith(kind.prefix)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
