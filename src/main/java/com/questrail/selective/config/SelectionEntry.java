package com.questrail.selective.config;

import java.util.Objects;

/**
 * A single classified selection line.
 *
 * @param kind  what the entry selects or excludes
 * @param value the module or test block name; never blank
 */
public record SelectionEntry(SelectionKind kind, String value)
{
    public SelectionEntry {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }
}
