package com.questrail.selective.api;

/**
 * ExecutionMode
 * -----------------------------------------------------------------------------
 * The context a run executes in, derived from the selection configuration.
 */
public enum ExecutionMode
{
    /** No include or exclude entry is configured; every block runs. */
    ALL("All"),

    /** At least one include or exclude entry is configured. */
    SELECTION("Selection");

    private final String label;

    ExecutionMode(String label) {
        this.label = label;
    }

    /**
     * Returns the human-readable label used in reports.
     */
    public String label() {
        return label;
    }
}
