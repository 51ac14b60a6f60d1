package com.questrail.selective.internal.decide;

/**
 * Decision
 * -----------------------------------------------------------------------------
 * Outcome of {@link ExecutionDecider#decide}, together with the rule that
 * produced it. The rule is carried for diagnostics only; callers act on
 * {@link #isExecute()}.
 */
public enum Decision
{
    /** No selection configured; every block runs. */
    RUN_ALL(true),

    /** The block's module is excluded. */
    SKIP_EXCLUDED_MODULE(false),

    /** The block's name is excluded. */
    SKIP_EXCLUDED_TEST(false),

    /** The block's module is explicitly included. */
    RUN_INCLUDED_MODULE(true),

    /** The block's name is explicitly included. */
    RUN_INCLUDED_TEST(true),

    /** Only exclusions are configured and none matched. */
    RUN_NOT_EXCLUDED(true),

    /** Inclusions are configured and none matched. */
    SKIP_NOT_SELECTED(false);

    private final boolean execute;

    Decision(boolean execute) {
        this.execute = execute;
    }

    public boolean isExecute() {
        return execute;
    }
}
