package com.questrail.selective.observability;

import com.questrail.selective.api.ExecutionMode;
import com.questrail.selective.internal.decide.Decision;

/**
 * Record representing the engine's decision for one test block.
 */
public record TestDecisionEvent(
    String module,
    String testName,
    int line,
    ExecutionMode mode,
    Decision decision,
    int ordinalInModule
) {
    /**
     * Returns true if the block body is going to run.
     */
    public boolean isExecuted() {
        return decision.isExecute();
    }

    /**
     * Returns true for the first block reported for its module.
     */
    public boolean isFirstInModule() {
        return ordinalInModule == 1;
    }
}
