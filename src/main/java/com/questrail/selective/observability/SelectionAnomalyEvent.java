package com.questrail.selective.observability;

/**
 * Record representing misuse of the block contract that the engine
 * tolerated, such as a failure reported for a block that was never admitted.
 */
public record SelectionAnomalyEvent(
    String module,
    String message
) {
}
