package com.questrail.selective.observability;

/**
 * Main interface for receiving selection engine observability events.
 * Implementations can provide logging, progress display, or metrics.
 */
public interface SelectionObservabilitySink {
    /**
     * Called once per {@code beginTest}, after the decision is made.
     * @param event the decision details
     */
    void onTestDecision(TestDecisionEvent event);

    /**
     * Called when a block reports a failed outcome.
     * @param event the failure details
     */
    void onTestFailure(TestFailureEvent event);

    /**
     * Called when the engine tolerated a contract misuse.
     * @param event the anomaly
     */
    void onAnomaly(SelectionAnomalyEvent event);
}
