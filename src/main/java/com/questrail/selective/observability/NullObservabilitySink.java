package com.questrail.selective.observability;

/**
 * No-op implementation of SelectionObservabilitySink.
 */
public final class NullObservabilitySink implements SelectionObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTestDecision(TestDecisionEvent event) {}

    @Override
    public void onTestFailure(TestFailureEvent event) {}

    @Override
    public void onAnomaly(SelectionAnomalyEvent event) {}
}
