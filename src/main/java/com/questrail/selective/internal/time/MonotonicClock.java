package com.questrail.selective.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for measuring test block and run durations.
 *
 * <h2>Binding invariant</h2>
 * Elapsed times reported for modules and runs MUST be computed from a
 * monotonic source. Wall-clock time is used only for the start and end
 * timestamps shown in a report.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
