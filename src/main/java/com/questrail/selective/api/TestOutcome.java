package com.questrail.selective.api;

/**
 * TestOutcome
 * -----------------------------------------------------------------------------
 * Result of running the body of a test block that was admitted by
 * {@link SelectiveTestEngine#beginTest(String, String, int)}.
 *
 * <p>Only {@link #FAILED} changes the counters. A block is counted as passing
 * at the moment it is admitted; the harness reports {@link #PASSED} purely
 * for symmetry (or not at all).</p>
 */
public enum TestOutcome
{
    /** The block body completed normally. */
    PASSED,

    /** The block body terminated abnormally (assertion failure, exception). */
    FAILED
}
