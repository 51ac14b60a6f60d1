package com.questrail.selective.api;

import com.questrail.selective.report.ReportModel;

import java.time.Duration;
import java.time.Instant;

/**
 * SelectiveTestEngine
 * -----------------------------------------------------------------------------
 * {@code SelectiveTestEngine} is the contract a test harness drives to run a
 * chosen subset of its test blocks and to collect pass/fail/skip counters.
 *
 * <h2>Two-phase block contract</h2>
 * Every participating test block performs the following sequence:
 * <pre>
 *   if (!engine.beginTest(module, name, line)) {
 *       return;                                  // skipped, body must not run
 *   }
 *   try {
 *       ... block body ...
 *   } catch (Throwable t) {
 *       engine.endTest(module, TestOutcome.FAILED, t);
 *   }
 * </pre>
 *
 * A block admitted by {@link #beginTest(String, String, int)} is counted as
 * passing immediately. The harness only has to report failure; reporting
 * {@link TestOutcome#PASSED} is accepted and changes nothing.
 *
 * <h2>What this interface does NOT do</h2>
 * <ul>
 *   <li>Discover test blocks or modules</li>
 *   <li>Read clocks (durations are measured by the caller)</li>
 *   <li>Format or print reports (see {@code ReportRenderer})</li>
 * </ul>
 *
 * <h2>Threading model</h2>
 * Blocks run one at a time. Implementations take no locks and must be driven
 * from a single thread.
 */
public interface SelectiveTestEngine
{
    /**
     * Decides whether a test block runs and records that it was found.
     *
     * @param moduleName the module containing the block (must not be {@code null})
     * @param testName   the block's name; may be empty for unnamed blocks
     * @param line       source line of the block, for diagnostics only
     * @return {@code true} if the block body must run, {@code false} if it is skipped
     */
    boolean beginTest(String moduleName, String testName, int line);

    /**
     * Reports the outcome of a block body admitted by {@link #beginTest}.
     *
     * @param moduleName the module passed to the matching {@code beginTest}
     * @param outcome    the outcome of the body
     */
    default void endTest(String moduleName, TestOutcome outcome) {
        endTest(moduleName, outcome, null);
    }

    /**
     * Reports the outcome of a block body, with the throwable that ended it.
     *
     * @param moduleName the module passed to the matching {@code beginTest}
     * @param outcome    the outcome of the body
     * @param cause      the failure cause; may be {@code null}
     */
    void endTest(String moduleName, TestOutcome outcome, Throwable cause);

    /**
     * Records a block that ran without calling {@link #beginTest}. Such a
     * block cannot be filtered; it is counted as found and passing.
     *
     * @param moduleName the module containing the block
     */
    void recordUnhookedBlock(String moduleName);

    /**
     * Adds an externally measured duration to a module's elapsed time.
     *
     * @param moduleName the module
     * @param elapsed    the measured duration, recorded as given
     */
    void recordModuleElapsed(String moduleName, Duration elapsed);

    /**
     * Returns the execution mode implied by the selection configuration, or
     * {@link ExecutionMode#ALL} when selective mode is disabled.
     */
    ExecutionMode mode();

    /**
     * Assembles a read-only report of the run so far.
     *
     * @param totalElapsed total measured run duration
     * @param startedAt    wall-clock run start
     * @param finishedAt   wall-clock run end
     * @return an immutable report model
     */
    ReportModel report(Duration totalElapsed, Instant startedAt, Instant finishedAt);
}
