package com.questrail.selective.internal.decide;

import com.questrail.selective.api.ExecutionMode;
import com.questrail.selective.config.SelectionSpec;

import java.util.Objects;

/**
 * ExecutionDecider
 * -----------------------------------------------------------------------------
 * Pure, deterministic decision function answering "does this test block
 * run?".
 *
 * <h2>Role in the architecture</h2>
 * The decider consults an immutable {@link SelectionSpec} and nothing else.
 * It never touches counters; recording that a block was found, admitted or
 * skipped is the engine's job.
 *
 * <h2>Rule order</h2>
 * With an empty spec every block runs ({@link ExecutionMode#ALL}). Otherwise
 * the first matching rule wins:
 * <ol>
 *   <li>module excluded, or block name excluded → skip</li>
 *   <li>module included → run</li>
 *   <li>block name included → run</li>
 *   <li>no inclusion configured at all → run</li>
 *   <li>otherwise → skip</li>
 * </ol>
 * Exclusion always dominates inclusion, so a name that is both included and
 * excluded is skipped.
 */
public final class ExecutionDecider
{
    /**
     * Returns the execution mode implied by {@code spec}.
     */
    public ExecutionMode modeOf(SelectionSpec spec) {
        Objects.requireNonNull(spec, "spec");
        return spec.isEmpty() ? ExecutionMode.ALL : ExecutionMode.SELECTION;
    }

    /**
     * Decides whether the block {@code testName} in {@code module} runs.
     *
     * @param spec     the run's selection (must not be {@code null})
     * @param module   the containing module (must not be {@code null})
     * @param testName the block name (must not be {@code null}; may be empty)
     * @return the decision and the rule that produced it
     */
    public Decision decide(SelectionSpec spec, String module, String testName) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(testName, "testName");

        if (spec.isEmpty()) {
            return Decision.RUN_ALL;
        }

        if (spec.excludedModules().contains(module)) {
            return Decision.SKIP_EXCLUDED_MODULE;
        }
        if (spec.excludedTests().contains(testName)) {
            return Decision.SKIP_EXCLUDED_TEST;
        }

        if (spec.includedModules().contains(module)) {
            return Decision.RUN_INCLUDED_MODULE;
        }
        if (spec.includedTests().contains(testName)) {
            return Decision.RUN_INCLUDED_TEST;
        }

        // Blacklist only: anything not excluded runs.
        if (spec.includedModules().isEmpty() && spec.includedTests().isEmpty()) {
            return Decision.RUN_NOT_EXCLUDED;
        }
        return Decision.SKIP_NOT_SELECTED;
    }
}
