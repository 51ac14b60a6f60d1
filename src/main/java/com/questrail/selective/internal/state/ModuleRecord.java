package com.questrail.selective.internal.state;

import com.questrail.selective.report.ModuleLineItem;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * ModuleRecord
 * -----------------------------------------------------------------------------
 * Mutable per-module counters for one run.
 *
 * <h2>Invariant</h2>
 * <blockquote>
 *     {@code passing + failing <= found} at all times, and {@code found}
 *     never decreases.
 * </blockquote>
 * Every mutator preserves it: passing is only added together with (or after)
 * a found increment, and a failure only converts an existing pass.
 *
 * Records never leave their {@link TestRegistry}; readers see them only as
 * immutable {@link ModuleLineItem}s.
 */
final class ModuleRecord
{
    private final String name;

    private int found;
    private int passing;
    private int failing;
    private boolean usesHook;
    private Duration elapsed = Duration.ZERO;

    private AdmittedBlock lastAdmitted;

    ModuleRecord(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    String name() {
        return name;
    }

    int found() {
        return found;
    }

    int passing() {
        return passing;
    }

    int failing() {
        return failing;
    }

    boolean usesHook() {
        return usesHook;
    }

    /**
     * The most recent block of this module that was counted as passing.
     * Skipped blocks never replace it.
     */
    Optional<AdmittedBlock> lastAdmitted() {
        return Optional.ofNullable(lastAdmitted);
    }

    // ---------------------------------------------------------------------
    // Mutators
    // ---------------------------------------------------------------------

    void recordFound() {
        found++;
    }

    void markHooked() {
        usesHook = true;
    }

    /**
     * Counts the current block as passing, ahead of its outcome, and remembers
     * it for failure attribution.
     */
    void recordAdmitted(String testName, int line) {
        Objects.requireNonNull(testName, "testName");
        if (passing + failing >= found) {
            throw new IllegalStateException("No admitted block left to count in module " + name);
        }
        passing++;
        lastAdmitted = new AdmittedBlock(testName, line);
    }

    /**
     * Converts one optimistic pass into a failure.
     *
     * @return {@code false} if there was no pass to convert; nothing changes
     */
    boolean convertPassToFailure() {
        if (passing == 0) {
            return false;
        }
        passing--;
        failing++;
        return true;
    }

    void addElapsed(Duration duration) {
        elapsed = elapsed.plus(Objects.requireNonNull(duration, "duration"));
    }

    ModuleLineItem toLineItem() {
        return new ModuleLineItem(name, passing, failing, found, elapsed, usesHook);
    }
}
