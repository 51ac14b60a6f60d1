package com.questrail.selective.internal.state;

import com.questrail.selective.config.SelectionSpec;
import com.questrail.selective.report.AggregateCounters;
import com.questrail.selective.report.ModuleLineItem;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * TestRegistry
 * -----------------------------------------------------------------------------
 * The single piece of mutable state of a run: one {@link ModuleRecord} per
 * module, created lazily on the first event for that module. Counters change
 * only through the registry's operations; readers get {@link ModuleLineItem}s.
 *
 * <h2>Ordering</h2>
 * Records keep first-seen order for display. Nothing in the decision or
 * counting logic depends on that order.
 *
 * <h2>Threading model</h2>
 * Not thread-safe. A registry belongs to exactly one engine, driven from one
 * thread.
 */
public final class TestRegistry
{
    private final Map<String, ModuleRecord> records = new LinkedHashMap<>();

    ModuleRecord getOrCreate(String module) {
        Objects.requireNonNull(module, "module");
        return records.computeIfAbsent(module, ModuleRecord::new);
    }

    /**
     * Counts a block that called the engine's prologue, and an optimistic
     * pass for it when {@code admitted}.
     *
     * @return the number of blocks found in {@code module} so far
     */
    public int recordBlock(String module, String testName, int line, boolean admitted) {
        Objects.requireNonNull(testName, "testName");
        ModuleRecord record = getOrCreate(module);
        record.markHooked();
        record.recordFound();
        if (admitted) {
            record.recordAdmitted(testName, line);
        }
        return record.found();
    }

    /**
     * Counts a block that ran without calling the engine's prologue. Such a
     * block is always admitted.
     */
    public void recordUnhookedBlock(String module) {
        ModuleRecord record = getOrCreate(module);
        record.recordFound();
        record.recordAdmitted("", 0);
    }

    /**
     * Converts one optimistic pass of {@code module} into a failure.
     *
     * @return the block the failure is attributed to, or empty if the module
     *         has no pass to convert; in that case nothing changes
     */
    public Optional<AdmittedBlock> recordFailure(String module) {
        ModuleRecord record = records.get(module);
        if (record == null || !record.convertPassToFailure()) {
            return Optional.empty();
        }
        return record.lastAdmitted();
    }

    public void addElapsed(String module, Duration elapsed) {
        getOrCreate(module).addElapsed(elapsed);
    }

    public Optional<ModuleLineItem> find(String module) {
        return Optional.ofNullable(records.get(module)).map(ModuleRecord::toLineItem);
    }

    public int size() {
        return records.size();
    }

    /**
     * Returns an immutable line item per module, in first-seen order.
     */
    public List<ModuleLineItem> lineItems() {
        return records.values().stream()
                .map(ModuleRecord::toLineItem)
                .toList();
    }

    /**
     * Sums all records and categorizes module names.
     *
     * @param spec         the run's selection; its excluded modules are listed
     *                     whether or not they were ever seen
     * @param knownModules every module name the host knows of, in host order
     * @return a consistent snapshot of the run-wide counters
     */
    public AggregateCounters snapshot(SelectionSpec spec, Collection<String> knownModules) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(knownModules, "knownModules");

        int found = 0;
        int passing = 0;
        int failing = 0;
        List<String> withTests = new ArrayList<>();
        List<String> withoutHook = new ArrayList<>();

        for (ModuleRecord r : records.values()) {
            found += r.found();
            passing += r.passing();
            failing += r.failing();
            if (r.found() > 0) {
                withTests.add(r.name());
                if (!r.usesHook()) {
                    withoutHook.add(r.name());
                }
            }
        }

        Set<String> withoutTests = new LinkedHashSet<>(knownModules);
        withoutTests.removeAll(withTests);
        withoutTests.removeAll(spec.excludedModules());

        return new AggregateCounters(
                found,
                passing,
                failing,
                withTests,
                List.copyOf(withoutTests),
                List.copyOf(spec.excludedModules()),
                withoutHook);
    }
}
