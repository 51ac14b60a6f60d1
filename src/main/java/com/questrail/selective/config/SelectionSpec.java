package com.questrail.selective.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * SelectionSpec
 * -----------------------------------------------------------------------------
 * Immutable description of which modules and test blocks a run should
 * include or exclude.
 *
 * <h2>Role in the architecture</h2>
 * A {@code SelectionSpec} is built exactly once per run, before any test
 * block executes, and is consulted (never modified) by the execution
 * decider for every block.
 *
 * <h2>Set semantics</h2>
 * <ul>
 *   <li>Each of the four name sets collapses duplicates</li>
 *   <li>Sets keep insertion order, for display only</li>
 *   <li>Merging several sources is a per-kind union; the source of an entry
 *       never affects its kind</li>
 * </ul>
 *
 * Unrecognised lines are carried in {@link #unknown()} for diagnostics. They
 * never influence decisions and do not make the spec non-empty.
 */
public final class SelectionSpec
{
    private static final SelectionSpec EMPTY = builder().build();

    private final Set<String> includedModules;
    private final Set<String> excludedModules;
    private final Set<String> includedTests;
    private final Set<String> excludedTests;
    private final List<UnknownEntry> unknown;

    private SelectionSpec(Builder b) {
        this.includedModules = Collections.unmodifiableSet(new LinkedHashSet<>(b.includedModules));
        this.excludedModules = Collections.unmodifiableSet(new LinkedHashSet<>(b.excludedModules));
        this.includedTests = Collections.unmodifiableSet(new LinkedHashSet<>(b.includedTests));
        this.excludedTests = Collections.unmodifiableSet(new LinkedHashSet<>(b.excludedTests));
        this.unknown = List.copyOf(b.unknown);
    }

    /**
     * Returns the spec with no entries at all.
     */
    public static SelectionSpec empty() {
        return EMPTY;
    }

    public Set<String> includedModules() {
        return includedModules;
    }

    public Set<String> excludedModules() {
        return excludedModules;
    }

    public Set<String> includedTests() {
        return includedTests;
    }

    public Set<String> excludedTests() {
        return excludedTests;
    }

    public List<UnknownEntry> unknown() {
        return unknown;
    }

    /**
     * Returns {@code true} if no include or exclude entry is present.
     * Unknown entries are ignored.
     */
    public boolean isEmpty() {
        return includedModules.isEmpty()
                && excludedModules.isEmpty()
                && includedTests.isEmpty()
                && excludedTests.isEmpty();
    }

    /**
     * Returns {@code true} if only exclusions are configured.
     */
    public boolean isExclusionOnly() {
        return includedModules.isEmpty() && includedTests.isEmpty() && !isEmpty();
    }

    public boolean hasUnknowns() {
        return !unknown.isEmpty();
    }

    /**
     * Returns the names configured for the given kind.
     */
    public Set<String> valuesOf(SelectionKind kind) {
        Objects.requireNonNull(kind, "kind");
        return switch (kind) {
            case MODULE_INCLUDE -> includedModules;
            case MODULE_EXCLUDE -> excludedModules;
            case TEST_INCLUDE -> includedTests;
            case TEST_EXCLUDE -> excludedTests;
        };
    }

    /**
     * Returns every classified entry, grouped by kind.
     */
    public List<SelectionEntry> entries() {
        List<SelectionEntry> out = new ArrayList<>();
        for (SelectionKind kind : SelectionKind.values()) {
            for (String value : valuesOf(kind)) {
                out.add(new SelectionEntry(kind, value));
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SelectionSpec other)) {
            return false;
        }
        return includedModules.equals(other.includedModules)
                && excludedModules.equals(other.excludedModules)
                && includedTests.equals(other.includedTests)
                && excludedTests.equals(other.excludedTests)
                && unknown.equals(other.unknown);
    }

    @Override
    public int hashCode() {
        return Objects.hash(includedModules, excludedModules, includedTests, excludedTests, unknown);
    }

    @Override
    public String toString() {
        return "SelectionSpec{"
                + "includedModules=" + includedModules
                + ", excludedModules=" + excludedModules
                + ", includedTests=" + includedTests
                + ", excludedTests=" + excludedTests
                + ", unknown=" + unknown.size()
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<String> includedModules = new LinkedHashSet<>();
        private final Set<String> excludedModules = new LinkedHashSet<>();
        private final Set<String> includedTests = new LinkedHashSet<>();
        private final Set<String> excludedTests = new LinkedHashSet<>();
        private final Set<UnknownEntry> unknown = new LinkedHashSet<>();

        public Builder add(SelectionEntry entry) {
            Objects.requireNonNull(entry, "entry");
            switch (entry.kind()) {
                case MODULE_INCLUDE -> includedModules.add(entry.value());
                case MODULE_EXCLUDE -> excludedModules.add(entry.value());
                case TEST_INCLUDE -> includedTests.add(entry.value());
                case TEST_EXCLUDE -> excludedTests.add(entry.value());
            }
            return this;
        }

        public Builder add(SelectionKind kind, String value) {
            return add(new SelectionEntry(kind, value));
        }

        public Builder includeModule(String module) {
            return add(SelectionKind.MODULE_INCLUDE, module);
        }

        public Builder excludeModule(String module) {
            return add(SelectionKind.MODULE_EXCLUDE, module);
        }

        public Builder includeTest(String testName) {
            return add(SelectionKind.TEST_INCLUDE, testName);
        }

        public Builder excludeTest(String testName) {
            return add(SelectionKind.TEST_EXCLUDE, testName);
        }

        public Builder addUnknown(UnknownEntry entry) {
            unknown.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        /**
         * Unions every entry of {@code other} into this builder.
         */
        public Builder merge(SelectionSpec other) {
            Objects.requireNonNull(other, "other");
            other.entries().forEach(this::add);
            other.unknown().forEach(this::addUnknown);
            return this;
        }

        public SelectionSpec build() {
            return new SelectionSpec(this);
        }
    }
}
