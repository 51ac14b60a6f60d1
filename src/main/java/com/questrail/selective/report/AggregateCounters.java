package com.questrail.selective.report;

import java.util.List;

/**
 * AggregateCounters
 * -----------------------------------------------------------------------------
 * Run-wide counters, summed over every module, plus the categorized module
 * name lists shown in a summary.
 *
 * @param found               blocks found across all modules
 * @param passing             blocks counted as passing
 * @param failing             blocks that failed
 * @param modulesWithTests    modules with at least one found block, first-seen order
 * @param modulesWithoutTests known modules with no found block and not excluded
 * @param modulesExcluded     modules excluded by the selection, seen or not
 * @param modulesWithoutHook  modules whose blocks ran without calling the prologue
 */
public record AggregateCounters(
        int found,
        int passing,
        int failing,
        List<String> modulesWithTests,
        List<String> modulesWithoutTests,
        List<String> modulesExcluded,
        List<String> modulesWithoutHook
) {
    public AggregateCounters {
        modulesWithTests = List.copyOf(modulesWithTests);
        modulesWithoutTests = List.copyOf(modulesWithoutTests);
        modulesExcluded = List.copyOf(modulesExcluded);
        modulesWithoutHook = List.copyOf(modulesWithoutHook);
    }

    public int skipped() {
        return found - passing - failing;
    }

    public boolean isAllPassing() {
        return passing == found;
    }

    public boolean isNoneFailing() {
        return failing == 0;
    }
}
