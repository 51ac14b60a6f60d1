package com.questrail.selective.report;

import java.time.Duration;
import java.util.Objects;

/**
 * One report line per module.
 *
 * @param name     module name
 * @param passing  blocks counted as passing
 * @param failing  blocks that failed
 * @param found    blocks found, skipped ones included
 * @param elapsed  accumulated measured duration of the module's blocks
 * @param usesHook whether any block of the module called the prologue
 */
public record ModuleLineItem(
        String name,
        int passing,
        int failing,
        int found,
        Duration elapsed,
        boolean usesHook
) {
    public ModuleLineItem {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(elapsed, "elapsed");
    }

    /**
     * Blocks found but not run.
     */
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
