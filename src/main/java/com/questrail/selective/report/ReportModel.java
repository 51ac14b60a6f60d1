package com.questrail.selective.report;

import com.questrail.selective.api.ExecutionMode;
import com.questrail.selective.config.SelectionSpec;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * ReportModel
 * -----------------------------------------------------------------------------
 * Read-only snapshot of a run, assembled at run end and handed to a
 * {@link ReportRenderer}.
 *
 * <h2>Boundary</h2>
 * This is a data contract only. No formatting, colouring or layout lives
 * here; see {@link PlainTextReportFormatter} for the default text layout.
 *
 * @param mode         ALL or SELECTION
 * @param selections   the active selection, echoed for display
 * @param modules      one line item per module, first-seen order
 * @param aggregate    run-wide counters and categorized module lists
 * @param failures     details of failed blocks whose cause was reported
 * @param totalElapsed measured duration of the whole run
 * @param startedAt    wall-clock start of the run
 * @param finishedAt   wall-clock end of the run
 */
public record ReportModel(
        ExecutionMode mode,
        SelectionSpec selections,
        List<ModuleLineItem> modules,
        AggregateCounters aggregate,
        List<FailureDetail> failures,
        Duration totalElapsed,
        Instant startedAt,
        Instant finishedAt
) {
    public ReportModel {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(selections, "selections");
        Objects.requireNonNull(aggregate, "aggregate");
        Objects.requireNonNull(totalElapsed, "totalElapsed");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(finishedAt, "finishedAt");
        modules = List.copyOf(modules);
        failures = List.copyOf(failures);
    }

    public boolean isAllPassing() {
        return aggregate.isAllPassing();
    }

    public boolean isNoneFailing() {
        return aggregate.isNoneFailing();
    }
}
