package com.questrail.selective.report;

import com.questrail.selective.api.ExecutionMode;
import com.questrail.selective.config.SelectionSpec;
import com.questrail.selective.config.UnknownEntry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * PlainTextReportFormatter
 * -----------------------------------------------------------------------------
 * Lays out a {@link ReportModel} as plain, uncoloured text lines:
 *
 * <pre>
 * [unittest] Start:   2026-10-17T09:00:00Z
 * [unittest] Mode:    Selection
 * [unittest]            block:  add
 * [unittest]          test.mod1 - 1 passed, 0 failed, 2 found - 0.412 ms
 * [unittest]          ==================================================
 * [unittest] Summary: 3 found: 1 passed, 0 failed
 * ...
 * </pre>
 *
 * The categorized module lists are printed only in {@link ExecutionMode#ALL};
 * their counts are always printed. Lists are sorted for display.
 */
public final class PlainTextReportFormatter
{
    static final String BLANK = "[unittest]         ";
    static final String START = "[unittest] Start:  ";
    static final String MODE = "[unittest] Mode:   ";
    static final String SUMMARY = "[unittest] Summary:";
    static final String LIST = "[unittest] List:   ";
    static final String ELAPSED = "[unittest] Elapsed:";
    static final String END = "[unittest] End:    ";
    static final String FAILED = "[unittest] Assertion Failed!";
    static final String DETAIL = "          ";

    static final String WITH_TESTS = "Module(s) with unit test";
    static final String WITHOUT_TESTS = "Module(s) without unit test";
    static final String EXCLUDED = "Module(s) excluded";

    private static final String BAR = "=".repeat(50);

    public List<String> format(ReportModel report) {
        Objects.requireNonNull(report, "report");
        List<String> out = new ArrayList<>();

        out.add(START + " " + report.startedAt());
        out.add(MODE + " " + report.mode().label());
        if (report.mode() == ExecutionMode.SELECTION) {
            appendSelections(out, report.selections());
        }
        appendUnknowns(out, report.selections());

        for (ModuleLineItem item : report.modules()) {
            out.add(String.format(Locale.ROOT, "%s %s - %d passed, %d failed, %d found - %s",
                    BLANK, item.name(), item.passing(), item.failing(), item.found(),
                    formatElapsed(item.elapsed())));
        }

        for (FailureDetail failure : report.failures()) {
            appendFailure(out, failure);
        }

        AggregateCounters all = report.aggregate();
        if (report.mode() == ExecutionMode.ALL) {
            out.add(BLANK + " " + BAR);
            appendModulesWithTests(out, all);
            appendCategory(out, WITHOUT_TESTS, all.modulesWithoutTests());
            appendCategory(out, EXCLUDED, all.modulesExcluded());
        }

        out.add(BLANK + " " + BAR);
        out.add(String.format(Locale.ROOT, "%s %d found: %d passed, %d failed",
                SUMMARY, all.found(), all.passing(), all.failing()));
        out.add(String.format(Locale.ROOT, "%s %d %s",
                BLANK, all.modulesWithTests().size(), WITH_TESTS.toLowerCase(Locale.ROOT)));
        out.add(String.format(Locale.ROOT, "%s %d %s",
                BLANK, all.modulesWithoutTests().size(), WITHOUT_TESTS.toLowerCase(Locale.ROOT)));
        out.add(String.format(Locale.ROOT, "%s %d %s",
                BLANK, all.modulesExcluded().size(), EXCLUDED.toLowerCase(Locale.ROOT)));
        out.add(ELAPSED + " " + formatElapsed(report.totalElapsed()));
        out.add(END + " " + report.finishedAt());
        return out;
    }

    /**
     * Formats a duration as milliseconds with microsecond precision.
     */
    public static String formatElapsed(Duration elapsed) {
        long micros = elapsed.toNanos() / 1_000L;
        return String.format(Locale.ROOT, "%.3f ms", micros / 1_000.0);
    }

    private static void appendSelections(List<String> out, SelectionSpec spec) {
        for (String module : spec.includedModules()) {
            out.add(BLANK + "   module:  " + module);
        }
        for (String module : spec.excludedModules()) {
            out.add(BLANK + "   xmodule: " + module);
        }
        for (String test : spec.includedTests()) {
            out.add(BLANK + "   block:   " + test);
        }
        for (String test : spec.excludedTests()) {
            out.add(BLANK + "   xblock:  " + test);
        }
    }

    private static void appendUnknowns(List<String> out, SelectionSpec spec) {
        for (UnknownEntry entry : spec.unknown()) {
            out.add(BLANK + "   x:       " + entry.rawLine() + " (" + entry.sourceFile() + ")");
        }
    }

    private static void appendFailure(List<String> out, FailureDetail failure) {
        String message = failure.message().isEmpty() ? failure.exceptionType() : failure.message();
        out.add(FAILED);
        out.add(DETAIL + " Message: " + message);
        out.add(DETAIL + " Module:  " + failure.module());
        out.add(DETAIL + " Block:   " + failure.testName() + " (" + failure.line() + ")");
        if (!failure.file().isEmpty()) {
            out.add(DETAIL + " File:    " + failure.file() + " (" + failure.throwLine() + ")");
        }
        for (String frame : failure.trace()) {
            out.add(DETAIL + " Trace:   " + frame);
        }
        if (failure.traceTruncated()) {
            out.add(DETAIL + " Trace:   ...  (skipping)");
        }
    }

    private static void appendModulesWithTests(List<String> out, AggregateCounters all) {
        out.add(String.format(Locale.ROOT, "%s %s (%d)", LIST, WITH_TESTS, all.modulesWithTests().size()));
        out.add(BLANK + " Module(s) without prologue code have asterisk (*)");

        Set<String> withoutHook = new HashSet<>(all.modulesWithoutHook());
        for (String module : sorted(all.modulesWithTests())) {
            out.add(BLANK + "     " + module + (withoutHook.contains(module) ? " *" : ""));
        }
    }

    private static void appendCategory(List<String> out, String label, List<String> modules) {
        out.add(String.format(Locale.ROOT, "%s %s (%d)", LIST, label, modules.size()));
        for (String module : sorted(modules)) {
            out.add(BLANK + "     " + module);
        }
    }

    private static List<String> sorted(Collection<String> names) {
        List<String> copy = new ArrayList<>(names);
        copy.sort(null);
        return copy;
    }
}
