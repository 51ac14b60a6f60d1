package com.questrail.selective.core;

import com.questrail.selective.api.ExecutionMode;
import com.questrail.selective.api.TestOutcome;
import com.questrail.selective.config.SelectionSpec;
import com.questrail.selective.internal.decide.Decision;
import com.questrail.selective.observability.RecordingObservabilitySink;
import com.questrail.selective.observability.SelectionAnomalyEvent;
import com.questrail.selective.observability.TestDecisionEvent;
import com.questrail.selective.report.AggregateCounters;
import com.questrail.selective.report.FailureDetail;
import com.questrail.selective.report.ModuleLineItem;
import com.questrail.selective.report.ReportModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultSelectiveTestEngineTest
 * -----------------------------------------------------------------------------
 * Drives the engine through the two-phase block contract and checks the
 * counters and report it produces.
 */
class DefaultSelectiveTestEngineTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
    }

    private DefaultSelectiveTestEngine engine(SelectionSpec spec, String... knownModules) {
        return new DefaultSelectiveTestEngine(true, spec, List.of(knownModules), sink);
    }

    private static ReportModel report(DefaultSelectiveTestEngine engine) {
        return engine.report(Duration.ofMillis(10), T0, T0.plusMillis(10));
    }

    private static ModuleLineItem item(ReportModel report, String module) {
        return report.modules().stream()
                .filter(m -> m.name().equals(module))
                .findFirst()
                .orElseThrow();
    }

    // ---------------------------------------------------------------------
    // Decisions
    // ---------------------------------------------------------------------

    @Test
    void emptySpecRunsEveryBlock() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.empty());

        assertTrue(engine.beginTest("m1", "a", 10));
        assertTrue(engine.beginTest("m2", "", 20));
        assertEquals(ExecutionMode.ALL, engine.mode());
    }

    @Test
    void includedTestRunsOnlyThatName() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.builder().includeTest("add").build());

        assertTrue(engine.beginTest("m1", "add", 1));
        assertTrue(engine.beginTest("m2", "add", 1));
        assertFalse(engine.beginTest("m1", "sub", 2));
        assertEquals(ExecutionMode.SELECTION, engine.mode());
    }

    @Test
    void excludedModuleSkipsAllItsBlocks() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.builder().excludeModule("M").build());

        assertFalse(engine.beginTest("M", "a", 1));
        assertFalse(engine.beginTest("M", "b", 2));
        assertTrue(engine.beginTest("N", "a", 1));
    }

    @Test
    void exclusionBeatsInclusion() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.builder()
                .includeTest("add")
                .excludeTest("add")
                .build());

        assertFalse(engine.beginTest("m", "add", 1));
    }

    // ---------------------------------------------------------------------
    // Counters
    // ---------------------------------------------------------------------

    @Test
    void foundCountsEveryCallPassingOnlyAdmittedOnes() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.builder().includeTest("add").build());

        engine.beginTest("m", "add", 1);
        engine.beginTest("m", "sub", 2);
        engine.beginTest("m", "sub", 2);

        ModuleLineItem m = item(report(engine), "m");
        assertEquals(3, m.found());
        assertEquals(1, m.passing());
        assertEquals(0, m.failing());
        assertEquals(2, m.skipped());
    }

    @Test
    void repeatedBeginDoubleCountsFound() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.empty());

        engine.beginTest("m", "a", 1);
        engine.beginTest("m", "a", 1);

        assertEquals(2, item(report(engine), "m").found());
        assertEquals(2, item(report(engine), "m").passing());
    }

    @Test
    void passedOutcomeChangesNothing() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.empty());

        engine.beginTest("m", "a", 1);
        engine.endTest("m", TestOutcome.PASSED);

        ModuleLineItem m = item(report(engine), "m");
        assertEquals(1, m.passing());
        assertEquals(0, m.failing());
    }

    @Test
    void failedOutcomeConvertsPassToFailure() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.empty());

        assertTrue(engine.beginTest("m", "x", 7));
        engine.endTest("m", TestOutcome.FAILED);

        ReportModel report = report(engine);
        ModuleLineItem m = item(report, "m");
        assertEquals(1, m.found());
        assertEquals(0, m.passing());
        assertEquals(1, m.failing());

        AggregateCounters all = report.aggregate();
        assertEquals(1, all.found());
        assertEquals(0, all.passing());
        assertEquals(1, all.failing());
        assertFalse(report.isNoneFailing());
    }

    @Test
    void failureWithCauseIsAttributedToTheCurrentBlock() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.empty());

        engine.beginTest("test.failing", "div", 42);
        engine.endTest("test.failing", TestOutcome.FAILED, new AssertionError("10 / 0"));

        List<FailureDetail> failures = report(engine).failures();
        assertEquals(1, failures.size());
        FailureDetail detail = failures.get(0);
        assertEquals("test.failing", detail.module());
        assertEquals("div", detail.testName());
        assertEquals(42, detail.line());
        assertEquals("10 / 0", detail.message());
        assertEquals(AssertionError.class.getName(), detail.exceptionType());
        assertEquals(1, sink.getFailures().size());
    }

    @Test
    void failureAfterSkippedBlockIsAttributedToLastAdmittedOne() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.builder().excludeTest("sub").build());

        assertTrue(engine.beginTest("m", "add", 10));
        assertFalse(engine.beginTest("m", "sub", 20));
        engine.endTest("m", TestOutcome.FAILED, new AssertionError("late"));

        FailureDetail detail = report(engine).failures().get(0);
        assertEquals("add", detail.testName());
        assertEquals(10, detail.line());
    }

    @Test
    void failureForUnadmittedBlockIsIgnored() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.builder().includeTest("add").build());

        engine.beginTest("m", "sub", 1);
        engine.endTest("m", TestOutcome.FAILED);
        engine.endTest("never-seen", TestOutcome.FAILED);

        ModuleLineItem m = item(report(engine), "m");
        assertEquals(0, m.passing());
        assertEquals(0, m.failing());
        assertEquals(1, m.found());
        assertTrue(sink.hasEventOfType(SelectionAnomalyEvent.class));
        assertTrue(report(engine).modules().stream().noneMatch(i -> i.name().equals("never-seen")));
    }

    @Test
    void unhookedBlocksCountButAreFlagged() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.empty());

        engine.recordUnhookedBlock("plain");
        engine.recordUnhookedBlock("plain");
        engine.endTest("plain", TestOutcome.FAILED);

        ReportModel report = report(engine);
        ModuleLineItem plain = item(report, "plain");
        assertEquals(2, plain.found());
        assertEquals(1, plain.passing());
        assertEquals(1, plain.failing());
        assertFalse(plain.usesHook());
        assertEquals(List.of("plain"), report.aggregate().modulesWithoutHook());
    }

    @Test
    void moduleElapsedAccumulates() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.empty());

        engine.beginTest("m", "a", 1);
        engine.recordModuleElapsed("m", Duration.ofMillis(4));
        engine.recordModuleElapsed("m", Duration.ofMillis(6));

        assertEquals(Duration.ofMillis(10), item(report(engine), "m").elapsed());
    }

    // ---------------------------------------------------------------------
    // Pass-through build
    // ---------------------------------------------------------------------

    @Test
    void passThroughBuildNeverFiltersOrCounts() {
        SelectionSpec spec = SelectionSpec.builder().excludeModule("M").build();
        DefaultSelectiveTestEngine engine = new DefaultSelectiveTestEngine(false, spec, List.of(), sink);

        assertTrue(engine.beginTest("M", "a", 1));
        engine.endTest("M", TestOutcome.FAILED);
        engine.recordUnhookedBlock("M");

        ReportModel report = report(engine);
        assertTrue(report.modules().isEmpty());
        assertEquals(0, report.aggregate().found());
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void passThroughBuildReportsAllModeWithoutSelections() {
        SelectionSpec spec = SelectionSpec.builder().includeTest("add").excludeModule("M").build();
        DefaultSelectiveTestEngine engine = new DefaultSelectiveTestEngine(false, spec, List.of("M"), sink);

        ReportModel report = report(engine);

        assertEquals(ExecutionMode.ALL, engine.mode());
        assertEquals(ExecutionMode.ALL, report.mode());
        assertTrue(report.selections().isEmpty());
        assertTrue(report.aggregate().modulesExcluded().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------------

    @Test
    void decisionsArePublishedWithRuleAndOrdinal() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.builder().excludeTest("slow").build());

        engine.beginTest("m", "fast", 3);
        engine.beginTest("m", "slow", 9);

        List<TestDecisionEvent> decisions = sink.getDecisions();
        assertEquals(2, decisions.size());
        assertTrue(decisions.get(0).isFirstInModule());
        assertEquals(Decision.RUN_NOT_EXCLUDED, decisions.get(0).decision());
        assertFalse(decisions.get(1).isFirstInModule());
        assertEquals(Decision.SKIP_EXCLUDED_TEST, decisions.get(1).decision());
        assertEquals(9, decisions.get(1).line());
    }

    // ---------------------------------------------------------------------
    // End-to-end
    // ---------------------------------------------------------------------

    @Test
    void allModeRunAggregatesEveryModule() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.empty(), "m1", "m2", "m3");

        engine.beginTest("m1", "a", 1);
        engine.beginTest("m1", "b", 2);
        engine.beginTest("m2", "c", 1);

        ReportModel report = report(engine);
        AggregateCounters all = report.aggregate();
        assertEquals(3, all.found());
        assertEquals(3, all.passing());
        assertEquals(0, all.failing());
        assertEquals(2, item(report, "m1").found());
        assertEquals(1, item(report, "m2").found());
        assertEquals(List.of("m1", "m2"), all.modulesWithTests());
        assertEquals(List.of("m3"), all.modulesWithoutTests());
        assertEquals(ExecutionMode.ALL, report.mode());
        assertTrue(report.isAllPassing());
    }

    @Test
    void selectionRunCountsOnlyAdmittedBlocksAsPassing() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.builder().includeTest("add").build());

        assertTrue(engine.beginTest("mod1", "add", 1));
        assertFalse(engine.beginTest("mod1", "sub", 2));
        assertFalse(engine.beginTest("mod2", "mul", 1));

        ReportModel report = report(engine);
        assertEquals(ExecutionMode.SELECTION, report.mode());
        assertEquals(3, report.aggregate().found());
        assertEquals(1, report.aggregate().passing());
        assertEquals(1, item(report, "mod1").passing());
        assertEquals(0, item(report, "mod2").passing());
    }

    @Test
    void excludedModuleIsReportedStatically() {
        SelectionSpec spec = SelectionSpec.builder().excludeModule("test.excluded").build();
        DefaultSelectiveTestEngine engine = engine(spec, "test.test", "test.excluded", "test.no_unittest");

        engine.beginTest("test.test", "add", 1);

        AggregateCounters all = report(engine).aggregate();
        assertEquals(List.of("test.excluded"), all.modulesExcluded());
        assertEquals(List.of("test.no_unittest"), all.modulesWithoutTests());
    }

    @Test
    void reportIsASnapshotOfTheCounters() {
        DefaultSelectiveTestEngine engine = engine(SelectionSpec.empty());
        engine.beginTest("m", "a", 1);
        ReportModel early = report(engine);

        engine.beginTest("m", "b", 2);
        engine.endTest("m", TestOutcome.FAILED, new AssertionError());

        ModuleLineItem m = item(early, "m");
        assertEquals(1, m.found());
        assertEquals(1, m.passing());
        assertEquals(0, m.failing());
        assertTrue(early.failures().isEmpty());
        assertEquals(1, report(engine).failures().size());
    }

    @Test
    void reportEchoesSelectionsAndTimes() {
        SelectionSpec spec = SelectionSpec.builder().includeModule("m").build();
        DefaultSelectiveTestEngine engine = engine(spec);

        ReportModel report = engine.report(Duration.ofSeconds(1), T0, T0.plusSeconds(1));

        assertSame(spec, report.selections());
        assertEquals(Duration.ofSeconds(1), report.totalElapsed());
        assertEquals(T0, report.startedAt());
        assertEquals(T0.plusSeconds(1), report.finishedAt());
    }
}
