package com.questrail.selective.core;

import com.questrail.selective.api.ExecutionMode;
import com.questrail.selective.api.SelectiveTestEngine;
import com.questrail.selective.api.TestOutcome;
import com.questrail.selective.config.SelectionSpec;
import com.questrail.selective.internal.decide.Decision;
import com.questrail.selective.internal.decide.ExecutionDecider;
import com.questrail.selective.internal.state.AdmittedBlock;
import com.questrail.selective.internal.state.TestRegistry;
import com.questrail.selective.observability.NullObservabilitySink;
import com.questrail.selective.observability.SelectionAnomalyEvent;
import com.questrail.selective.observability.SelectionObservabilitySink;
import com.questrail.selective.observability.TestDecisionEvent;
import com.questrail.selective.observability.TestFailureEvent;
import com.questrail.selective.report.FailureDetail;
import com.questrail.selective.report.ReportModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultSelectiveTestEngine
 * -----------------------------------------------------------------------------
 * The standard {@link SelectiveTestEngine}: an {@link ExecutionDecider} over
 * an immutable {@link SelectionSpec}, and a {@link TestRegistry} of counters.
 *
 * <h2>What this class does</h2>
 * <ul>
 *   <li>Counts every block reported through {@link #beginTest} as found</li>
 *   <li>Counts admitted blocks as passing immediately (optimistic pass)</li>
 *   <li>Converts a pass into a failure when the harness reports
 *       {@link TestOutcome#FAILED}</li>
 *   <li>Publishes decisions and failures to a {@link SelectionObservabilitySink}</li>
 *   <li>Assembles a {@link ReportModel} on request</li>
 * </ul>
 *
 * <h2>Pass-through build</h2>
 * Constructed with {@code selectiveModeEnabled == false}, the engine behaves
 * like the host's default runner: every block runs, and no counter, event or
 * failure is recorded. The given selection is ignored, so the report shows
 * {@link ExecutionMode#ALL} and no selections.
 *
 * <h2>Threading model</h2>
 * One instance per run, driven from a single thread. No locking.
 */
public final class DefaultSelectiveTestEngine implements SelectiveTestEngine
{
    private static final Logger log = LoggerFactory.getLogger(DefaultSelectiveTestEngine.class);

    private final boolean selectiveModeEnabled;
    private final SelectionSpec spec;
    private final List<String> knownModules;
    private final SelectionObservabilitySink observabilitySink;

    private final ExecutionDecider decider = new ExecutionDecider();
    private final TestRegistry registry = new TestRegistry();
    private final List<FailureDetail> failures = new ArrayList<>();

    public DefaultSelectiveTestEngine(SelectionSpec spec) {
        this(true, spec, List.of(), NullObservabilitySink.INSTANCE);
    }

    /**
     * @param selectiveModeEnabled {@code false} for a pass-through build
     * @param spec                 the run's merged selection
     * @param knownModules         every module name the host knows of, used to
     *                             list modules without tests
     * @param observabilitySink    receiver of decision and failure events
     */
    public DefaultSelectiveTestEngine(
            boolean selectiveModeEnabled,
            SelectionSpec spec,
            Collection<String> knownModules,
            SelectionObservabilitySink observabilitySink
    ) {
        this.selectiveModeEnabled = selectiveModeEnabled;
        Objects.requireNonNull(spec, "spec");
        this.spec = selectiveModeEnabled ? spec : SelectionSpec.empty();
        this.knownModules = List.copyOf(Objects.requireNonNull(knownModules, "knownModules"));
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");

        log.debug("Engine created: selective={}, mode={}, knownModules={}",
                selectiveModeEnabled, mode(), this.knownModules.size());
    }

    @Override
    public boolean beginTest(String moduleName, String testName, int line) {
        Objects.requireNonNull(moduleName, "moduleName");
        Objects.requireNonNull(testName, "testName");

        if (!selectiveModeEnabled) {
            return true;
        }

        Decision decision = decider.decide(spec, moduleName, testName);
        int ordinal = registry.recordBlock(moduleName, testName, line, decision.isExecute());

        observabilitySink.onTestDecision(new TestDecisionEvent(
                moduleName, testName, line, mode(), decision, ordinal));
        return decision.isExecute();
    }

    @Override
    public void endTest(String moduleName, TestOutcome outcome, Throwable cause) {
        Objects.requireNonNull(moduleName, "moduleName");
        Objects.requireNonNull(outcome, "outcome");

        if (!selectiveModeEnabled || outcome == TestOutcome.PASSED) {
            return;
        }

        Optional<AdmittedBlock> failed = registry.recordFailure(moduleName);
        if (failed.isEmpty()) {
            String message = "failure reported without an admitted block";
            log.warn("Ignoring failure for module {}: {}", moduleName, message);
            observabilitySink.onAnomaly(new SelectionAnomalyEvent(moduleName, message));
            return;
        }

        AdmittedBlock block = failed.get();
        FailureDetail detail = null;
        if (cause != null) {
            detail = FailureDetail.of(moduleName, block.testName(), block.line(), cause);
            failures.add(detail);
        }
        observabilitySink.onTestFailure(new TestFailureEvent(moduleName, detail, cause));
    }

    @Override
    public void recordUnhookedBlock(String moduleName) {
        Objects.requireNonNull(moduleName, "moduleName");
        if (!selectiveModeEnabled) {
            return;
        }

        registry.recordUnhookedBlock(moduleName);
    }

    @Override
    public void recordModuleElapsed(String moduleName, Duration elapsed) {
        Objects.requireNonNull(moduleName, "moduleName");
        Objects.requireNonNull(elapsed, "elapsed");
        if (!selectiveModeEnabled) {
            return;
        }
        registry.addElapsed(moduleName, elapsed);
    }

    @Override
    public ExecutionMode mode() {
        return decider.modeOf(spec);
    }

    @Override
    public ReportModel report(Duration totalElapsed, Instant startedAt, Instant finishedAt) {
        return new ReportModel(
                mode(),
                spec,
                registry.lineItems(),
                registry.snapshot(spec, knownModules),
                failures,
                totalElapsed,
                startedAt,
                finishedAt);
    }
}
