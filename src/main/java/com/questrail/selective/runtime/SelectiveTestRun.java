package com.questrail.selective.runtime;

import com.questrail.selective.api.SelectiveTestEngine;
import com.questrail.selective.api.TestOutcome;
import com.questrail.selective.config.SelectionConfigException;
import com.questrail.selective.config.SelectionConfigLoader;
import com.questrail.selective.config.SelectionRunConfig;
import com.questrail.selective.config.SelectionSpec;
import com.questrail.selective.core.DefaultSelectiveTestEngine;
import com.questrail.selective.internal.time.MonotonicClock;
import com.questrail.selective.internal.time.WallClock;
import com.questrail.selective.report.ReportModel;
import com.questrail.selective.report.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * SelectiveTestRun
 * =============================================================================
 * Composition root and lifecycle owner for one selective test run.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #start(SelectionRunConfig)} loads the selection files and
 *       builds the engine. A missing or unreadable file aborts here, before
 *       any block runs. A pass-through run reads no files.</li>
 *   <li>{@link #runBlock} is called once per test block, in order.</li>
 *   <li>{@link #finish()} renders and returns the report.</li>
 * </ol>
 *
 * <h2>Guarded block bodies</h2>
 * {@link #runBlock} wraps the body so that any abnormal exit, assertion
 * errors included, reports {@link TestOutcome#FAILED} with its cause. A normal
 * exit reports nothing; the block was already counted as passing. An
 * {@link InterruptedException} from the body is a failure too, and the
 * thread's interrupt status is restored.
 */
public final class SelectiveTestRun {
    private static final Logger log = LoggerFactory.getLogger(SelectiveTestRun.class);

    /**
     * Body of a test block.
     */
    @FunctionalInterface
    public interface TestBody {
        void run() throws Throwable;
    }

    /**
     * What happened to a block passed to {@link #runBlock}.
     */
    public enum BlockResult {
        EXECUTED_PASSED,
        EXECUTED_FAILED,
        SKIPPED
    }

    private final SelectiveTestEngine engine;
    private final ReportRenderer reportRenderer;
    private final MonotonicClock monotonicClock;
    private final WallClock wallClock;

    private final long startNanos;
    private final Instant startedAt;
    private ReportModel finalReport;

    private SelectiveTestRun(
            SelectiveTestEngine engine,
            ReportRenderer reportRenderer,
            MonotonicClock monotonicClock,
            WallClock wallClock) {
        this.engine = engine;
        this.reportRenderer = reportRenderer;
        this.monotonicClock = monotonicClock;
        this.wallClock = wallClock;
        this.startNanos = monotonicClock.nowNanos();
        this.startedAt = wallClock.now();
    }

    /**
     * Loads the configured selection and starts the run.
     *
     * @throws SelectionConfigException if a selection file is missing or
     *         unreadable; never for a pass-through run
     */
    public static SelectiveTestRun start(SelectionRunConfig config) {
        Objects.requireNonNull(config, "config");

        SelectionSpec spec = SelectionSpec.empty();
        if (config.selectiveModeEnabled()) {
            spec = new SelectionConfigLoader().load(config.configPaths());
        } else if (!config.configPaths().isEmpty()) {
            log.debug("Pass-through run; ignoring {} selection file(s)", config.configPaths().size());
        }
        SelectiveTestEngine engine = new DefaultSelectiveTestEngine(
                config.selectiveModeEnabled(),
                spec,
                config.knownModules(),
                config.observabilitySink());

        log.info("Selective test run started: mode={}, selective={}",
                engine.mode().label(), config.selectiveModeEnabled());
        return new SelectiveTestRun(
                engine,
                config.reportRenderer(),
                config.monotonicClock(),
                config.wallClock());
    }

    public SelectiveTestEngine engine() {
        return engine;
    }

    /**
     * Runs one test block if the selection admits it.
     *
     * @param moduleName the block's module
     * @param testName   the block's name
     * @param line       the block's source line
     * @param body       the block body; not invoked when skipped
     * @return what happened to the block; failures are not rethrown
     */
    public BlockResult runBlock(String moduleName, String testName, int line, TestBody body) {
        Objects.requireNonNull(body, "body");
        if (finalReport != null) {
            throw new IllegalStateException("Run already finished");
        }

        if (!engine.beginTest(moduleName, testName, line)) {
            return BlockResult.SKIPPED;
        }

        long from = monotonicClock.nowNanos();
        try {
            body.run();
            return BlockResult.EXECUTED_PASSED;
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            engine.endTest(moduleName, TestOutcome.FAILED, t);
            return BlockResult.EXECUTED_FAILED;
        } finally {
            engine.recordModuleElapsed(moduleName, Duration.ofNanos(monotonicClock.nowNanos() - from));
        }
    }

    /**
     * Ends the run, hands the report to the configured renderer and returns it.
     *
     * @throws IllegalStateException if the run was already finished
     */
    public ReportModel finish() {
        if (finalReport != null) {
            throw new IllegalStateException("Run already finished");
        }
        Duration total = Duration.ofNanos(monotonicClock.nowNanos() - startNanos);
        finalReport = engine.report(total, startedAt, wallClock.now());
        reportRenderer.render(finalReport);
        return finalReport;
    }
}
