package com.questrail.selective.config;

import com.questrail.selective.cli.SelectionArguments;
import com.questrail.selective.internal.time.MonotonicClock;
import com.questrail.selective.internal.time.SystemMonotonicClock;
import com.questrail.selective.internal.time.SystemWallClock;
import com.questrail.selective.internal.time.WallClock;
import com.questrail.selective.observability.NullObservabilitySink;
import com.questrail.selective.observability.SelectionObservabilitySink;
import com.questrail.selective.report.ReportRenderer;
import com.questrail.selective.report.Slf4jReportRenderer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration for a selective test run.
 *
 * @param selectiveModeEnabled {@code false} runs every block without counting
 * @param configPaths          selection files, merged in order
 * @param knownModules         every module name the host knows of
 * @param observabilitySink    receiver of per-block events
 * @param reportRenderer       receiver of the final report
 * @param monotonicClock       source for measured durations
 * @param wallClock            source for report timestamps
 */
public record SelectionRunConfig(
    boolean selectiveModeEnabled,
    List<Path> configPaths,
    List<String> knownModules,
    SelectionObservabilitySink observabilitySink,
    ReportRenderer reportRenderer,
    MonotonicClock monotonicClock,
    WallClock wallClock
) {
    public SelectionRunConfig {
        configPaths = List.copyOf(configPaths);
        knownModules = List.copyOf(knownModules);
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(reportRenderer, "reportRenderer");
        Objects.requireNonNull(monotonicClock, "monotonicClock");
        Objects.requireNonNull(wallClock, "wallClock");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder seeded with the selection files named on the host's
     * command line ({@code -c}/{@code --config}).
     */
    public static Builder fromArguments(String... args) {
        return builder().withConfigPaths(SelectionArguments.parse(args).configPaths());
    }

    public static final class Builder {
        private boolean selectiveModeEnabled = true;
        private final List<Path> configPaths = new ArrayList<>();
        private final List<String> knownModules = new ArrayList<>();
        private SelectionObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private ReportRenderer reportRenderer;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withSelectiveModeEnabled(boolean enabled) {
            this.selectiveModeEnabled = enabled;
            return this;
        }

        public Builder withConfigPaths(Collection<Path> paths) {
            this.configPaths.addAll(paths);
            return this;
        }

        public Builder addConfigPath(Path path) {
            this.configPaths.add(Objects.requireNonNull(path, "path"));
            return this;
        }

        public Builder withKnownModules(Collection<String> modules) {
            this.knownModules.addAll(modules);
            return this;
        }

        public Builder withObservabilitySink(SelectionObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withReportRenderer(ReportRenderer renderer) {
            this.reportRenderer = renderer;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public SelectionRunConfig build() {
            ReportRenderer renderer = reportRenderer != null ? reportRenderer : new Slf4jReportRenderer();
            return new SelectionRunConfig(
                    selectiveModeEnabled,
                    configPaths,
                    knownModules,
                    observabilitySink,
                    renderer,
                    monotonicClock,
                    wallClock);
        }
    }
}
