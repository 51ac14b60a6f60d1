package com.questrail.selective.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SelectionObservabilitySink that emits logs via SLF4J.
 * <p>
 * Executed blocks are logged at INFO (module name on the first block of each
 * module), skipped blocks at DEBUG together with the rule that skipped them.
 */
public final class Slf4jSelectionObservabilitySink implements SelectionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSelectionObservabilitySink.class);

    @Override
    public void onTestDecision(TestDecisionEvent event) {
        if (!event.isExecuted()) {
            log.debug("Skipping {} {} ({}): {}",
                event.module(), event.line(), event.testName(), event.decision());
            return;
        }
        if (event.isFirstInModule()) {
            log.info("Module: {} {} {}", event.module(), event.line(), event.testName());
        } else {
            log.info("        {} {} {}", event.module(), event.line(), event.testName());
        }
    }

    @Override
    public void onTestFailure(TestFailureEvent event) {
        if (event.detail() == null) {
            log.error("Block failed in module {}", event.module());
            return;
        }
        log.error("Assertion failed in module {}, block '{}' (line {}): {}",
            event.module(),
            event.detail().testName(),
            event.detail().line(),
            event.detail().message(),
            event.cause());
    }

    @Override
    public void onAnomaly(SelectionAnomalyEvent event) {
        log.warn("Selection contract misuse in module {}: {}", event.module(), event.message());
    }
}
