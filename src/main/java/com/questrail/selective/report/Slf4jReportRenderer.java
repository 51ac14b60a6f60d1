package com.questrail.selective.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Production implementation of ReportRenderer that writes the plain-text
 * report via SLF4J, one log event per line.
 */
public final class Slf4jReportRenderer implements ReportRenderer {
    private static final Logger log = LoggerFactory.getLogger(Slf4jReportRenderer.class);

    private final PlainTextReportFormatter formatter;

    public Slf4jReportRenderer() {
        this(new PlainTextReportFormatter());
    }

    public Slf4jReportRenderer(PlainTextReportFormatter formatter) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    @Override
    public void render(ReportModel report) {
        for (String line : formatter.format(report)) {
            log.info("{}", line);
        }
    }
}
