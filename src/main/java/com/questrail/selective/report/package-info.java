/**
 * Report Contract
 * =============================================================================
 *
 * <p>This package defines what a finished run hands to the outside world.
 * The {@link com.questrail.selective.report.ReportModel} is the whole
 * contract: counters per module, run-wide aggregates, categorized module
 * lists, failure details and timing.</p>
 *
 * <h2>Boundary</h2>
 * <pre>
 *   TestRegistry (mutable, internal)
 *        → ReportModel            (immutable snapshot)
 *            → ReportRenderer     (presentation, replaceable)
 * </pre>
 *
 * <p>{@link com.questrail.selective.report.PlainTextReportFormatter} provides
 * a plain layout and {@link com.questrail.selective.report.Slf4jReportRenderer}
 * writes it to the log. Hosts wanting colour, HTML or files supply their own
 * {@link com.questrail.selective.report.ReportRenderer}.</p>
 */
package com.questrail.selective.report;
