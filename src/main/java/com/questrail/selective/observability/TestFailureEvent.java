package com.questrail.selective.observability;

import com.questrail.selective.report.FailureDetail;

/**
 * Record representing a failed test block.
 *
 * @param detail the captured failure; {@code null} when the harness reported
 *               the failure without a cause
 */
public record TestFailureEvent(
    String module,
    FailureDetail detail,
    Throwable cause
) {
}
