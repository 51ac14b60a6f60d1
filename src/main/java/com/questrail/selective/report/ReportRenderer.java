package com.questrail.selective.report;

/**
 * Consumes the {@link ReportModel} of a finished run. Implementations decide
 * presentation (log lines, console text, files).
 */
public interface ReportRenderer
{
    void render(ReportModel report);
}
