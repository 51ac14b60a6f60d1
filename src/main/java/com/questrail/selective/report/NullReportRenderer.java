package com.questrail.selective.report;

/**
 * No-op implementation of ReportRenderer.
 */
public final class NullReportRenderer implements ReportRenderer {
    public static final NullReportRenderer INSTANCE = new NullReportRenderer();

    private NullReportRenderer() {}

    @Override
    public void render(ReportModel report) {}
}
