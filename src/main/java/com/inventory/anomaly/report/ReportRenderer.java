package com.inventory.anomaly.report;

import java.io.IOException;

public interface ReportRenderer {

    /**
     * Renders and stores the report.
     *
     * @return locator of the stored report
     */
    String render(ReportInput input) throws IOException;
}
