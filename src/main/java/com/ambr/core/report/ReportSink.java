package com.ambr.core.report;

import java.io.IOException;

/**
 * Destination of the final reconciliation report.
 */
public interface ReportSink {

    void emit(RunReport report) throws IOException;
}
