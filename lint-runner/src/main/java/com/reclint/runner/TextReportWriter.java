package com.reclint.runner;

import com.reclint.core.validation.ValidationReport;

import java.io.PrintStream;

/**
 * Plain text report: error lines, then violation lines.
 */
class TextReportWriter implements ReportWriter {

    @Override
    public void write(ValidationReport report, PrintStream out) {
        for (String line : report.lines()) {
            out.println(line);
        }
        out.flush();
    }
}
