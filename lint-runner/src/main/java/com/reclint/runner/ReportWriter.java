package com.reclint.runner;

import com.reclint.core.validation.ValidationReport;

import java.io.PrintStream;

/**
 * Writes a {@link ValidationReport} to an output stream.
 *
 * @since 1.0.0
 */
interface ReportWriter {

    void write(ValidationReport report, PrintStream out);
}
