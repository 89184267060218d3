package com.reclint.runner;

import com.reclint.core.validation.ValidationDriver;
import com.reclint.core.validation.ValidationReport;
import com.reclint.core.validation.ValidatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Main entry point of rec-lint.
 *
 * <h3>Usage</h3>
 *
 * <pre>
 *   java -jar lint-runner.jar [PATH...]
 * </pre>
 *
 * <p>
 * Positional arguments are the files and directories to validate; without
 * arguments the paths come from {@link RunConfig#ENV_PATHS}. Sort mode and
 * output format are read from the environment via {@link RunConfig}.
 * </p>
 *
 * <p>
 * The report goes to standard output; logs go to standard error. A
 * configuration error (missing root marker, invalid rule) aborts the run
 * with an exception.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecLintRunner {

    private static final Logger LOG = LoggerFactory.getLogger(RecLintRunner.class);

    private RecLintRunner() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) {
        RunConfig config = RunConfig.fromEnvironment();
        if (args.length > 0) {
            config = config.withPaths(Arrays.stream(args).map(Path::of).toList());
        }
        run(config, ValidatorRegistry.discover(), System.out);
    }

    /**
     * Validate the configured paths and write the report.
     *
     * @param config   run configuration
     * @param registry validators for the delegated rule kinds
     * @param out      report destination
     * @return the report that was written
     */
    static ValidationReport run(RunConfig config, ValidatorRegistry registry, PrintStream out) {
        LOG.info("Starting rec-lint with config: {}", config);
        List<Path> paths = config.getPaths();
        ValidationReport report = new ValidationDriver(registry).run(paths, config.getSortMode());
        config.getOutputFormat().writer().write(report, out);
        return report;
    }
}
