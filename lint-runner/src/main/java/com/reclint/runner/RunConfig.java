package com.reclint.runner;

import com.reclint.core.validation.SortMode;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration of a lint run.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * runner can be configured from a CI job or a shell without flags:
 * </p>
 * <ul>
 * <li>{@value #ENV_SORT}: {@code rule} (default) or {@code file}</li>
 * <li>{@value #ENV_FORMAT}: {@code text} (default) or {@code json}</li>
 * <li>{@value #ENV_PATHS}: paths separated by the platform path separator,
 * used when no arguments are given (default {@code .})</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunConfig {

    public static final String ENV_SORT = "REC_LINT_SORT";
    public static final String ENV_FORMAT = "REC_LINT_FORMAT";
    public static final String ENV_PATHS = "REC_LINT_PATHS";

    private final SortMode sortMode;
    private final OutputFormat outputFormat;
    private final List<Path> paths;

    private RunConfig(Builder b) {
        this.sortMode = b.sortMode;
        this.outputFormat = b.outputFormat;
        this.paths = List.copyOf(b.paths);
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link RunConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException if an env-var value is not recognised
     */
    public static RunConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link RunConfig} from the given variables.
     *
     * @param env environment variables; must not be {@code null}
     * @return fully populated configuration
     * @throws IllegalStateException if a value is not recognised
     */
    public static RunConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "Environment must not be null");
        String sort = env(env, ENV_SORT, "rule");
        String format = env(env, ENV_FORMAT, "text");
        return new Builder()
                .sortMode(SortMode.fromConfigName(sort).orElseThrow(() -> new IllegalStateException(
                        ENV_SORT + " must be 'rule' or 'file', got: '" + sort + "'")))
                .outputFormat(OutputFormat.fromConfigName(format).orElseThrow(() -> new IllegalStateException(
                        ENV_FORMAT + " must be 'text' or 'json', got: '" + format + "'")))
                .paths(splitPaths(env(env, ENV_PATHS, ".")))
                .build();
    }

    /**
     * Copy of this configuration with other paths, e.g. from command-line
     * arguments.
     *
     * @param paths replacement paths; must not be empty
     * @return a new configuration
     */
    public RunConfig withPaths(List<Path> paths) {
        return new Builder().sortMode(sortMode).outputFormat(outputFormat).paths(paths).build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public SortMode getSortMode() {
        return sortMode;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public List<Path> getPaths() {
        return paths;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunConfig}.
     *
     * <p>
     * {@link #build()} requires a sort mode, an output format and at least
     * one path.
     * </p>
     */
    public static class Builder {
        private SortMode sortMode = SortMode.RULE;
        private OutputFormat outputFormat = OutputFormat.TEXT;
        private List<Path> paths = List.of(Path.of("."));

        public Builder sortMode(SortMode v) {
            this.sortMode = v;
            return this;
        }

        public Builder outputFormat(OutputFormat v) {
            this.outputFormat = v;
            return this;
        }

        public Builder paths(List<Path> v) {
            this.paths = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunConfig build() {
            Objects.requireNonNull(sortMode, "sortMode required");
            Objects.requireNonNull(outputFormat, "outputFormat required");
            if (paths == null || paths.isEmpty()) {
                throw new IllegalArgumentException("At least one path is required");
            }
            if (paths.stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("paths must not contain null");
            }
            return new RunConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static List<Path> splitPaths(String value) {
        List<Path> paths = new ArrayList<>();
        for (String part : value.split(File.pathSeparator)) {
            if (!part.isBlank()) {
                paths.add(Path.of(part.trim()));
            }
        }
        return paths;
    }

    @Override
    public String toString() {
        return "RunConfig{" +
                "sortMode=" + sortMode.configName() +
                ", outputFormat=" + outputFormat.configName() +
                ", paths=" + paths +
                '}';
    }
}
