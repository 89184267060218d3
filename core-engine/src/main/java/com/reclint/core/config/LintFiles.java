package com.reclint.core.config;

/**
 * Well-known file and directory names.
 *
 * @since 1.0.0
 */
public final class LintFiles {

    /** Per-directory rule file. */
    public static final String RULE_FILE = ".rec_lint.yaml";

    /** Root marker; also holds the {@link RootConfig}. */
    public static final String ROOT_MARKER = ".rec_lint_config.yaml";

    /** Always skipped during directory expansion. */
    public static final String VCS_DIR = ".git";

    private LintFiles() {
        // utility class - not instantiable
    }

    /**
     * Whether a file name is one of the tool's own configuration files.
     *
     * @param fileName last path element
     * @return {@code true} for the rule file and the root marker
     */
    public static boolean isConfigFile(String fileName) {
        return RULE_FILE.equals(fileName) || ROOT_MARKER.equals(fileName);
    }
}
