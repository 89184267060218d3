package com.reclint.core.config;

import java.nio.file.Path;

/**
 * No ancestor of a path contains the root marker file.
 *
 * @since 1.0.0
 */
public class NoRootFoundException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final transient Path start;

    public NoRootFoundException(Path start) {
        super(LintFiles.ROOT_MARKER + " not found in " + start + " or any parent directory");
        this.start = start;
    }

    /**
     * Path the upward search started from.
     *
     * @return canonical start path
     */
    public Path getStart() {
        return start;
    }
}
