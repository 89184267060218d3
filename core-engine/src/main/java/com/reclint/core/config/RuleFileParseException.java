package com.reclint.core.config;

import java.nio.file.Path;

/**
 * A rule or root file could not be read or is not well-formed YAML for the
 * expected structure.
 *
 * <p>
 * The validation driver treats this as scoped to the directory holding the
 * file: that directory's files are skipped and the error is reported.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleFileParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Path file;

    public RuleFileParseException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
