package com.reclint.core.config;

/**
 * Fatal configuration problem: the run cannot produce a meaningful result
 * and is aborted.
 *
 * @since 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
