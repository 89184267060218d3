package com.reclint.core.config;

/**
 * One or more rules of a rule file violate their invariants. The message
 * lists every problem of the file, each naming the rule label.
 *
 * @since 1.0.0
 */
public class InvalidRuleException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public InvalidRuleException(String message) {
        super(message);
    }
}
