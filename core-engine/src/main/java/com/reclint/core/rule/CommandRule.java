package com.reclint.core.rule;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * {@code custom}: runs an external command per file; a non-zero exit status
 * is a violation.
 *
 * @param header common fields
 * @param exec   command template; {@value #FILE_PLACEHOLDER} is replaced by the file path
 * @since 1.0.0
 */
public record CommandRule(RuleHeader header, String exec) implements Rule {

    public static final String FILE_PLACEHOLDER = "{file}";

    public CommandRule {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(exec, "exec must not be null");
        header.requireAllowed(RuleKind.CUSTOM);
        if (exec.isBlank()) {
            throw new IllegalArgumentException("Rule '" + header.label() + "' requires a non-blank exec");
        }
    }

    /**
     * Build the command line for a file: substitute the placeholder, then
     * split on whitespace. No shell quoting is applied.
     *
     * @param file path substituted for {@value #FILE_PLACEHOLDER}
     * @return program followed by its arguments
     */
    public List<String> commandFor(String file) {
        String expanded = exec.replace(FILE_PLACEHOLDER, file).trim();
        return Arrays.asList(expanded.split("\\s+"));
    }

    @Override
    public RuleKind kind() {
        return RuleKind.CUSTOM;
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitCommand(this);
    }
}
