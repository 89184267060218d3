package com.reclint.core.rule;

import java.util.Objects;

/**
 * {@code require_japanese_*_test_name}: test names must be written in
 * Japanese. Checked by a registered validator.
 *
 * @param header    common fields
 * @param framework test framework whose test declarations are inspected
 * @since 1.0.0
 */
public record TestNameRule(RuleHeader header, TestFramework framework) implements Rule {

    public TestNameRule {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(framework, "framework must not be null");
        header.requireAllowed(framework.testNameKind());
    }

    @Override
    public RuleKind kind() {
        return framework.testNameKind();
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitTestName(this);
    }
}
