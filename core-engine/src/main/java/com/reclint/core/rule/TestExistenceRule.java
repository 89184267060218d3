package com.reclint.core.rule;

import java.util.Objects;

/**
 * {@code require_*_test}: source files must have tests. Checked by a
 * registered validator.
 *
 * @param header         common fields
 * @param framework      test framework
 * @param testDirectory  directory holding test files, relative to the root;
 *                       {@code null} for frameworks with inline tests
 * @param requireLevel   how much must be tested
 * @param testFileSuffix suffix appended to the source file stem to name its test file
 * @since 1.0.0
 */
public record TestExistenceRule(
        RuleHeader header,
        TestFramework framework,
        String testDirectory,
        TestRequireLevel requireLevel,
        String testFileSuffix) implements Rule {

    public static final String DEFAULT_TEST_FILE_SUFFIX = "Test";

    public TestExistenceRule {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(framework, "framework must not be null");
        header.requireAllowed(framework.testExistenceKind());
        if (framework.hasSeparateTestFile() && (testDirectory == null || testDirectory.isBlank())) {
            throw new IllegalArgumentException("Rule '" + header.label() + "' requires a test_directory");
        }
        requireLevel = requireLevel != null ? requireLevel : TestRequireLevel.EXISTS;
        testFileSuffix = testFileSuffix != null ? testFileSuffix : DEFAULT_TEST_FILE_SUFFIX;
    }

    @Override
    public RuleKind kind() {
        return framework.testExistenceKind();
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitTestExistence(this);
    }
}
