package com.reclint.core.rule;

import java.util.Optional;
/**
 * Test ecosystem targeted by test-name and test-existence rules.
 *
 * @since 1.0.0
 */
public enum TestFramework {

    PHPUNIT(RuleKind.REQUIRE_JAPANESE_PHPUNIT_TEST_NAME, RuleKind.REQUIRE_PHPUNIT_TEST, true),
    KOTEST(RuleKind.REQUIRE_JAPANESE_KOTEST_TEST_NAME, RuleKind.REQUIRE_KOTEST_TEST, true),
    RUST(RuleKind.REQUIRE_JAPANESE_RUST_TEST_NAME, RuleKind.REQUIRE_RUST_UNIT_TEST, false);

    private final RuleKind testNameKind;
    private final RuleKind testExistenceKind;
    private final boolean separateTestFile;

    TestFramework(RuleKind testNameKind, RuleKind testExistenceKind, boolean separateTestFile) {
        this.testNameKind = testNameKind;
        this.testExistenceKind = testExistenceKind;
        this.separateTestFile = separateTestFile;
    }

    public RuleKind testNameKind() {
        return testNameKind;
    }

    public RuleKind testExistenceKind() {
        return testExistenceKind;
    }

    /**
     * Whether tests live in a separate file under a test directory (PHPUnit,
     * Kotest) rather than next to the code (Rust unit tests).
     *
     * @return {@code true} if a {@code test_directory} is required
     */
    public boolean hasSeparateTestFile() {
        return separateTestFile;
    }

    public static Optional<TestFramework> forTestNameKind(RuleKind kind) {
        for (TestFramework framework : values()) {
            if (framework.testNameKind == kind) {
                return Optional.of(framework);
            }
        }
        return Optional.empty();
    }

    public static Optional<TestFramework> forTestExistenceKind(RuleKind kind) {
        for (TestFramework framework : values()) {
            if (framework.testExistenceKind == kind) {
                return Optional.of(framework);
            }
        }
        return Optional.empty();
    }
}
