package com.reclint.core.model;

/**
 * {@code test} block of a test-existence rule.
 *
 * @since 1.0.0
 */
public class TestDefinition {

    private String testDirectory;

    /** {@code exists} (default) or {@code all_public}. */
    private String require;

    private String testFileSuffix;

    public String getTestDirectory() {
        return testDirectory;
    }

    public void setTestDirectory(String testDirectory) {
        this.testDirectory = testDirectory;
    }

    public String getRequire() {
        return require;
    }

    public void setRequire(String require) {
        this.require = require;
    }

    public String getTestFileSuffix() {
        return testFileSuffix;
    }

    public void setTestFileSuffix(String testFileSuffix) {
        this.testFileSuffix = testFileSuffix;
    }
}
