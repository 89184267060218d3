package com.reclint.core.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ExcludeFilter} and {@link ExtFilter}.
 */
class FiltersTest {

    @Test
    @DisplayName("Should exclude nothing when the filter is empty")
    void shouldExcludeNothingWhenEmpty() {
        assertThat(ExcludeFilter.none().shouldExclude(Path.of("/a/b.java"))).isFalse();
    }

    @Test
    @DisplayName("Should exclude a file when any entry matches")
    void shouldExcludeOnAnyEntry() {
        ExcludeFilter filter = ExcludeFilter.of(List.of(
                new ExcludeFilter.Entry(ExcludeFilterType.FILE_STARTS_WITH, "Generated"),
                new ExcludeFilter.Entry(ExcludeFilterType.FILE_ENDS_WITH, "_pb.java"),
                new ExcludeFilter.Entry(ExcludeFilterType.PATH_CONTAINS, "/vendor/")));

        assertThat(filter.shouldExclude(Path.of("/r/GeneratedFoo.java"))).isTrue();
        assertThat(filter.shouldExclude(Path.of("/r/msg_pb.java"))).isTrue();
        assertThat(filter.shouldExclude(Path.of("/r/vendor/lib.java"))).isTrue();
        assertThat(filter.shouldExclude(Path.of("/r/src/Foo.java"))).isFalse();
    }

    @Test
    @DisplayName("Should allow every file when no suffix is configured")
    void shouldAllowAllWithoutSuffixes() {
        assertThat(ExtFilter.all().matches("Makefile")).isTrue();
    }

    @Test
    @DisplayName("Should let the exclude list win over the include list")
    void shouldPreferExclude() {
        ExtFilter filter = new ExtFilter(List.of(".java", ".kt"), List.of("Test.java"));

        assertThat(filter.matches("Foo.java")).isTrue();
        assertThat(filter.matches("Foo.kt")).isTrue();
        assertThat(filter.matches("FooTest.java")).isFalse();
        assertThat(filter.matches("foo.rs")).isFalse();
    }
}
