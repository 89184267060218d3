package com.reclint.core.filter;

import java.util.List;

/**
 * Per-rule file-name suffix filter ({@code include_exts} / {@code exclude_exts}).
 *
 * <p>
 * An empty include list allows every file; the exclude list always wins over
 * the include list.
 * </p>
 *
 * @param include suffixes a file name must end with (any of)
 * @param exclude suffixes that reject a file name
 * @since 1.0.0
 */
public record ExtFilter(List<String> include, List<String> exclude) {

    private static final ExtFilter ALL = new ExtFilter(List.of(), List.of());

    public ExtFilter {
        include = include != null ? List.copyOf(include) : List.of();
        exclude = exclude != null ? List.copyOf(exclude) : List.of();
    }

    public static ExtFilter all() {
        return ALL;
    }

    /**
     * Test a file name.
     *
     * @param fileName last path element
     * @return {@code true} if the file passes the filter
     */
    public boolean matches(String fileName) {
        if (!include.isEmpty() && include.stream().noneMatch(fileName::endsWith)) {
            return false;
        }
        return exclude.stream().noneMatch(fileName::endsWith);
    }
}
