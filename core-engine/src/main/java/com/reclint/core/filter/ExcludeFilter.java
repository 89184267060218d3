package com.reclint.core.filter;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Per-rule file exclusion declared with {@code exclude_files}.
 *
 * <p>
 * Entries are OR-combined: a file is excluded as soon as one entry matches.
 * An empty filter excludes nothing.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExcludeFilter {

    private static final ExcludeFilter NONE = new ExcludeFilter(List.of());

    private final List<Entry> entries;

    private ExcludeFilter(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * One exclusion test.
     *
     * @param type    what to test
     * @param keyword text tested against the file name or path
     */
    public record Entry(ExcludeFilterType type, String keyword) {

        public Entry {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(keyword, "keyword must not be null");
        }

        boolean matches(String fileName, String path) {
            return switch (type) {
                case FILE_STARTS_WITH -> fileName.startsWith(keyword);
                case FILE_ENDS_WITH -> fileName.endsWith(keyword);
                case PATH_CONTAINS -> path.contains(keyword);
            };
        }
    }

    public static ExcludeFilter none() {
        return NONE;
    }

    public static ExcludeFilter of(List<Entry> entries) {
        Objects.requireNonNull(entries, "Exclude entries must not be null");
        return entries.isEmpty() ? NONE : new ExcludeFilter(entries);
    }

    /**
     * Decide whether a file is excluded.
     *
     * @param file file path; must not be {@code null}
     * @return {@code true} if any entry matches
     */
    public boolean shouldExclude(Path file) {
        Objects.requireNonNull(file, "File must not be null");
        if (entries.isEmpty()) {
            return false;
        }
        Path name = file.getFileName();
        String fileName = name != null ? name.toString() : "";
        String path = file.toString();
        for (Entry entry : entries) {
            if (entry.matches(fileName, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExcludeFilter that))
            return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ExcludeFilter{entries=" + entries + '}';
    }
}
