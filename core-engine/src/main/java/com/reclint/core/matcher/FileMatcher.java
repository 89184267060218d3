package com.reclint.core.matcher;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Boolean predicate over a file path deciding whether a rule applies.
 *
 * <p>
 * A matcher without items matches every path. Otherwise every
 * {@link MatchItem} must hold. The file name is the last path element; the
 * path string is the path exactly as given (the validation driver passes
 * canonical absolute paths).
 * </p>
 *
 * <p>
 * Instances are immutable and shared across validation threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class FileMatcher {

    private static final FileMatcher ALWAYS = new FileMatcher(List.of());

    private final List<MatchItem> items;

    private FileMatcher(List<MatchItem> items) {
        this.items = List.copyOf(items);
    }

    /**
     * Matcher without items.
     *
     * @return a matcher accepting every path
     */
    public static FileMatcher always() {
        return ALWAYS;
    }

    /**
     * Create a matcher from its items.
     *
     * @param items clauses, AND-combined; must not be {@code null}
     * @return the matcher
     */
    public static FileMatcher of(List<MatchItem> items) {
        Objects.requireNonNull(items, "Match items must not be null");
        return items.isEmpty() ? ALWAYS : new FileMatcher(items);
    }

    /**
     * Evaluate the matcher.
     *
     * @param file file path; must not be {@code null}
     * @return {@code true} if every item holds
     */
    public boolean matches(Path file) {
        Objects.requireNonNull(file, "File must not be null");
        if (items.isEmpty()) {
            return true;
        }
        Path name = file.getFileName();
        String fileName = name != null ? name.toString() : "";
        String path = file.toString();
        for (MatchItem item : items) {
            if (!item.matches(fileName, path)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FileMatcher that))
            return false;
        return items.equals(that.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "FileMatcher{items=" + items + '}';
    }
}
