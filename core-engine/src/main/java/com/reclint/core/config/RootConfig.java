package com.reclint.core.config;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable project-wide settings read from the root marker.
 *
 * <ul>
 * <li>{@code includeExtensions}: dot-prefixed suffixes a file must have to be
 * collected from a directory; empty allows every file.</li>
 * <li>{@code excludeDirs}: directory names skipped during expansion.</li>
 * </ul>
 *
 * <p>
 * When extensions are configured, a file without an extension is never
 * collected. Extensions given without the leading dot are normalised.
 * </p>
 *
 * @since 1.0.0
 */
public final class RootConfig {

    private static final RootConfig DEFAULTS = new RootConfig(Set.of(), Set.of());

    private final Set<String> includeExtensions;
    private final Set<String> excludeDirs;

    private RootConfig(Set<String> includeExtensions, Set<String> excludeDirs) {
        this.includeExtensions = includeExtensions;
        this.excludeDirs = excludeDirs;
    }

    public static RootConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Create a root config.
     *
     * @param includeExtensions allowed extensions; {@code null} allows all
     * @param excludeDirs       skipped directory names; {@code null} skips none
     * @return the config
     */
    public static RootConfig of(Collection<String> includeExtensions, Collection<String> excludeDirs) {
        Set<String> extensions = new LinkedHashSet<>();
        if (includeExtensions != null) {
            for (String ext : includeExtensions) {
                if (ext != null && !ext.isBlank()) {
                    String trimmed = ext.trim();
                    extensions.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
                }
            }
        }
        Set<String> dirs = new LinkedHashSet<>();
        if (excludeDirs != null) {
            for (String dir : excludeDirs) {
                if (dir != null && !dir.isBlank()) {
                    dirs.add(dir.trim());
                }
            }
        }
        if (extensions.isEmpty() && dirs.isEmpty()) {
            return DEFAULTS;
        }
        return new RootConfig(Collections.unmodifiableSet(extensions), Collections.unmodifiableSet(dirs));
    }

    public Set<String> getIncludeExtensions() {
        return includeExtensions;
    }

    public Set<String> getExcludeDirs() {
        return excludeDirs;
    }

    /**
     * Whether a file found while walking a directory is collected.
     *
     * @param file file path
     * @return {@code true} if the extension filter allows the file
     */
    public boolean shouldIncludeFile(Path file) {
        Objects.requireNonNull(file, "File must not be null");
        if (includeExtensions.isEmpty()) {
            return true;
        }
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return false;
        }
        return includeExtensions.contains(fileName.substring(dot));
    }

    /**
     * Whether a directory is skipped during expansion.
     *
     * @param dirName last path element of the directory
     * @return {@code true} if the name is listed in {@code exclude_dirs}
     */
    public boolean shouldExcludeDir(String dirName) {
        return excludeDirs.contains(dirName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RootConfig that))
            return false;
        return includeExtensions.equals(that.includeExtensions) && excludeDirs.equals(that.excludeDirs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(includeExtensions, excludeDirs);
    }

    @Override
    public String toString() {
        return "RootConfig{includeExtensions=" + includeExtensions + ", excludeDirs=" + excludeDirs + '}';
    }
}
