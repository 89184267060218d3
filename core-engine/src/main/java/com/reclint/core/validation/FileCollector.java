package com.reclint.core.validation;

import com.reclint.core.config.LintFiles;
import com.reclint.core.config.RootConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expands input paths into the files to validate.
 *
 * <ul>
 * <li>A file is taken as is, unless it is a configuration file or the root
 * config's extension filter rejects it.</li>
 * <li>A directory is walked recursively without following symbolic links.
 * {@code .git} and the root config's excluded directories are not entered;
 * configuration files and files rejected by the extension filter are
 * skipped.</li>
 * </ul>
 *
 * @since 1.0.0
 */
final class FileCollector {

    private static final Logger LOG = LoggerFactory.getLogger(FileCollector.class);

    /**
     * Collected files and the paths that could not be read.
     *
     * @param files  files in input order, directory entries in walk order
     * @param errors unreadable or missing paths
     */
    record Result(List<Path> files, List<LintError> errors) {
    }

    private FileCollector() {
        // utility class - not instantiable
    }

    static Result collect(List<Path> inputs, RootConfig rootConfig) {
        Objects.requireNonNull(inputs, "Input paths must not be null");
        Objects.requireNonNull(rootConfig, "Root config must not be null");

        List<Path> files = new ArrayList<>();
        List<LintError> errors = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isRegularFile(input)) {
                if (accepts(input, rootConfig)) {
                    files.add(input);
                }
            } else if (Files.isDirectory(input)) {
                walk(input, rootConfig, files, errors);
            } else {
                errors.add(LintError.file(input.toString(), "no such file or directory"));
            }
        }
        LOG.debug("Collected {} file(s) from {} input path(s)", files.size(), inputs.size());
        return new Result(files, errors);
    }

    private static void walk(Path start, RootConfig rootConfig, List<Path> files, List<LintError> errors) {
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(start)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String name = dir.getFileName().toString();
                    if (LintFiles.VCS_DIR.equals(name) || rootConfig.shouldExcludeDir(name)) {
                        LOG.trace("Skipping directory {}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && accepts(file, rootConfig)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    errors.add(LintError.file(file.toString(), describe(exc)));
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            errors.add(LintError.directory(start.toString(), describe(e)));
        }
    }

    private static boolean accepts(Path file, RootConfig rootConfig) {
        Path name = file.getFileName();
        if (name != null && LintFiles.isConfigFile(name.toString())) {
            return false;
        }
        return rootConfig.shouldIncludeFile(file);
    }

    static String describe(IOException e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
