package com.reclint.core.validation;

import com.reclint.core.config.ConfigurationException;
import com.reclint.core.config.RootConfig;
import com.reclint.core.config.RootConfigLoader;
import com.reclint.core.config.RuleFileParseException;
import com.reclint.core.hierarchy.CollectedRuleSet;
import com.reclint.core.hierarchy.RuleHierarchyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Validates a set of input paths against their hierarchical rules.
 *
 * <h3>Phases</h3>
 * <ol>
 * <li>Setup (calling thread): read the root config of the first input that
 * has a root, expand the inputs into files, canonicalize them and resolve
 * the effective rules of every distinct parent directory once.</li>
 * <li>Validation: one task per file on an unbounded cached thread pool. The
 * rule cache is read-only during this phase.</li>
 * <li>Report: scoped errors in encounter order, violations sorted once by
 * the requested mode.</li>
 * </ol>
 *
 * <p>
 * Configuration errors ({@link ConfigurationException})
 * abort the run. Errors scoped to a directory or a file are reported next to
 * the violations and do not stop the rest of the run.
 * </p>
 *
 * @since 1.0.0
 */
public final class ValidationDriver {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationDriver.class);

    private final FileValidator fileValidator;
    private final Function<Path, CollectedRuleSet> resolver;

    /**
     * Driver with the given validators.
     *
     * @param registry validators for the delegated rule kinds; must not be
     *                 {@code null}
     */
    public ValidationDriver(ValidatorRegistry registry) {
        this(registry, RuleHierarchyResolver::resolveEffectiveRules);
    }

    ValidationDriver(ValidatorRegistry registry, Function<Path, CollectedRuleSet> resolver) {
        this.fileValidator = new FileValidator(registry, new CommandRunner());
        this.resolver = Objects.requireNonNull(resolver, "Resolver must not be null");
    }

    /**
     * Run a validation.
     *
     * @param paths    files and directories to validate; relative paths are
     *                 resolved against the working directory
     * @param sortMode output order
     * @return errors and sorted violations
     * @throws ConfigurationException if a directory has no root or a rule is invalid
     */
    public ValidationReport run(List<Path> paths, SortMode sortMode) {
        Objects.requireNonNull(paths, "Paths must not be null");
        Objects.requireNonNull(sortMode, "Sort mode must not be null");

        List<Path> inputs = paths.stream().map(p -> p.toAbsolutePath().normalize()).toList();
        RootConfig rootConfig = rootConfigFor(inputs);

        FileCollector.Result collected = FileCollector.collect(inputs, rootConfig);
        List<LintError> errors = new ArrayList<>(collected.errors());

        Set<Path> files = new LinkedHashSet<>();
        for (Path file : collected.files()) {
            try {
                files.add(file.toRealPath());
            } catch (IOException e) {
                errors.add(LintError.file(file.toString(), FileCollector.describe(e)));
            }
        }
        if (files.isEmpty()) {
            LOG.info("No files to validate");
            return new ValidationReport(sortMode, errors, List.of());
        }

        Set<Path> dirs = new LinkedHashSet<>();
        for (Path file : files) {
            dirs.add(file.getParent());
        }
        RuleSetCache cache = RuleSetCache.build(dirs, resolver);
        errors.addAll(cache.errors());

        List<FileValidator.Result> results = validateAll(files, cache);

        List<Violation> violations = new ArrayList<>();
        for (FileValidator.Result result : results) {
            violations.addAll(result.violations());
            errors.addAll(result.errors());
        }
        violations.sort(Violation.comparator(sortMode));

        LOG.info("Validated {} file(s) in {} director(ies): {} violation(s), {} error(s)",
                files.size(), cache.size(), violations.size(), errors.size());
        return new ValidationReport(sortMode, errors, violations);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<FileValidator.Result> validateAll(Set<Path> files, RuleSetCache cache) {
        ExecutorService executor = Executors.newCachedThreadPool(new WorkerThreadFactory());
        try {
            List<CompletableFuture<FileValidator.Result>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                Optional<CollectedRuleSet> rules = cache.get(file.getParent());
                if (rules.isEmpty()) {
                    continue;
                }
                futures.add(CompletableFuture.supplyAsync(
                        () -> fileValidator.validate(file, rules.get()), executor));
            }

            List<FileValidator.Result> results = new ArrayList<>(futures.size());
            for (CompletableFuture<FileValidator.Result> future : futures) {
                results.add(join(future));
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }

    private static FileValidator.Result join(CompletableFuture<FileValidator.Result> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private static RootConfig rootConfigFor(List<Path> inputs) {
        for (Path input : inputs) {
            try {
                return RootConfigLoader.fromRootDir(RuleHierarchyResolver.findRoot(input));
            } catch (ConfigurationException | RuleFileParseException e) {
                LOG.debug("No usable root config for {}: {}", input, e.getMessage());
            }
        }
        return RootConfig.defaults();
    }

    /** Named daemon worker threads. */
    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "rec-lint-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
