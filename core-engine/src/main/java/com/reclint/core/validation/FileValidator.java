package com.reclint.core.validation;

import com.reclint.core.hierarchy.CollectedRuleSet;
import com.reclint.core.rule.CommandRule;
import com.reclint.core.rule.CommentLanguageRule;
import com.reclint.core.rule.DocRequiredRule;
import com.reclint.core.rule.RegexRule;
import com.reclint.core.rule.Rule;
import com.reclint.core.rule.RuleVisitor;
import com.reclint.core.rule.TestExistenceRule;
import com.reclint.core.rule.TestNameRule;
import com.reclint.core.rule.TextRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies the effective rules of a directory to one of its files.
 *
 * <p>
 * Rules run in validation order ({@code required} then {@code deny}, each
 * root-first). A failure of one rule (command that cannot be started,
 * missing or failing validator) is recorded as a file error and the
 * remaining rules still run.
 * </p>
 *
 * @since 1.0.0
 */
final class FileValidator {

    private static final Logger LOG = LoggerFactory.getLogger(FileValidator.class);

    /**
     * Violations and errors of one file.
     *
     * @param violations violations in rule order
     * @param errors     file-scoped errors
     */
    record Result(List<Violation> violations, List<LintError> errors) {

        static Result error(LintError error) {
            return new Result(List.of(), List.of(error));
        }
    }

    private final ValidatorRegistry registry;
    private final CommandRunner commandRunner;

    FileValidator(ValidatorRegistry registry, CommandRunner commandRunner) {
        this.registry = Objects.requireNonNull(registry, "Validator registry must not be null");
        this.commandRunner = Objects.requireNonNull(commandRunner, "Command runner must not be null");
    }

    /**
     * Validate a file.
     *
     * @param file  canonical file path
     * @param rules effective rules of the file's directory
     * @return violations and errors
     */
    Result validate(Path file, CollectedRuleSet rules) {
        String displayPath = rules.relativize(file);
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            LOG.warn("Cannot read {}: {}", file, e.getMessage());
            return Result.error(LintError.file(displayPath, FileCollector.describe(e)));
        }

        RuleChecker checker = new RuleChecker(file, displayPath, content, rules.rootDir());
        for (Rule rule : rules.enforcedRules()) {
            if (!rule.appliesTo(file)) {
                LOG.trace("Rule '{}' does not apply to {}", rule.label(), displayPath);
                continue;
            }
            checker.violations.addAll(rule.accept(checker));
        }
        return new Result(checker.violations, checker.errors);
    }

    // ---------------------------------------------------------------
    // Per-variant checks
    // ---------------------------------------------------------------

    private final class RuleChecker implements RuleVisitor<List<Violation>> {

        private final Path file;
        private final String displayPath;
        private final String content;
        private final Path rootDir;
        private final List<Violation> violations = new ArrayList<>();
        private final List<LintError> errors = new ArrayList<>();

        RuleChecker(Path file, String displayPath, String content, Path rootDir) {
            this.file = file;
            this.displayPath = displayPath;
            this.content = content;
            this.rootDir = rootDir;
        }

        @Override
        public List<Violation> visitText(TextRule rule) {
            return toViolations(rule, LineScanner.scanTexts(content, rule.keywords()));
        }

        @Override
        public List<Violation> visitRegex(RegexRule rule) {
            return toViolations(rule, LineScanner.scanPatterns(content, rule.patterns()));
        }

        @Override
        public List<Violation> visitCommand(CommandRule rule) {
            List<String> command = rule.commandFor(file.toString());
            if (command.isEmpty() || command.get(0).isEmpty()) {
                return List.of();
            }
            try {
                Optional<String> failure = commandRunner.run(command);
                return failure.map(output -> List.of(Violation.command(displayPath, rule.message(), output)))
                        .orElse(List.of());
            } catch (IOException e) {
                LOG.warn("Rule '{}' could not run '{}' on {}: {}", rule.label(), command.get(0), displayPath,
                        e.getMessage());
                errors.add(LintError.file(displayPath, FileCollector.describe(e)));
                return List.of();
            }
        }

        @Override
        public List<Violation> visitDocRequired(DocRequiredRule rule) {
            return delegate(rule);
        }

        @Override
        public List<Violation> visitCommentLanguage(CommentLanguageRule rule) {
            return delegate(rule);
        }

        @Override
        public List<Violation> visitTestName(TestNameRule rule) {
            return delegate(rule);
        }

        @Override
        public List<Violation> visitTestExistence(TestExistenceRule rule) {
            return delegate(rule);
        }

        private List<Violation> delegate(Rule rule) {
            Optional<Validator> validator = registry.find(rule.kind());
            if (validator.isEmpty()) {
                errors.add(LintError.file(displayPath,
                        "no validator registered for rule type '" + rule.kind().configName() + "'"));
                return List.of();
            }
            try {
                return toViolations(rule, validator.get().validate(file, content, rule, rootDir));
            } catch (RuntimeException e) {
                LOG.warn("Validator for rule '{}' failed on {}", rule.label(), displayPath, e);
                errors.add(LintError.file(displayPath, "rule '" + rule.label() + "' failed: " + e.getMessage()));
                return List.of();
            }
        }

        private List<Violation> toViolations(Rule rule, List<Finding> findings) {
            if (!findings.isEmpty()) {
                LOG.debug("Rule '{}' reported {} finding(s) in {}", rule.label(), findings.size(), displayPath);
            }
            List<Violation> result = new ArrayList<>(findings.size());
            for (Finding finding : findings) {
                result.add(finding.isFileLevel()
                        ? new Violation(displayPath, 0, 0, rule.message(), finding.found(), null)
                        : Violation.atLine(displayPath, finding.line(), finding.column(), rule.message(),
                                finding.found()));
            }
            return result;
        }
    }
}
