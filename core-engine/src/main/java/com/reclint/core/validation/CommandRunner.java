package com.reclint.core.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the external command of a {@code custom} rule.
 *
 * <p>
 * The call blocks until the process exits; there is no timeout. Output is
 * decoded as UTF-8 with malformed bytes replaced. Stderr is drained on its
 * own thread while stdout is read on the calling thread.
 * </p>
 *
 * @since 1.0.0
 */
class CommandRunner {

    private static final Logger LOG = LoggerFactory.getLogger(CommandRunner.class);

    /** One dedicated daemon thread per stderr stream. */
    private static final Executor STDERR_READER = task -> {
        Thread thread = new Thread(task, "rec-lint-stderr-reader");
        thread.setDaemon(true);
        thread.start();
    };

    /**
     * Run a command.
     *
     * @param command program followed by its arguments
     * @return empty on exit status 0, otherwise the trimmed stdout followed by
     *         stderr
     * @throws IOException if the process cannot be started or its output read
     */
    Optional<String> run(List<String> command) throws IOException {
        LOG.trace("Running {}", command);
        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()),
                STDERR_READER);
        String stdout;
        try (InputStream in = process.getInputStream()) {
            stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new IOException("Interrupted while waiting for " + command.get(0), e);
        }

        String errors;
        try {
            errors = stderr.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof UncheckedIOException io) {
                throw io.getCause();
            }
            throw e;
        }

        if (exitCode == 0) {
            return Optional.empty();
        }
        LOG.debug("{} exited with status {}", command.get(0), exitCode);
        return Optional.of((stdout + errors).trim());
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
