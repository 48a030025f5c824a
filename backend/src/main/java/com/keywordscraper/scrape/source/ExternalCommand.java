package com.keywordscraper.scrape.source;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a command line tool with a hard timeout and captures its standard output.
 * Standard error is discarded.
 */
final class ExternalCommand {

    record Output(int exitCode, String stdout) {}

    private ExternalCommand() {
    }

    static Output run(List<String> command, int timeoutSeconds) throws ContentSourceException {
        Process process;
        try {
            process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        } catch (IOException e) {
            throw new ContentSourceException(
                ContentSourceRegistry.ERROR_UNAVAILABLE,
                "Unable to start " + command.get(0) + ": " + e.getMessage(),
                e
            );
        }
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ContentSourceException(
                    "timeout",
                    command.get(0) + " timed out after " + timeoutSeconds + "s"
                );
            }
            String output = stdout.get(5, TimeUnit.SECONDS);
            return new Output(process.exitValue(), output);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ContentSourceException("interrupted", command.get(0) + " interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ContentSourceException(
                ContentSourceRegistry.ERROR_SOURCE,
                "Failed to read output of " + command.get(0) + ": " + e.getMessage(),
                e
            );
        }
    }

    private static String readAll(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
