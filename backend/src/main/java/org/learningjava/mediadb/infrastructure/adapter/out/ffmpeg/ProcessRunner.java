package org.learningjava.mediadb.infrastructure.adapter.out.ffmpeg;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/** Runs an external tool with a deadline and returns its combined output. */
class ProcessRunner {

    private final Duration timeout;

    ProcessRunner(Duration timeout) {
        this.timeout = timeout;
    }

    String run(List<String> command) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);
        Process process = builder.start();
        // the pipe must be drained while waiting or a chatty tool blocks on a full buffer
        CompletableFuture<byte[]> drained = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException(command.get(0) + " interrupted", ex);
        }
        if (!finished) {
            process.destroyForcibly();
            throw new IOException(command.get(0) + " timed out after " + timeout.toSeconds() + "s");
        }
        String output = new String(await(command.get(0), drained), StandardCharsets.UTF_8);
        if (process.exitValue() != 0) {
            throw new IOException(command.get(0) + " exited with " + process.exitValue() + ": " + summarize(output));
        }
        return output;
    }

    private static byte[] readAll(InputStream in) {
        try (in) {
            return in.readAllBytes();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static byte[] await(String tool, CompletableFuture<byte[]> drained) throws IOException {
        try {
            return drained.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IOException(tool + " interrupted while reading output", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() instanceof UncheckedIOException u ? u.getCause() : ex.getCause();
            throw new IOException("failed to read " + tool + " output", cause);
        }
    }

    private static String summarize(String output) {
        String trimmed = output.trim();
        return trimmed.length() > 300 ? trimmed.substring(trimmed.length() - 300) : trimmed;
    }
}
