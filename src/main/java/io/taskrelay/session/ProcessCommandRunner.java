package io.taskrelay.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);
    private static final int MAX_OUTPUT_CHARS = 256 * 1024;

    @Override
    public CommandResult run(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        long safeTimeoutMs = Math.max(100L, timeoutMs);
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.debug("spawn failed for {}: {}", command.get(0), e.getMessage());
            return CommandResult.spawnFailed("spawn failed: " + e.getMessage());
        }

        try {
            process.getOutputStream().close();
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            boolean finished = process.waitFor(safeTimeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return new CommandResult(-1, "timeout after " + Duration.ofMillis(safeTimeoutMs), true);
            }
            String text = output.get(1, TimeUnit.SECONDS);
            return new CommandResult(process.exitValue(), truncate(text), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new CommandResult(-1, "interrupted", true);
        } catch (IOException | ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            return new CommandResult(-1, "execution failed: " + e.getMessage(), false);
        }
    }

    private static String readAll(InputStream in) {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        if (raw.length() <= MAX_OUTPUT_CHARS) {
            return raw;
        }
        return raw.substring(raw.length() - MAX_OUTPUT_CHARS);
    }
}
