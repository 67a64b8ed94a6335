package com.csd.vulnscan.process;

import com.csd.vulnscan.exception.PackageManagerInvocationException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
public class ProcessCommandRunner implements CommandRunner {

    private final Duration timeout;

    public ProcessCommandRunner(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public CommandResult run(Path workingDir, List<String> command) {
        log.info("Running '{}' in {}", String.join(" ", command), workingDir);
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // keep package managers from prompting or colouring output
        pb.environment().put("CI", "true");
        pb.environment().put("NO_COLOR", "1");

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new PackageManagerInvocationException(command,
                    "Failed to start '" + command.get(0) + "': " + e.getMessage(), e);
        }

        // drain output concurrently so a chatty process cannot block on a full pipe
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new PackageManagerInvocationException(command, -1,
                        "Command '" + String.join(" ", command) + "' timed out after " + timeout);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new PackageManagerInvocationException(command, "Interrupted while waiting for '" + command.get(0) + "'", e);
        }

        int exitCode = process.exitValue();
        String text = output.join();
        log.debug("'{}' exited with {}", String.join(" ", command), exitCode);
        return new CommandResult(exitCode, text);
    }

    private static String readAll(InputStream in) {
        try (in; ByteArrayOutputStream buffer = new ByteArrayOutputStream()) {
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
