package com.csd.vulnscan.process;

import com.csd.vulnscan.exception.PackageManagerInvocationException;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external executable with an explicit argument vector (never through a shell)
 * and waits for it to exit.
 */
public interface CommandRunner {

    /**
     * @throws PackageManagerInvocationException when the process cannot be started or does not exit in time
     */
    CommandResult run(Path workingDir, List<String> command);

    /**
     * Same as {@link #run} but treats a non-zero exit code as fatal.
     */
    default CommandResult runChecked(Path workingDir, List<String> command) {
        CommandResult result = run(workingDir, command);
        if (!result.isSuccess()) {
            throw new PackageManagerInvocationException(command, result.getExitCode(),
                    "Command '" + String.join(" ", command) + "' exited with code " + result.getExitCode()
                            + tail(result.getOutput()));
        }
        return result;
    }

    private static String tail(String output) {
        if (output == null || output.isBlank()) {
            return "";
        }
        String trimmed = output.strip();
        return ": " + (trimmed.length() > 500 ? "..." + trimmed.substring(trimmed.length() - 500) : trimmed);
    }
}
