package com.csd.vulnscan.process;

import com.csd.vulnscan.exception.PackageManagerInvocationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProcessCommandRunnerTest {

    @TempDir
    Path dir;

    @Test
    void missingExecutableIsAnInvocationError() {
        ProcessCommandRunner runner = new ProcessCommandRunner(Duration.ofSeconds(5));
        PackageManagerInvocationException ex = assertThrows(PackageManagerInvocationException.class,
                () -> runner.run(dir, List.of("definitely-not-a-real-binary-4711")));
        assertEquals(-1, ex.getExitCode());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void nonZeroExitFailsCheckedRun() {
        ProcessCommandRunner runner = new ProcessCommandRunner(Duration.ofSeconds(5));
        assertFalse(runner.run(dir, List.of("false")).isSuccess());
        PackageManagerInvocationException ex = assertThrows(PackageManagerInvocationException.class,
                () -> runner.runChecked(dir, List.of("false")));
        assertEquals(List.of("false"), ex.getCommand());
        assertEquals(1, ex.getExitCode());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void capturesOutput() {
        ProcessCommandRunner runner = new ProcessCommandRunner(Duration.ofSeconds(5));
        CommandResult result = runner.runChecked(dir, List.of("echo", "hello"));
        assertEquals("hello", result.getOutput().trim());
    }
}
