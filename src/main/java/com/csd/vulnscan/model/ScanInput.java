package com.csd.vulnscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.file.Path;

/**
 * What a scan reads from: a project directory, or one lockfile the caller picked explicitly.
 * Standalone files are parsed as-is and never replaced by a manifest fallback.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScanInput {

    public enum Mode { DIRECTORY, STANDALONE }

    Mode mode;
    Path directory;
    Path file;      // null in DIRECTORY mode

    public static ScanInput directory(Path dir) {
        return new ScanInput(Mode.DIRECTORY, dir, null);
    }

    public static ScanInput standalone(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        return new ScanInput(Mode.STANDALONE, parent, file);
    }

    public boolean isStandalone() {
        return mode == Mode.STANDALONE;
    }

    public String fileName() {
        return file == null ? "" : file.getFileName().toString();
    }
}
