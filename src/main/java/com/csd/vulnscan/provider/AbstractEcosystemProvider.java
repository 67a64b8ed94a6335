package com.csd.vulnscan.provider;

import com.csd.vulnscan.exception.LockfileParseException;
import com.csd.vulnscan.exception.ManifestMissingException;
import com.csd.vulnscan.exception.ScanException;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.ScanInput;
import com.csd.vulnscan.process.CommandRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Holds the lockfile-versus-manifest policy shared by every ecosystem.
 */
@Slf4j
public abstract class AbstractEcosystemProvider implements EcosystemProvider {

    protected final CommandRunner commandRunner;

    protected AbstractEcosystemProvider(CommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public final List<Dependency> gatherDependencies(ScanInput input, boolean includeDev) {
        if (input.isStandalone()) {
            return parseStandalone(input.getFile(), includeDev);
        }

        Path dir = input.getDirectory();
        try {
            Optional<List<Dependency>> fromLockfile = gatherFromLockfile(dir, includeDev);
            if (fromLockfile.isPresent()) {
                return fromLockfile.get();
            }
        } catch (LockfileParseException e) {
            log.warn("Lockfile parsing failed in {}, falling back to declared dependencies: {}", dir, e.getMessage());
        }
        return gatherFromManifest(dir, includeDev);
    }

    /**
     * Parses one explicitly chosen file; the parser is picked from the file name alone.
     */
    protected abstract List<Dependency> parseStandalone(Path file, boolean includeDev);

    /**
     * Empty when the directory has no lockfile for this ecosystem.
     */
    protected abstract Optional<List<Dependency>> gatherFromLockfile(Path dir, boolean includeDev);

    protected abstract List<Dependency> gatherFromManifest(Path dir, boolean includeDev);

    protected static String readLockfile(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LockfileParseException("Failed to read " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    protected static String readManifest(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ManifestMissingException(path.getFileName() + " not found in " + path.getParent());
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScanException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    protected static boolean nameEndsWith(Path file, String suffix) {
        return file.getFileName().toString().endsWith(suffix);
    }
}
