package com.csd.vulnscan.provider;

import com.csd.vulnscan.exception.LockfileParseException;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.DetectionResult;
import com.csd.vulnscan.model.LockfileOptions;
import com.csd.vulnscan.process.CommandRunner;
import com.csd.vulnscan.provider.parser.PoetryParser;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Slf4j
public class PoetryProvider extends AbstractEcosystemProvider {

    static final String PYPROJECT = "pyproject.toml";
    static final String POETRY_LOCK = "poetry.lock";

    static final List<String> LOCK = List.of("poetry", "lock", "--no-update");
    static final List<String> CHECK = List.of("poetry", "check", "--lock");

    public PoetryProvider(CommandRunner commandRunner) {
        super(commandRunner);
    }

    @Override
    public ProviderId id() {
        return ProviderId.PYTHON_POETRY;
    }

    @Override
    public List<String> supportedFiles() {
        return List.of(PYPROJECT, POETRY_LOCK);
    }

    @Override
    public Optional<DetectionResult> detect(Path dir) {
        Path pyproject = dir.resolve(PYPROJECT);
        if (!Files.isRegularFile(pyproject)) {
            return Optional.empty();
        }
        try {
            if (PoetryParser.isPoetryProject(Files.readString(pyproject, StandardCharsets.UTF_8))) {
                return Optional.of(DetectionResult.builder()
                        .providerId(id().id())
                        .name("Poetry")
                        .confidence(1.0)
                        .build());
            }
        } catch (IOException e) {
            log.debug("Could not read {}: {}", pyproject, e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public void ensureLockfile(Path dir, LockfileOptions options) {
        boolean hasLock = Files.exists(dir.resolve(POETRY_LOCK));

        if (options.isForceRefresh()) {
            commandRunner.runChecked(dir, LOCK);
        } else if (options.isForceValidate()) {
            commandRunner.runChecked(dir, CHECK);
        } else if (!hasLock && options.isCreateIfMissing()) {
            commandRunner.runChecked(dir, LOCK);
        } else if (hasLock && options.isValidateIfPresent()) {
            commandRunner.runChecked(dir, CHECK);
        }
    }

    @Override
    protected List<Dependency> parseStandalone(Path file, boolean includeDev) {
        String content = readLockfile(file);
        if (nameEndsWith(file, POETRY_LOCK)) {
            return PoetryParser.parseLockfile(content, includeDev);
        }
        if (nameEndsWith(file, PYPROJECT)) {
            return PoetryParser.parsePyproject(content, includeDev);
        }
        throw new LockfileParseException("Unsupported Poetry file: " + file.getFileName());
    }

    @Override
    protected Optional<List<Dependency>> gatherFromLockfile(Path dir, boolean includeDev) {
        Path lock = dir.resolve(POETRY_LOCK);
        if (!Files.exists(lock)) {
            return Optional.empty();
        }
        return Optional.of(PoetryParser.parseLockfile(readLockfile(lock), includeDev));
    }

    @Override
    protected List<Dependency> gatherFromManifest(Path dir, boolean includeDev) {
        return PoetryParser.parsePyproject(readManifest(dir.resolve(PYPROJECT)), includeDev);
    }
}
