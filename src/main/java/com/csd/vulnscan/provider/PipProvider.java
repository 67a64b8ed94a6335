package com.csd.vulnscan.provider;

import com.csd.vulnscan.exception.ManifestMissingException;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.DetectionResult;
import com.csd.vulnscan.model.LockfileOptions;
import com.csd.vulnscan.process.CommandRunner;
import com.csd.vulnscan.provider.parser.RequirementsParser;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Plain requirements.txt projects. There is no lockfile, so the manifest is always what gets parsed.
 */
@Slf4j
public class PipProvider extends AbstractEcosystemProvider {

    static final String REQUIREMENTS = "requirements.txt";

    public PipProvider(CommandRunner commandRunner) {
        super(commandRunner);
    }

    @Override
    public ProviderId id() {
        return ProviderId.PYTHON_PIP;
    }

    @Override
    public List<String> supportedFiles() {
        return List.of(REQUIREMENTS);
    }

    /**
     * Yields to Poetry whenever a pyproject.toml sits next to the requirements file.
     */
    @Override
    public Optional<DetectionResult> detect(Path dir) {
        if (!Files.isRegularFile(dir.resolve(REQUIREMENTS)) || Files.exists(dir.resolve(PoetryProvider.PYPROJECT))) {
            return Optional.empty();
        }
        return Optional.of(DetectionResult.builder()
                .providerId(id().id())
                .name("pip")
                .confidence(0.9)
                .build());
    }

    @Override
    public void ensureLockfile(Path dir, LockfileOptions options) {
        if (!Files.isRegularFile(dir.resolve(REQUIREMENTS))) {
            throw new ManifestMissingException("requirements.txt not found in " + dir);
        }
        if (options.isForceValidate()) {
            log.warn("Lockfile validation is not supported for requirements.txt");
        }
    }

    @Override
    protected List<Dependency> parseStandalone(Path file, boolean includeDev) {
        return RequirementsParser.parse(readLockfile(file));
    }

    @Override
    protected Optional<List<Dependency>> gatherFromLockfile(Path dir, boolean includeDev) {
        return Optional.empty();
    }

    @Override
    protected List<Dependency> gatherFromManifest(Path dir, boolean includeDev) {
        return RequirementsParser.parse(readManifest(dir.resolve(REQUIREMENTS)));
    }
}
