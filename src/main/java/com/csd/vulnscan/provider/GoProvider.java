package com.csd.vulnscan.provider;

import com.csd.vulnscan.exception.LockfileParseException;
import com.csd.vulnscan.exception.ManifestMissingException;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.DetectionResult;
import com.csd.vulnscan.model.LockfileOptions;
import com.csd.vulnscan.process.CommandRunner;
import com.csd.vulnscan.provider.parser.GoModParser;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Go modules: go.sum holds resolved versions, go.mod the declared requirements.
 */
@Slf4j
public class GoProvider extends AbstractEcosystemProvider {

    static final String GO_MOD = "go.mod";
    static final String GO_SUM = "go.sum";

    static final List<String> TIDY = List.of("go", "mod", "tidy");
    static final List<String> VERIFY = List.of("go", "mod", "verify");

    public GoProvider(CommandRunner commandRunner) {
        super(commandRunner);
    }

    @Override
    public ProviderId id() {
        return ProviderId.GO;
    }

    @Override
    public List<String> supportedFiles() {
        return List.of(GO_MOD, GO_SUM);
    }

    @Override
    public Optional<DetectionResult> detect(Path dir) {
        if (!Files.isRegularFile(dir.resolve(GO_MOD))) {
            return Optional.empty();
        }
        return Optional.of(DetectionResult.builder()
                .providerId(id().id())
                .name("Go modules")
                .confidence(1.0)
                .build());
    }

    @Override
    public void ensureLockfile(Path dir, LockfileOptions options) {
        if (!Files.isRegularFile(dir.resolve(GO_MOD))) {
            throw new ManifestMissingException("go.mod not found in " + dir);
        }
        boolean hasSum = Files.exists(dir.resolve(GO_SUM));

        if (options.isForceRefresh()) {
            commandRunner.runChecked(dir, TIDY);
        } else if (options.isForceValidate()) {
            if (!hasSum) {
                log.warn("go.sum not found in {} - run 'go mod download' to generate it", dir);
            }
            commandRunner.runChecked(dir, VERIFY);
        } else if (!hasSum && options.isCreateIfMissing()) {
            commandRunner.runChecked(dir, TIDY);
        } else if (hasSum && options.isValidateIfPresent()) {
            commandRunner.runChecked(dir, VERIFY);
        }
    }

    @Override
    protected List<Dependency> parseStandalone(Path file, boolean includeDev) {
        String content = readLockfile(file);
        if (nameEndsWith(file, GO_SUM)) {
            return GoModParser.parseGoSum(content);
        }
        if (nameEndsWith(file, GO_MOD)) {
            return GoModParser.parseGoMod(content, includeDev);
        }
        throw new LockfileParseException("Unsupported Go file: " + file.getFileName());
    }

    @Override
    protected Optional<List<Dependency>> gatherFromLockfile(Path dir, boolean includeDev) {
        Path sum = dir.resolve(GO_SUM);
        if (!Files.exists(sum)) {
            return Optional.empty();
        }
        return Optional.of(GoModParser.parseGoSum(readLockfile(sum)));
    }

    @Override
    protected List<Dependency> gatherFromManifest(Path dir, boolean includeDev) {
        return GoModParser.parseGoMod(readManifest(dir.resolve(GO_MOD)), includeDev);
    }
}
