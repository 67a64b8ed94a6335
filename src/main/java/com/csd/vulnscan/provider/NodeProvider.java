package com.csd.vulnscan.provider;

import com.csd.vulnscan.exception.LockfileMissingException;
import com.csd.vulnscan.exception.LockfileParseException;
import com.csd.vulnscan.exception.ScanException;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.DetectionResult;
import com.csd.vulnscan.model.LockfileOptions;
import com.csd.vulnscan.process.CommandRunner;
import com.csd.vulnscan.provider.parser.Ecosystems;
import com.csd.vulnscan.provider.parser.NpmLockParser;
import com.csd.vulnscan.provider.parser.PnpmLockParser;
import com.csd.vulnscan.provider.parser.YarnLockParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * npm, pnpm and yarn (classic and berry) projects.
 */
@Slf4j
public class NodeProvider extends AbstractEcosystemProvider {

    static final String PACKAGE_JSON = "package.json";
    static final String PACKAGE_LOCK = "package-lock.json";
    static final String SHRINKWRAP = "npm-shrinkwrap.json";
    static final String PNPM_LOCK = "pnpm-lock.yaml";
    static final String PNPM_WORKSPACE = "pnpm-workspace.yaml";
    static final String YARN_LOCK = "yarn.lock";

    private static final List<String> SUPPORTED_FILES =
            List.of(PACKAGE_JSON, PACKAGE_LOCK, SHRINKWRAP, PNPM_LOCK, PNPM_WORKSPACE, YARN_LOCK);

    private static final ObjectMapper mapper = new ObjectMapper();

    public enum PackageManager { NPM, PNPM, YARN }

    public enum YarnVariant { CLASSIC, BERRY }

    @Value
    static class DetectedPm {
        PackageManager name;
        YarnVariant variant;  // null unless yarn

        String displayName() {
            return name.name().toLowerCase();
        }
    }

    public NodeProvider(CommandRunner commandRunner) {
        super(commandRunner);
    }

    @Override
    public ProviderId id() {
        return ProviderId.NODE;
    }

    @Override
    public List<String> supportedFiles() {
        return SUPPORTED_FILES;
    }

    @Override
    public Optional<DetectionResult> detect(Path dir) {
        if (!Files.isRegularFile(dir.resolve(PACKAGE_JSON))) {
            return Optional.empty();
        }
        DetectedPm pm = detectPackageManager(dir);
        return Optional.of(DetectionResult.builder()
                .providerId(id().id())
                .name(pm.displayName())
                .variant(pm.getVariant() == null ? null : pm.getVariant().name().toLowerCase())
                .confidence(1.0)
                .build());
    }

    @Override
    public void ensureLockfile(Path dir, LockfileOptions options) {
        DetectedPm pm = detectPackageManager(dir);
        boolean hasLock = switch (pm.getName()) {
            case PNPM -> Files.exists(dir.resolve(PNPM_LOCK));
            case YARN -> Files.exists(dir.resolve(YARN_LOCK));
            case NPM -> Files.exists(dir.resolve(PACKAGE_LOCK)) || Files.exists(dir.resolve(SHRINKWRAP));
        };

        if (options.isForceRefresh()) {
            commandRunner.runChecked(dir, createCommand(pm));
        } else if (options.isForceValidate()) {
            commandRunner.runChecked(dir, validateCommand(pm));
        } else if (!hasLock && options.isCreateIfMissing()) {
            commandRunner.runChecked(dir, createCommand(pm));
        } else if (hasLock && options.isValidateIfPresent()) {
            commandRunner.runChecked(dir, validateCommand(pm));
        }
    }

    @Override
    protected List<Dependency> parseStandalone(Path file, boolean includeDev) {
        if (nameEndsWith(file, PACKAGE_JSON)) {
            throw new LockfileMissingException("package.json requires a lockfile for accurate dependency resolution. "
                    + "Scan the lockfile (package-lock.json, pnpm-lock.yaml, or yarn.lock) instead, "
                    + "or scan the directory containing both files.");
        }
        if (nameEndsWith(file, PNPM_WORKSPACE)) {
            throw new LockfileMissingException("pnpm-workspace.yaml only defines workspace structure, not dependencies. "
                    + "Scan pnpm-lock.yaml from the workspace root instead.");
        }

        String content = readLockfile(file);
        if (nameEndsWith(file, PNPM_LOCK)) {
            return PnpmLockParser.parse(content, includeDev);
        }
        if (nameEndsWith(file, PACKAGE_LOCK) || nameEndsWith(file, SHRINKWRAP)) {
            return NpmLockParser.parse(content);
        }
        if (nameEndsWith(file, YARN_LOCK)) {
            return YarnLockParser.parse(content);
        }
        throw new LockfileParseException("Unsupported Node.js lockfile: " + file.getFileName());
    }

    @Override
    protected Optional<List<Dependency>> gatherFromLockfile(Path dir, boolean includeDev) {
        DetectedPm pm = detectPackageManager(dir);
        switch (pm.getName()) {
            case NPM -> {
                Path lock = dir.resolve(PACKAGE_LOCK);
                if (Files.exists(lock)) {
                    return Optional.of(NpmLockParser.parse(readLockfile(lock)));
                }
            }
            case PNPM -> {
                Path lock = dir.resolve(PNPM_LOCK);
                if (Files.exists(lock)) {
                    return Optional.of(PnpmLockParser.parse(readLockfile(lock), includeDev));
                }
            }
            case YARN -> {
                Path lock = dir.resolve(YARN_LOCK);
                if (Files.exists(lock)) {
                    String content = readLockfile(lock);
                    return Optional.of(pm.getVariant() == YarnVariant.BERRY || YarnLockParser.isBerry(content)
                            ? YarnLockParser.parseBerry(content)
                            : YarnLockParser.parseClassic(content));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    protected List<Dependency> gatherFromManifest(Path dir, boolean includeDev) {
        Path manifest = dir.resolve(PACKAGE_JSON);
        JsonNode pkg;
        try {
            pkg = mapper.readTree(readManifest(manifest));
        } catch (IOException e) {
            throw new ScanException("Invalid package.json in " + dir + ": " + e.getMessage(), e);
        }

        List<Dependency> out = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        addDeclared(pkg.path("dependencies"), out, seen);
        if (includeDev) {
            addDeclared(pkg.path("devDependencies"), out, seen);
        }
        log.debug("Read {} declared dependencies from {}", out.size(), manifest);
        return out;
    }

    private static void addDeclared(JsonNode section, List<Dependency> out, Set<String> seen) {
        Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String version = entry.getValue().asText();
            if (seen.add(entry.getKey() + "@" + version)) {
                out.add(new Dependency(entry.getKey(), version, Ecosystems.NPM));
            }
        }
    }

    /**
     * Lockfiles first, then the {@code packageManager} field, then a pnpm workspace hint; npm otherwise.
     */
    DetectedPm detectPackageManager(Path dir) {
        if (Files.exists(dir.resolve(PNPM_LOCK))) {
            return new DetectedPm(PackageManager.PNPM, null);
        }
        if (Files.exists(dir.resolve(YARN_LOCK))) {
            return new DetectedPm(PackageManager.YARN, yarnVariant(null));
        }
        if (Files.exists(dir.resolve(PACKAGE_LOCK)) || Files.exists(dir.resolve(SHRINKWRAP))) {
            return new DetectedPm(PackageManager.NPM, null);
        }

        Path pkgPath = dir.resolve(PACKAGE_JSON);
        if (Files.isRegularFile(pkgPath)) {
            try {
                String field = mapper.readTree(pkgPath.toFile()).path("packageManager").asText("");
                if (field.startsWith("pnpm@")) {
                    return new DetectedPm(PackageManager.PNPM, null);
                }
                if (field.startsWith("yarn@")) {
                    return new DetectedPm(PackageManager.YARN, yarnVariant(field));
                }
                if (field.startsWith("npm@")) {
                    return new DetectedPm(PackageManager.NPM, null);
                }
            } catch (IOException e) {
                log.debug("Could not read packageManager field from {}: {}", pkgPath, e.getMessage());
            }
        }

        if (Files.exists(dir.resolve(PNPM_WORKSPACE))) {
            return new DetectedPm(PackageManager.PNPM, null);
        }
        return new DetectedPm(PackageManager.NPM, null);
    }

    /**
     * Berry is yarn 2+, identified from a {@code yarn@X.Y.Z} packageManager value; classic otherwise.
     */
    private static YarnVariant yarnVariant(String packageManagerField) {
        if (packageManagerField != null) {
            String ver = packageManagerField.substring(packageManagerField.indexOf('@') + 1);
            int dot = ver.indexOf('.');
            try {
                int major = Integer.parseInt(dot > 0 ? ver.substring(0, dot) : ver);
                if (major >= 2) {
                    return YarnVariant.BERRY;
                }
            } catch (NumberFormatException e) {
                log.debug("Unrecognised yarn version in packageManager field: {}", packageManagerField);
            }
        }
        return YarnVariant.CLASSIC;
    }

    static List<String> createCommand(DetectedPm pm) {
        return switch (pm.getName()) {
            case PNPM -> List.of("pnpm", "install", "--lockfile-only");
            case NPM -> List.of("npm", "install", "--package-lock-only");
            case YARN -> pm.getVariant() == YarnVariant.BERRY
                    ? List.of("yarn", "install", "--mode=update-lockfile")
                    : List.of("yarn", "install");
        };
    }

    static List<String> validateCommand(DetectedPm pm) {
        return switch (pm.getName()) {
            case PNPM -> List.of("pnpm", "install", "--frozen-lockfile");
            case NPM -> List.of("npm", "ci", "--dry-run");
            case YARN -> pm.getVariant() == YarnVariant.BERRY
                    ? List.of("yarn", "install", "--immutable")
                    : List.of("yarn", "install", "--frozen-lockfile");
        };
    }
}
