package com.csd.vulnscan.service;

import com.csd.vulnscan.exception.DetectionFailureException;
import com.csd.vulnscan.exception.ManifestMissingException;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.DetectionResult;
import com.csd.vulnscan.model.IgnoreFilterResult;
import com.csd.vulnscan.model.LockfileMode;
import com.csd.vulnscan.model.MaintenanceInfo;
import com.csd.vulnscan.model.ScanInput;
import com.csd.vulnscan.model.ScanOptions;
import com.csd.vulnscan.model.ScanResult;
import com.csd.vulnscan.model.UnifiedAdvisory;
import com.csd.vulnscan.provider.EcosystemProvider;
import com.csd.vulnscan.provider.ProviderRegistry;
import com.csd.vulnscan.provider.ProviderSelection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one scan end to end: detect, prepare the lockfile, gather, query, merge, filter.
 * A failing stage aborts the scan with its own exception; no partial result is produced.
 */
@Slf4j
@Service
public class ScanService {

    // manifests scan their whole directory so the lockfile next to them is preferred
    private static final Set<String> MANIFEST_FILES = Set.of("package.json", "pyproject.toml", "requirements.txt", "go.mod");

    private final ProviderRegistry providerRegistry;
    private final AdvisoryQueryEngine queryEngine;
    private final AdvisoryMerger merger;
    private final IgnoreService ignoreService;
    private final MaintenanceService maintenanceService;

    public ScanService(ProviderRegistry providerRegistry, AdvisoryQueryEngine queryEngine, AdvisoryMerger merger,
                       IgnoreService ignoreService, MaintenanceService maintenanceService) {
        this.providerRegistry = providerRegistry;
        this.queryEngine = queryEngine;
        this.merger = merger;
        this.ignoreService = ignoreService;
        this.maintenanceService = maintenanceService;
    }

    public ScanResult scan(Path path, ScanOptions options) {
        if (options.getConcurrency() < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + options.getConcurrency());
        }
        long start = System.currentTimeMillis();

        ScanInput input = resolveInput(path);
        ProviderSelection selection = providerRegistry.selectProvider(input);
        EcosystemProvider provider = selection.getProvider();
        DetectionResult detection = selection.getDetection();
        log.info("=== Scanning {} ({} ecosystem{}) ===", path, detection.getName(),
                input.isStandalone() ? ", standalone " + input.fileName() : "");

        LockfileMode mode = options.effectiveLockfileMode();
        if (mode != LockfileMode.NONE) {
            log.info("Lockfile mode {} for {}", mode, input.getDirectory());
            provider.ensureLockfile(input.getDirectory(), mode.toOptions());
        }

        List<Dependency> deps = provider.gatherDependencies(input, options.isIncludeDev());
        if (deps.isEmpty()) {
            log.info("No dependencies found in {}", path);
            return ScanResult.builder()
                    .detection(detection)
                    .deps(List.copyOf(deps))
                    .advisoriesByPackage(Map.of())
                    .maintenance(Map.of())
                    .scanDurationMs(System.currentTimeMillis() - start)
                    .build();
        }
        log.info("Found {} dependencies, querying advisories", deps.size());

        AdvisoryQueryResult raw = queryEngine.query(deps, options.getConcurrency());
        Map<String, List<UnifiedAdvisory>> merged = merger.merge(deps, raw);

        IgnoreFilterResult filtered = ignoreService.findIgnoreFile(input.getDirectory(), options.getIgnoreFilePath())
                .flatMap(ignoreService::loadIgnoreConfig)
                .map(config -> ignoreService.filterAdvisories(merged, deps, config))
                .orElseGet(() -> new IgnoreFilterResult(merged, 0));

        Map<String, MaintenanceInfo> maintenance = options.isCheckMaintenance()
                ? maintenanceService.checkAll(deps, options.getConcurrency())
                : new LinkedHashMap<>();

        ScanResult result = ScanResult.builder()
                .detection(detection)
                .deps(List.copyOf(deps))
                .advisoriesByPackage(freeze(filtered.getAdvisoriesByPackage()))
                .suppressedCount(filtered.getSuppressedCount())
                .maintenance(Collections.unmodifiableMap(new LinkedHashMap<>(maintenance)))
                .scanDurationMs(System.currentTimeMillis() - start)
                .build();
        log.info("=== Scan of {} complete: {} advisories across {} packages in {} ms ===", path,
                result.totalAdvisories(), result.getAdvisoriesByPackage().size(), result.getScanDurationMs());
        return result;
    }

    public List<String> listSupportedManifestFilenames() {
        return providerRegistry.listSupportedManifestFilenames();
    }

    /**
     * A file name only has to end with a supported name, so uploads stored as {@code 8a161a-pnpm-lock.yaml} are accepted.
     */
    ScanInput resolveInput(Path path) {
        if (!Files.exists(path)) {
            throw new ManifestMissingException("Path not found: " + path);
        }
        if (Files.isDirectory(path)) {
            return ScanInput.directory(path);
        }

        String fileName = path.getFileName().toString();
        List<String> supported = listSupportedManifestFilenames();
        if (supported.stream().noneMatch(fileName::endsWith)) {
            throw new DetectionFailureException("Unsupported file: " + fileName
                    + ". Supported files: " + String.join(", ", supported));
        }
        if (MANIFEST_FILES.contains(fileName)) {
            return ScanInput.directory(path.toAbsolutePath().getParent());
        }
        return ScanInput.standalone(path);
    }

    private static Map<String, List<UnifiedAdvisory>> freeze(Map<String, List<UnifiedAdvisory>> advisoriesByPackage) {
        Map<String, List<UnifiedAdvisory>> copy = new LinkedHashMap<>();
        advisoriesByPackage.forEach((key, advisories) -> copy.put(key, List.copyOf(advisories)));
        return Collections.unmodifiableMap(copy);
    }
}
