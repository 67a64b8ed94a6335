package com.csd.vulnscan.service;

import com.csd.vulnscan.client.HttpStatusException;
import com.csd.vulnscan.client.PackageRegistryClient;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.MaintenanceInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Flags packages whose newest release is older than the configured window. Only npm and PyPI are supported.
 * Lookup problems end up in {@link MaintenanceInfo#getError()} instead of failing the scan.
 */
@Slf4j
public class MaintenanceService {

    private final PackageRegistryClient registryClient;
    private final Clock clock;
    private final int unmaintainedAfterDays;

    public MaintenanceService(PackageRegistryClient registryClient, Clock clock, int unmaintainedAfterDays) {
        this.registryClient = registryClient;
        this.clock = clock;
        this.unmaintainedAfterDays = unmaintainedAfterDays;
    }

    /**
     * Keyed by package name, in dependency order. A name seen with several versions is looked up once.
     */
    public Map<String, MaintenanceInfo> checkAll(List<Dependency> deps, int concurrency) {
        Map<String, Dependency> byName = new LinkedHashMap<>();
        for (Dependency dep : deps) {
            byName.putIfAbsent(dep.getName(), dep);
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, concurrency),
                new CustomizableThreadFactory("maintenance-check-"));
        try {
            List<CompletableFuture<MaintenanceInfo>> futures = new ArrayList<>();
            for (Dependency dep : byName.values()) {
                futures.add(CompletableFuture.supplyAsync(() -> check(dep.getName(), dep.getEcosystem()), pool));
            }
            Map<String, MaintenanceInfo> out = new LinkedHashMap<>();
            for (CompletableFuture<MaintenanceInfo> future : futures) {
                MaintenanceInfo info = future.join();
                out.put(info.getPackageName(), info);
            }
            long unmaintained = out.values().stream().filter(MaintenanceInfo::isUnmaintained).count();
            if (unmaintained > 0) {
                log.info("Found {} unmaintained package(s)", unmaintained);
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    public MaintenanceInfo check(String packageName, String ecosystem) {
        MaintenanceInfo.MaintenanceInfoBuilder info = MaintenanceInfo.builder()
                .packageName(packageName)
                .ecosystem(ecosystem);

        Optional<Instant> lastRelease;
        try {
            switch (ecosystem.toLowerCase(Locale.ROOT)) {
                case "npm" -> lastRelease = registryClient.npmLastRelease(packageName);
                case "pypi" -> lastRelease = registryClient.pypiLastRelease(packageName);
                default -> {
                    return info.error("Maintenance checking not supported for ecosystem: " + ecosystem).build();
                }
            }
        } catch (HttpStatusException e) {
            log.debug("Maintenance lookup for {} failed: {}", packageName, e.getMessage());
            return info.error(e.getStatus() == 404 ? "Package not found" : e.getMessage()).build();
        } catch (RuntimeException e) {
            log.debug("Maintenance lookup for {} failed: {}", packageName, e.getMessage());
            return info.error(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()).build();
        }

        if (lastRelease.isEmpty()) {
            return info.unmaintained(true).error("No release dates found").build();
        }
        long days = Duration.between(lastRelease.get(), clock.instant()).toDays();
        return info.lastReleaseDate(lastRelease.get())
                .daysSinceLastRelease(days)
                .unmaintained(days >= unmaintainedAfterDays)
                .build();
    }
}
