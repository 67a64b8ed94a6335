package com.csd.vulnscan.service;

import com.csd.vulnscan.client.GhsaAdvisory;
import com.csd.vulnscan.client.GhsaClient;
import com.csd.vulnscan.client.OsvClient;
import com.csd.vulnscan.exception.ScanException;
import com.csd.vulnscan.model.AdvisorySeverity;
import com.csd.vulnscan.model.AdvisorySource;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.UnifiedAdvisory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fans dependency lookups out to both advisory sources on a bounded pool.
 * OSV is asked in batches; GitHub one package at a time.
 */
@Slf4j
public class AdvisoryQueryEngine {

    private final OsvClient osvClient;
    private final GhsaClient ghsaClient;   // null when the GitHub source is disabled
    private final int batchSize;

    public AdvisoryQueryEngine(OsvClient osvClient, GhsaClient ghsaClient, int batchSize) {
        this.osvClient = osvClient;
        this.ghsaClient = ghsaClient;
        this.batchSize = Math.max(1, Math.min(batchSize, OsvClient.MAX_BATCH_SIZE));
    }

    /**
     * Every task runs to completion even when a sibling fails; the first failure in submission
     * order is then rethrown, so a partial result is never returned.
     */
    public AdvisoryQueryResult query(List<Dependency> deps, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        Map<String, List<UnifiedAdvisory>> osv = new ConcurrentHashMap<>();
        Map<String, List<UnifiedAdvisory>> ghsa = new ConcurrentHashMap<>();
        if (deps.isEmpty()) {
            return new AdvisoryQueryResult(osv, ghsa);
        }

        ExecutorService pool = Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("advisory-query-"));
        try {
            List<CompletableFuture<Void>> tasks = new ArrayList<>();
            for (int i = 0; i < deps.size(); i += batchSize) {
                List<Dependency> batch = List.copyOf(deps.subList(i, Math.min(i + batchSize, deps.size())));
                tasks.add(CompletableFuture.runAsync(() -> queryOsvBatch(batch, osv), pool));
            }
            if (ghsaClient != null) {
                for (Dependency dep : deps) {
                    tasks.add(CompletableFuture.runAsync(() -> ghsa.put(dep.packageKey(), queryGhsa(dep)), pool));
                }
            }
            log.info("Querying advisories for {} packages ({} tasks, concurrency {})", deps.size(), tasks.size(), concurrency);
            awaitAll(tasks);
        } finally {
            pool.shutdownNow();
        }
        return new AdvisoryQueryResult(osv, ghsa);
    }

    private void queryOsvBatch(List<Dependency> batch, Map<String, List<UnifiedAdvisory>> out) {
        List<List<UnifiedAdvisory>> results = osvClient.queryBatch(batch);
        for (int i = 0; i < batch.size(); i++) {
            out.put(batch.get(i).packageKey(), results.get(i));
        }
    }

    List<UnifiedAdvisory> queryGhsa(Dependency dep) {
        List<UnifiedAdvisory> out = new ArrayList<>();
        for (GhsaAdvisory advisory : ghsaClient.queryAdvisories(dep.getEcosystem(), dep.getName())) {
            Optional<GhsaAdvisory.VulnerableRange> hit = advisory.getVulnerabilities().stream()
                    .filter(range -> VersionRangeMatcher.matches(dep.getVersion(), range.getVulnerableVersionRange()))
                    .findFirst();
            hit.ifPresent(range -> out.add(toUnified(advisory, range)));
        }
        return out;
    }

    static UnifiedAdvisory toUnified(GhsaAdvisory advisory, GhsaAdvisory.VulnerableRange range) {
        return UnifiedAdvisory.builder()
                .id(advisory.getGhsaId())
                .source(AdvisorySource.GHSA)
                .severity(AdvisorySeverity.parse(advisory.getSeverity()))
                .summary(advisory.getSummary())
                .details(advisory.getDescription())
                .references(advisory.getReferences())
                .firstPatchedVersion(range.getFirstPatchedVersion())
                .cveIds(advisory.getCveIds())
                .build();
    }

    private static void awaitAll(List<CompletableFuture<Void>> tasks) {
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            for (CompletableFuture<Void> task : tasks) {
                if (task.isCompletedExceptionally()) {
                    try {
                        task.join();
                    } catch (CompletionException failure) {
                        throw asScanException(failure.getCause());
                    }
                }
            }
            throw asScanException(e.getCause());
        }
    }

    private static RuntimeException asScanException(Throwable cause) {
        if (cause instanceof ScanException) {
            return (ScanException) cause;
        }
        return new ScanException("Advisory query failed: " + cause.getMessage(), cause);
    }
}
