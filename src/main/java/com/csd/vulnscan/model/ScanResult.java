package com.csd.vulnscan.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Complete output of one scan. Advisory and maintenance maps preserve dependency order.
 */
@Value
@Builder
public class ScanResult {
    DetectionResult detection;
    List<Dependency> deps;
    Map<String, List<UnifiedAdvisory>> advisoriesByPackage;
    long scanDurationMs;
    int suppressedCount;
    Map<String, MaintenanceInfo> maintenance;

    public int totalAdvisories() {
        return advisoriesByPackage.values().stream().mapToInt(List::size).sum();
    }
}
