package com.csd.vulnscan.service;

import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.UnifiedAdvisory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines both sources per package. OSV entries come first, so when both report the same id the OSV record is kept.
 * Advisories that merely share a CVE alias under different ids stay separate.
 */
public class AdvisoryMerger {

    public Map<String, List<UnifiedAdvisory>> merge(List<Dependency> deps, AdvisoryQueryResult results) {
        return merge(deps, results.getOsv(), results.getGhsa());
    }

    public Map<String, List<UnifiedAdvisory>> merge(List<Dependency> deps,
                                                    Map<String, List<UnifiedAdvisory>> osv,
                                                    Map<String, List<UnifiedAdvisory>> ghsa) {
        Map<String, List<UnifiedAdvisory>> merged = new LinkedHashMap<>();
        for (Dependency dep : deps) {
            String key = dep.packageKey();
            List<UnifiedAdvisory> combined = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (UnifiedAdvisory advisory : osv.getOrDefault(key, List.of())) {
                if (seen.add(advisory.getId())) {
                    combined.add(advisory);
                }
            }
            for (UnifiedAdvisory advisory : ghsa.getOrDefault(key, List.of())) {
                if (seen.add(advisory.getId())) {
                    combined.add(advisory);
                }
            }
            if (!combined.isEmpty()) {
                merged.put(key, combined);
            }
        }
        return merged;
    }
}
