package com.csd.vulnscan.client;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One GitHub security advisory together with every vulnerable range it lists for the queried package.
 */
@Data
@NoArgsConstructor
public class GhsaAdvisory {

    private String ghsaId;
    private String summary;
    private String description;
    private String severity;
    private String publishedAt;
    private String updatedAt;
    private Double cvssScore;
    private List<String> references = new ArrayList<>();
    private List<String> cveIds = new ArrayList<>();
    private List<VulnerableRange> vulnerabilities = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VulnerableRange {
        private String packageName;
        private String ecosystem;
        private String vulnerableVersionRange;
        private String firstPatchedVersion;
    }
}
