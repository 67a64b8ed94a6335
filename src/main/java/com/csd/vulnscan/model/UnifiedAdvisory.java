package com.csd.vulnscan.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * An advisory normalized to one shape regardless of which source reported it.
 */
@Value
@Builder
public class UnifiedAdvisory {
    String id;
    AdvisorySource source;
    AdvisorySeverity severity;
    String summary;
    String details;
    @Singular
    List<String> references;
    String firstPatchedVersion;
    @Singular
    List<String> cveIds;
}
