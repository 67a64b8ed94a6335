package com.csd.vulnscan.service;

import com.csd.vulnscan.model.UnifiedAdvisory;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Raw per-source answers keyed by {@code name@version}. Packages without advisories may be absent.
 */
@Value
public class AdvisoryQueryResult {
    Map<String, List<UnifiedAdvisory>> osv;
    Map<String, List<UnifiedAdvisory>> ghsa;
}
