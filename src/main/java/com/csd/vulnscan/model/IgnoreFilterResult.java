package com.csd.vulnscan.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class IgnoreFilterResult {
    Map<String, List<UnifiedAdvisory>> advisoriesByPackage;
    int suppressedCount;
}
