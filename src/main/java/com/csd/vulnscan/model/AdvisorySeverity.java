package com.csd.vulnscan.model;

import java.util.Locale;

public enum AdvisorySeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN;

    /**
     * Lenient parse of the labels used by OSV and GitHub. GitHub reports MODERATE where OSV uses MEDIUM.
     */
    public static AdvisorySeverity parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if ("MODERATE".equals(normalized)) {
            return MEDIUM;
        }
        for (AdvisorySeverity severity : values()) {
            if (severity.name().equals(normalized)) {
                return severity;
            }
        }
        return UNKNOWN;
    }

    public static AdvisorySeverity fromScore(double score) {
        if (score >= 9.0) return CRITICAL;
        if (score >= 7.0) return HIGH;
        if (score >= 4.0) return MEDIUM;
        return LOW;
    }
}
