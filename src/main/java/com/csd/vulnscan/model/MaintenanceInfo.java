package com.csd.vulnscan.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class MaintenanceInfo {
    String packageName;
    String ecosystem;
    Instant lastReleaseDate;
    Long daysSinceLastRelease;
    boolean unmaintained;       // no release within the configured window
    String error;               // lookup failure, never fatal
}
