package com.csd.vulnscan.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DetectionResult {
    String providerId;  // node, go, python-poetry, python-pip
    String name;        // npm, pnpm, yarn, Poetry, pip, Go modules
    String variant;     // may be null (yarn: classic / berry)
    double confidence;
}
