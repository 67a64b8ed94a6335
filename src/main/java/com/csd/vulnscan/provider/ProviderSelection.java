package com.csd.vulnscan.provider;

import com.csd.vulnscan.model.DetectionResult;
import lombok.Value;

@Value
public class ProviderSelection {
    EcosystemProvider provider;
    DetectionResult detection;
}
