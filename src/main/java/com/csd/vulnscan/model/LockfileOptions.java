package com.csd.vulnscan.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LockfileOptions {
    boolean forceRefresh;       // always rewrite the lockfile
    boolean forceValidate;      // always validate
    boolean createIfMissing;    // create when there is no lockfile
    boolean validateIfPresent;  // validate when a lockfile exists

    public static LockfileOptions none() {
        return LockfileOptions.builder().build();
    }
}
