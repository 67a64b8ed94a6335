package com.csd.vulnscan.model;

/**
 * How the package manager is involved before dependencies are gathered.
 */
public enum LockfileMode {
    NONE,
    CHECK,
    REFRESH,
    ENFORCE;

    public LockfileOptions toOptions() {
        return switch (this) {
            case CHECK -> LockfileOptions.builder().forceValidate(true).build();
            case REFRESH -> LockfileOptions.builder().forceRefresh(true).build();
            case ENFORCE -> LockfileOptions.builder().createIfMissing(true).validateIfPresent(true).build();
            case NONE -> LockfileOptions.none();
        };
    }
}
