package com.csd.vulnscan.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class ScanOptions {
    boolean includeDev;
    boolean validateLock;
    boolean refreshLock;
    LockfileMode lockfileMode;  // overrides validateLock / refreshLock when set
    @Builder.Default
    int concurrency = 10;
    Path ignoreFilePath;
    boolean checkMaintenance;

    public static ScanOptions defaults() {
        return ScanOptions.builder().build();
    }

    public LockfileMode effectiveLockfileMode() {
        if (lockfileMode != null) {
            return lockfileMode;
        }
        if (refreshLock) {
            return LockfileMode.REFRESH;
        }
        return validateLock ? LockfileMode.CHECK : LockfileMode.NONE;
    }
}
