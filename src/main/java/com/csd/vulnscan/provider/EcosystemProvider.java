package com.csd.vulnscan.provider;

import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.DetectionResult;
import com.csd.vulnscan.model.LockfileOptions;
import com.csd.vulnscan.model.ScanInput;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface EcosystemProvider {

    ProviderId id();

    /**
     * File names this provider accepts when a single file is scanned.
     */
    List<String> supportedFiles();

    /**
     * Cheap filesystem probe; never modifies the directory.
     */
    Optional<DetectionResult> detect(Path dir);

    /**
     * Creates, refreshes or validates the lockfile through the ecosystem's package manager.
     * Forced refresh/validate always runs; otherwise create only when missing and requested,
     * validate only when present and requested.
     */
    void ensureLockfile(Path dir, LockfileOptions options);

    /**
     * Directory input prefers the lockfile and falls back to the manifest when the lockfile
     * cannot be parsed. Standalone input is parsed by file name and errors propagate.
     */
    List<Dependency> gatherDependencies(ScanInput input, boolean includeDev);
}
