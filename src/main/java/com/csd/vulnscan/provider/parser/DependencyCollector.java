package com.csd.vulnscan.provider.parser;

import com.csd.vulnscan.model.Dependency;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Accumulates dependencies for one parse call, dropping repeated (name, version) pairs
 * while keeping first-seen order.
 */
final class DependencyCollector {

    private final String ecosystem;
    private final boolean stripVersionPrefix;
    private final Set<String> seen = new HashSet<>();
    private final List<Dependency> deps = new ArrayList<>();

    private DependencyCollector(String ecosystem, boolean stripVersionPrefix) {
        this.ecosystem = ecosystem;
        this.stripVersionPrefix = stripVersionPrefix;
    }

    static DependencyCollector npm() {
        return new DependencyCollector(Ecosystems.NPM, false);
    }

    static DependencyCollector pypi() {
        return new DependencyCollector(Ecosystems.PYPI, false);
    }

    /** Go versions carry a leading "v" that OSV does not expect. */
    static DependencyCollector go() {
        return new DependencyCollector(Ecosystems.GO, true);
    }

    boolean add(String name, String version) {
        String cleanVersion = version;
        if (stripVersionPrefix && cleanVersion.startsWith("v")) {
            cleanVersion = cleanVersion.substring(1);
        }
        if (!seen.add(name + "@" + cleanVersion)) {
            return false;
        }
        deps.add(new Dependency(name, cleanVersion, ecosystem));
        return true;
    }

    List<Dependency> toList() {
        return List.copyOf(deps);
    }
}
