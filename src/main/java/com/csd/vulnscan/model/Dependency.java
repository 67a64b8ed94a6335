package com.csd.vulnscan.model;

import lombok.Value;

/**
 * One resolved or declared package reference, as reported by a lockfile or manifest.
 */
@Value
public class Dependency {
    String name;
    String version;
    String ecosystem; // OSV ecosystem identifier: npm, Go, PyPI

    /**
     * Key used for advisory maps and ignore rules, e.g. {@code lodash@4.17.20}.
     */
    public String packageKey() {
        return name + "@" + version;
    }
}
