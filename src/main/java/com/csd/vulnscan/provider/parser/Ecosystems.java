package com.csd.vulnscan.provider.parser;

/**
 * OSV ecosystem identifiers used by the parsers.
 */
public final class Ecosystems {
    public static final String NPM = "npm";
    public static final String GO = "Go";
    public static final String PYPI = "PyPI";

    private Ecosystems() {}
}
