package com.csd.vulnscan.service;

import org.apache.maven.artifact.versioning.ArtifactVersion;
import org.apache.maven.artifact.versioning.DefaultArtifactVersion;

import java.util.regex.Pattern;

public final class VersionUtil {
    private VersionUtil() {}

    private static final Pattern CONCRETE = Pattern.compile("^v?\\d+(\\.\\d+)*([.+-]?[0-9A-Za-z]+)*$");
    private static final Pattern WILDCARD = Pattern.compile("(?i)(^|\\.)(x|\\*)(\\.|$)");

    public static int compare(String a, String b) {
        if (a == null && b == null) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        ArtifactVersion av = new DefaultArtifactVersion(stripPrefix(a));
        ArtifactVersion bv = new DefaultArtifactVersion(stripPrefix(b));
        return av.compareTo(bv);
    }

    public static boolean isBelow(String version, String minVersion) {
        if (minVersion == null || version == null) return false;
        return compare(version, minVersion) < 0;
    }

    /**
     * True for a pinned version such as {@code 1.2.3} or {@code 2.0.0-rc.1};
     * false for ranges, wildcards and the {@code *} placeholder.
     */
    public static boolean isConcrete(String version) {
        if (version == null) return false;
        String v = version.trim();
        return CONCRETE.matcher(v).matches() && !WILDCARD.matcher(v).find();
    }

    private static String stripPrefix(String version) {
        String v = version.trim();
        return v.startsWith("v") ? v.substring(1) : v;
    }
}
