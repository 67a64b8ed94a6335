package com.csd.vulnscan.provider.parser;

import com.csd.vulnscan.model.Dependency;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parser for {@code pnpm-lock.yaml}.
 * <p>
 * Package keys look like {@code /name@1.2.3} (lockfile v6) or {@code name@1.2.3} (v9+), optionally
 * followed by a peer suffix such as {@code (react@18.2.0)}. Catalog references
 * ({@code name@catalog:key}) take their version from the package record.
 */
public final class PnpmLockParser {

    private static final String CATALOG_MARKER = "@catalog:";

    private PnpmLockParser() {}

    public static List<Dependency> parse(String lockContent, boolean includeDev) {
        JsonNode lock = YamlSupport.read(lockContent, "pnpm-lock.yaml");
        DependencyCollector deps = DependencyCollector.npm();

        JsonNode packages = lock.path("packages");
        if (!packages.isObject()) {
            return deps.toList();
        }

        Iterator<Map.Entry<String, JsonNode>> fields = packages.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String pkgSpec = entry.getKey();
            JsonNode pkgData = entry.getValue();

            if (pkgData.path("dev").asBoolean(false) && !includeDev) {
                continue;
            }
            if (pkgSpec.contains("workspace:")) {
                continue;
            }

            String spec = pkgSpec.startsWith("/") ? pkgSpec.substring(1) : pkgSpec;
            int peerIdx = spec.indexOf('(');
            String specWithoutPeer = peerIdx >= 0 ? spec.substring(0, peerIdx) : spec;
            String recordVersion = pkgData.path("version").asText("");

            String name;
            String version;
            if (specWithoutPeer.contains(CATALOG_MARKER)) {
                name = specWithoutPeer.substring(0, specWithoutPeer.indexOf(CATALOG_MARKER));
                // record version wins; otherwise the second '@'-separated token, even for scoped names
                String[] tokens = specWithoutPeer.split("@");
                String fallback = tokens.length > 1 && !tokens[1].isEmpty() ? tokens[1] : "*";
                version = !recordVersion.isEmpty() ? recordVersion : fallback;
            } else {
                int lastAt = specWithoutPeer.lastIndexOf('@');
                if (lastAt == -1) {
                    continue;
                }
                name = specWithoutPeer.substring(0, lastAt);
                version = !recordVersion.isEmpty() ? recordVersion : specWithoutPeer.substring(lastAt + 1);
            }

            if (version.isEmpty() || "*".equals(version)) {
                continue;
            }
            deps.add(name, version);
        }
        return deps.toList();
    }
}
