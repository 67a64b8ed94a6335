package com.csd.vulnscan.provider.parser;

import com.csd.vulnscan.exception.LockfileParseException;
import com.csd.vulnscan.model.Dependency;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parser for npm {@code package-lock.json} / {@code npm-shrinkwrap.json}.
 * <ul>
 *   <li>v3 (npm 9+): flat {@code packages} map keyed by {@code node_modules/...} paths</li>
 *   <li>v1/v2: {@code packages} map (v2 only) plus the nested {@code dependencies} tree</li>
 * </ul>
 */
public final class NpmLockParser {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final String NODE_MODULES = "node_modules/";

    private NpmLockParser() {}

    public static List<Dependency> parse(String lockContent) {
        JsonNode lock;
        try {
            lock = mapper.readTree(lockContent);
        } catch (JsonProcessingException e) {
            throw new LockfileParseException("Invalid package-lock.json format: " + e.getOriginalMessage(), e);
        }
        if (lock == null || !lock.isObject()) {
            throw new LockfileParseException("Invalid package-lock.json format: expected a JSON object");
        }

        DependencyCollector deps = DependencyCollector.npm();
        int lockfileVersion = lock.path("lockfileVersion").asInt(0);

        if (lockfileVersion == 3) {
            collectPackages(lock.path("packages"), deps);
        } else if (lockfileVersion == 2 || lockfileVersion == 1) {
            collectPackages(lock.path("packages"), deps);
            collectDependencyTree(lock.path("dependencies"), deps);
        }
        return deps.toList();
    }

    private static void collectPackages(JsonNode packages, DependencyCollector deps) {
        if (!packages.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = packages.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String name = packageNameFromPath(entry.getKey());
            String version = entry.getValue().path("version").asText("");
            if (name == null || version.isEmpty()) {
                continue;
            }
            deps.add(name, version);
        }
    }

    private static void collectDependencyTree(JsonNode dependencies, DependencyCollector deps) {
        if (!dependencies.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = dependencies.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode dep = entry.getValue();
            String version = dep.path("version").asText("");
            if (!version.isEmpty()) {
                deps.add(entry.getKey(), version);
            }
            collectDependencyTree(dep.path("dependencies"), deps);
        }
    }

    /**
     * {@code node_modules/express/node_modules/@types/qs} resolves to {@code @types/qs}.
     * Returns null for the root entry and for workspace sources under {@code packages/}.
     */
    static String packageNameFromPath(String path) {
        if (path == null || path.isEmpty() || path.startsWith("packages/")) {
            return null;
        }
        int idx = path.lastIndexOf(NODE_MODULES);
        if (idx >= 0) {
            String name = path.substring(idx + NODE_MODULES.length());
            return name.isEmpty() ? null : name;
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
