package com.csd.vulnscan.provider.parser;

import com.csd.vulnscan.exception.LockfileParseException;
import com.csd.vulnscan.model.Dependency;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for {@code yarn.lock}: the v1 "classic" format and the YAML-based "berry" format (yarn 2+).
 */
public final class YarnLockParser {

    private static final Pattern BERRY_KEY = Pattern.compile("^(.+?)@npm:(.+)$");
    private static final Pattern CLASSIC_VERSION = Pattern.compile("^\\s+version:?\\s+\"?([^\"\\s]+)\"?\\s*$");

    private YarnLockParser() {}

    /**
     * Picks the parser from the content: berry lockfiles always carry a {@code __metadata} block.
     */
    public static List<Dependency> parse(String lockContent) {
        return isBerry(lockContent) ? parseBerry(lockContent) : parseClassic(lockContent);
    }

    public static boolean isBerry(String lockContent) {
        return lockContent.contains("__metadata:");
    }

    public static List<Dependency> parseClassic(String lockContent) {
        DependencyCollector deps = DependencyCollector.npm();
        String currentName = null;
        boolean skipEntry = false;
        int lineNo = 0;

        for (String rawLine : lockContent.split("\\r?\\n")) {
            lineNo++;
            if (rawLine.isBlank() || rawLine.trim().startsWith("#")) {
                continue;
            }

            if (!Character.isWhitespace(rawLine.charAt(0))) {
                String keyLine = rawLine.trim();
                if (!keyLine.endsWith(":")) {
                    throw new LockfileParseException("Invalid yarn.lock format at line " + lineNo + ": " + keyLine);
                }
                keyLine = keyLine.substring(0, keyLine.length() - 1);
                skipEntry = hasUnsupportedProtocol(keyLine);
                currentName = skipEntry ? null : nameFromSpecifier(keyLine.split(",")[0].trim());
                continue;
            }

            if (currentName == null || skipEntry) {
                continue;
            }
            Matcher m = CLASSIC_VERSION.matcher(rawLine);
            if (m.matches() && rawLine.startsWith("  ") && !rawLine.startsWith("    ")) {
                deps.add(currentName, m.group(1));
                currentName = null;
            }
        }
        return deps.toList();
    }

    public static List<Dependency> parseBerry(String lockContent) {
        JsonNode lock = YamlSupport.read(lockContent, "yarn.lock");
        DependencyCollector deps = DependencyCollector.npm();
        if (!lock.isObject()) {
            return deps.toList();
        }

        Iterator<Map.Entry<String, JsonNode>> fields = lock.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();

            if ("__metadata".equals(key) || hasUnsupportedProtocol(key) || !value.isObject()) {
                continue;
            }
            Matcher m = BERRY_KEY.matcher(key);
            if (!m.matches()) {
                continue;
            }
            String name = unquote(m.group(1));
            String version = value.path("version").asText("");
            if (version.isEmpty()) {
                version = m.group(2);
            }
            if (version.isEmpty()) {
                continue;
            }
            deps.add(name, version);
        }
        return deps.toList();
    }

    private static boolean hasUnsupportedProtocol(String key) {
        return key.contains("file:") || key.contains("git+") || key.contains("github:") || key.contains("git:");
    }

    private static String nameFromSpecifier(String specifier) {
        String spec = unquote(specifier);
        int lastAt = spec.lastIndexOf('@');
        if (lastAt <= 0) {
            return null;
        }
        return spec.substring(0, lastAt);
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }
}
