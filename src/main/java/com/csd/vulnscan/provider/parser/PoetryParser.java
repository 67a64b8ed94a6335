package com.csd.vulnscan.provider.parser;

import com.csd.vulnscan.model.Dependency;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented readers for Poetry's {@code poetry.lock} and {@code pyproject.toml}.
 * Only the handful of keys the scanner needs are read; this is not a general TOML parser.
 */
public final class PoetryParser {

    private static final Pattern PACKAGE_DELIMITER = Pattern.compile("(?m)^\\[\\[package\\]\\]\\s*$");
    private static final Pattern NAME = Pattern.compile("(?m)^name\\s*=\\s*\"([^\"]+)\"");
    private static final Pattern VERSION = Pattern.compile("(?m)^version\\s*=\\s*\"([^\"]+)\"");
    private static final Pattern CATEGORY = Pattern.compile("(?m)^category\\s*=\\s*\"([^\"]+)\"");

    private static final Pattern SIMPLE_VALUE = Pattern.compile("^(\\S+?)\\s*=\\s*\"([^\"]+)\"");
    private static final Pattern TABLE_VALUE = Pattern.compile("^(\\S+?)\\s*=\\s*\\{.*version\\s*=\\s*\"([^\"]+)\"");

    static final String MAIN_SECTION = "[tool.poetry.dependencies]";
    static final String LEGACY_DEV_SECTION = "[tool.poetry.dev-dependencies]";
    static final String GROUP_DEV_SECTION = "[tool.poetry.group.dev.dependencies]";

    private PoetryParser() {}

    public static List<Dependency> parseLockfile(String content, boolean includeDev) {
        DependencyCollector deps = DependencyCollector.pypi();
        for (String block : PACKAGE_DELIMITER.split(content)) {
            if (block.isBlank()) {
                continue;
            }
            Matcher name = NAME.matcher(block);
            Matcher version = VERSION.matcher(block);
            if (!name.find() || !version.find()) {
                continue;
            }
            Matcher category = CATEGORY.matcher(block);
            if (category.find() && "dev".equals(category.group(1)) && !includeDev) {
                continue;
            }
            deps.add(name.group(1), version.group(1));
        }
        return deps.toList();
    }

    public static List<Dependency> parsePyproject(String content, boolean includeDev) {
        DependencyCollector deps = DependencyCollector.pypi();
        addSection(content, MAIN_SECTION, deps);
        if (includeDev) {
            addSection(content, LEGACY_DEV_SECTION, deps);
            addSection(content, GROUP_DEV_SECTION, deps);
        }
        return deps.toList();
    }

    /**
     * True when the pyproject declares a Poetry project rather than plain PEP 621 metadata.
     */
    public static boolean isPoetryProject(String pyprojectContent) {
        return pyprojectContent.contains("[tool.poetry]") || pyprojectContent.contains(MAIN_SECTION);
    }

    private static void addSection(String content, String header, DependencyCollector deps) {
        extractSection(content, header).ifPresent(section -> {
            for (String[] pair : keyValues(section)) {
                if ("python".equals(pair[0])) {
                    continue;
                }
                deps.add(pair[0], pair[1]);
            }
        });
    }

    static Optional<String> extractSection(String content, String header) {
        boolean inSection = false;
        StringBuilder section = new StringBuilder();
        for (String line : content.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (!inSection) {
                inSection = trimmed.equals(header);
                continue;
            }
            if (trimmed.startsWith("[")) {
                break;
            }
            section.append(line).append('\n');
        }
        return inSection ? Optional.of(section.toString()) : Optional.empty();
    }

    private static List<String[]> keyValues(String section) {
        List<String[]> pairs = new ArrayList<>();
        for (String line : section.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Matcher simple = SIMPLE_VALUE.matcher(trimmed);
            if (simple.find()) {
                pairs.add(new String[]{unquoteKey(simple.group(1)), simple.group(2)});
                continue;
            }
            Matcher table = TABLE_VALUE.matcher(trimmed);
            if (table.find()) {
                pairs.add(new String[]{unquoteKey(table.group(1)), table.group(2)});
            }
        }
        return pairs;
    }

    private static String unquoteKey(String key) {
        if (key.length() >= 2 && key.startsWith("\"") && key.endsWith("\"")) {
            return key.substring(1, key.length() - 1);
        }
        return key;
    }
}
