package com.csd.vulnscan.provider.parser;

import com.csd.vulnscan.model.Dependency;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for pip {@code requirements.txt} (PEP 508 lines).
 * Exact pins ({@code ==}) become the version; any other constraint is kept verbatim.
 */
public final class RequirementsParser {

    private static final Pattern REQUIREMENT =
            Pattern.compile("^([a-zA-Z0-9_-]+[a-zA-Z0-9._-]*)(?:\\[[^\\]]+\\])?(.*?)(?:\\s*#.*)?$");
    private static final Pattern EXACT = Pattern.compile("==([0-9.]+(?:[a-zA-Z0-9._-]*)?)");

    private RequirementsParser() {}

    public static List<Dependency> parse(String content) {
        DependencyCollector deps = DependencyCollector.pypi();
        for (String rawLine : content.split("\\r?\\n")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            // editable installs, URLs, and options such as -r / --index-url
            if (line.startsWith("-") || line.contains("://")) {
                continue;
            }
            Matcher m = REQUIREMENT.matcher(line);
            if (!m.matches()) {
                continue;
            }
            String versionSpec = m.group(2);
            Matcher exact = EXACT.matcher(versionSpec);
            String version = exact.find() ? exact.group(1) : versionSpec.trim();
            if (version.isEmpty()) {
                version = "*";
            }
            deps.add(m.group(1).toLowerCase(Locale.ROOT), version);
        }
        return deps.toList();
    }
}
