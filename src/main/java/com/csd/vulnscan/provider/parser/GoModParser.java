package com.csd.vulnscan.provider.parser;

import com.csd.vulnscan.model.Dependency;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for Go modules files.
 * <pre>
 * go.mod:  require (
 *              github.com/pkg/errors v0.9.1
 *              golang.org/x/sync v0.1.0 // indirect
 *          )
 *          require github.com/google/uuid v1.6.0
 * go.sum:  github.com/pkg/errors v0.9.1 h1:FEBLx1zS214owpjy7qsBeixbURkuhQAwrK5UwLGTwt4=
 * </pre>
 */
public final class GoModParser {

    private static final Pattern REQUIRE_BLOCK = Pattern.compile("require\\s*\\(([\\s\\S]*?)\\)");
    private static final Pattern BLOCK_LINE = Pattern.compile("^(\\S+)\\s+(\\S+)(?:\\s+//\\s*(.*))?$");
    private static final Pattern REQUIRE_LINE = Pattern.compile("(?m)^\\s*require\\s+([^\\s(]\\S*)\\s+(\\S+)([^\\n]*)$");

    private GoModParser() {}

    public static List<Dependency> parseGoMod(String content, boolean includeIndirect) {
        DependencyCollector deps = DependencyCollector.go();
        StringBuilder outsideBlocks = new StringBuilder();

        Matcher block = REQUIRE_BLOCK.matcher(content);
        int last = 0;
        while (block.find()) {
            outsideBlocks.append(content, last, block.start());
            last = block.end();

            for (String rawLine : block.group(1).split("\\r?\\n")) {
                String line = rawLine.trim();
                if (line.isEmpty() || line.startsWith("//")) {
                    continue;
                }
                Matcher m = BLOCK_LINE.matcher(line);
                if (!m.matches()) {
                    continue;
                }
                if (isIndirect(m.group(3)) && !includeIndirect) {
                    continue;
                }
                deps.add(m.group(1), m.group(2));
            }
        }
        outsideBlocks.append(content.substring(last));

        Matcher single = REQUIRE_LINE.matcher(outsideBlocks);
        while (single.find()) {
            if (isIndirect(single.group(3)) && !includeIndirect) {
                continue;
            }
            deps.add(single.group(1), single.group(2));
        }
        return deps.toList();
    }

    public static List<Dependency> parseGoSum(String content) {
        DependencyCollector deps = DependencyCollector.go();
        for (String rawLine : content.split("\\r?\\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length < 2) {
                continue;
            }
            // "<module> <version>/go.mod h1:..." hashes the go.mod file only
            if (parts[1].endsWith("/go.mod")) {
                continue;
            }
            deps.add(parts[0], parts[1]);
        }
        return deps.toList();
    }

    private static boolean isIndirect(String comment) {
        return comment != null && comment.contains("indirect");
    }
}
