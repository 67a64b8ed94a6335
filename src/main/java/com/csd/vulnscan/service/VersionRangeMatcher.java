package com.csd.vulnscan.service;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates GitHub-style vulnerable ranges such as {@code >= 1.0.0, < 1.4.2} or {@code = 2.3.1}.
 * Anything that cannot be evaluated counts as a match, so an advisory is never hidden by a parsing gap.
 */
@Slf4j
public final class VersionRangeMatcher {
    private VersionRangeMatcher() {}

    private static final Pattern CONSTRAINT = Pattern.compile("^(>=|<=|>|<|=)?\\s*(\\S+)$");

    public static boolean matches(String version, String range) {
        if (!VersionUtil.isConcrete(version) || range == null || range.isBlank()) {
            return true;
        }
        for (String part : range.split(",")) {
            String constraint = part.trim();
            if (constraint.isEmpty()) {
                continue;
            }
            Matcher m = CONSTRAINT.matcher(constraint);
            if (!m.matches()) {
                log.debug("Cannot evaluate range constraint '{}', treating {} as affected", constraint, version);
                return true;
            }
            String op = m.group(1) == null ? "=" : m.group(1);
            int cmp = VersionUtil.compare(version, m.group(2));
            boolean ok;
            switch (op) {
                case ">=" -> ok = cmp >= 0;
                case "<=" -> ok = cmp <= 0;
                case ">" -> ok = cmp > 0;
                case "<" -> ok = cmp < 0;
                default -> ok = cmp == 0;
            }
            if (!ok) {
                return false;
            }
        }
        return true;
    }
}
