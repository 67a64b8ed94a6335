package com.csd.vulnscan.service;

import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.IgnoreConfig;
import com.csd.vulnscan.model.IgnoreFilterResult;
import com.csd.vulnscan.model.IgnoreRule;
import com.csd.vulnscan.model.UnifiedAdvisory;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Suppresses advisories listed in a {@code .vuln-ignore.json} file.
 */
@Slf4j
public class IgnoreService {

    public static final String DEFAULT_FILE_NAME = ".vuln-ignore.json";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String defaultFileName;

    public IgnoreService(ObjectMapper objectMapper, Clock clock, String defaultFileName) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultFileName = defaultFileName;
    }

    public IgnoreService(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC(), DEFAULT_FILE_NAME);
    }

    /**
     * An explicitly configured path always wins, even if it does not exist.
     */
    public Optional<Path> findIgnoreFile(Path projectDir, Path explicitPath) {
        if (explicitPath != null) {
            return Optional.of(explicitPath);
        }
        Path candidate = projectDir.resolve(defaultFileName);
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    /**
     * A broken ignore file never fails a scan; it is reported and treated as absent.
     */
    public Optional<IgnoreConfig> loadIgnoreConfig(Path path) {
        if (path == null || !Files.exists(path)) {
            return Optional.empty();
        }
        IgnoreConfig config;
        try {
            config = objectMapper.readValue(path.toFile(), IgnoreConfig.class);
        } catch (IOException e) {
            log.warn("Failed to load ignore config from {}: {}", path, e.getMessage());
            return Optional.empty();
        }
        if (config == null || config.getIgnores() == null) {
            log.warn("Invalid ignore config {}: missing 'ignores' array", path);
            return Optional.empty();
        }
        List<IgnoreRule> rules = new ArrayList<>();
        for (IgnoreRule rule : config.getIgnores()) {
            if (rule == null) {
                log.warn("Skipping null entry in 'ignores' of {}", path);
            } else {
                rules.add(rule);
            }
        }
        config.setIgnores(rules);
        log.info("Loaded {} ignore rule(s) from {}", rules.size(), path);
        return Optional.of(config);
    }

    public IgnoreFilterResult filterAdvisories(Map<String, List<UnifiedAdvisory>> advisoriesByPackage,
                                               List<Dependency> deps,
                                               IgnoreConfig config) {
        if (config == null || config.getIgnores() == null || config.getIgnores().isEmpty()) {
            return new IgnoreFilterResult(new LinkedHashMap<>(advisoriesByPackage), 0);
        }

        Instant now = clock.instant();
        List<IgnoreRule> active = new ArrayList<>();
        for (IgnoreRule rule : config.getIgnores()) {
            if (rule != null && isActive(rule, now)) {
                active.add(rule);
            }
        }

        Map<String, Dependency> byKey = new HashMap<>();
        for (Dependency dep : deps) {
            byKey.put(dep.packageKey(), dep);
        }

        Map<String, List<UnifiedAdvisory>> filtered = new LinkedHashMap<>();
        int suppressed = 0;
        for (Map.Entry<String, List<UnifiedAdvisory>> entry : advisoriesByPackage.entrySet()) {
            String key = entry.getKey();
            Dependency dep = byKey.get(key);
            String name = dep != null ? dep.getName() : nameOf(key);
            String version = dep != null ? dep.getVersion() : versionOf(key);

            List<UnifiedAdvisory> kept = new ArrayList<>();
            for (UnifiedAdvisory advisory : entry.getValue()) {
                if (active.stream().anyMatch(rule -> matches(rule, advisory, name, version))) {
                    suppressed++;
                    log.debug("Ignoring {} for {}", advisory.getId(), key);
                } else {
                    kept.add(advisory);
                }
            }
            if (!kept.isEmpty()) {
                filtered.put(key, kept);
            }
        }

        if (suppressed > 0) {
            log.info("Ignored {} advisory(ies) based on ignore rules", suppressed);
        }
        return new IgnoreFilterResult(filtered, suppressed);
    }

    static boolean matches(IgnoreRule rule, UnifiedAdvisory advisory, String name, String version) {
        String id = rule.getId();
        if (id != null && !id.isEmpty()) {
            if (id.equals(advisory.getId()) || advisory.getCveIds().contains(id)) {
                return true;
            }
        }
        if (rule.getPackageName() != null && rule.getPackageName().equals(name)) {
            if (rule.getPackageVersion() == null || rule.getPackageVersion().equals(version)) {
                return true;
            }
        }
        if (id != null && id.lastIndexOf('@') > 0) {
            return nameOf(id).equals(name) && versionOf(id).equals(version);
        }
        return false;
    }

    /**
     * A date-only expiry means the start of that day in UTC, as does a date-time without an offset.
     * The rule lapses once that instant has passed.
     * An expiry that cannot be parsed leaves the rule in force.
     */
    boolean isActive(IgnoreRule rule, Instant now) {
        String expires = rule.getExpires();
        if (expires == null || expires.isBlank()) {
            return true;
        }
        Optional<Instant> expiry = parseExpiry(expires.trim());
        if (expiry.isEmpty()) {
            log.warn("Ignoring unparseable expiry '{}' on rule {}; rule stays active", expires, describe(rule));
            return true;
        }
        return !now.isAfter(expiry.get());
    }

    static Optional<Instant> parseExpiry(String value) {
        List<Function<String, Instant>> parsers = List.of(
                v -> LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant(),
                v -> OffsetDateTime.parse(v).toInstant(),
                v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC));
        for (Function<String, Instant> parser : parsers) {
            try {
                return Optional.of(parser.apply(value));
            } catch (DateTimeParseException e) {
                log.trace("Expiry '{}' did not match: {}", value, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static String describe(IgnoreRule rule) {
        return rule.getId() != null ? rule.getId() : rule.getPackageName();
    }

    // split at the last '@' so scoped names such as @scope/pkg@1.0.0 survive
    private static String nameOf(String key) {
        int at = key.lastIndexOf('@');
        return at > 0 ? key.substring(0, at) : key;
    }

    private static String versionOf(String key) {
        int at = key.lastIndexOf('@');
        return at > 0 ? key.substring(at + 1) : "";
    }
}
