package com.csd.vulnscan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from {@code vulnscan.*} in application.properties.
 */
@Data
@ConfigurationProperties(prefix = "vulnscan")
public class ScannerProperties {

    private Osv osv = new Osv();
    private Ghsa ghsa = new Ghsa();
    private Retry retry = new Retry();
    private Scan scan = new Scan();
    private PackageManager packageManager = new PackageManager();
    private Maintenance maintenance = new Maintenance();

    @Data
    public static class Osv {
        private String baseUrl = "https://api.osv.dev";
        /** Dependencies per querybatch request. Values above 50 are clamped. */
        private int batchSize = 50;
        /** Fetch full records for batch results that only carry an id. */
        private boolean hydrate = true;
    }

    @Data
    public static class Ghsa {
        private boolean enabled = true;
        private String endpoint = "https://api.github.com/graphql";
        private int pageSize = 100;
        private String tokenEnvVariable = "GITHUB_TOKEN";
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration minBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Scan {
        private int defaultConcurrency = 10;
        private String ignoreFileName = ".vuln-ignore.json";
    }

    @Data
    public static class PackageManager {
        private Duration timeout = Duration.ofMinutes(10);
    }

    @Data
    public static class Maintenance {
        private String npmRegistryUrl = "https://registry.npmjs.org";
        private String pypiUrl = "https://pypi.org";
        private int unmaintainedAfterDays = 365;
        private Duration timeout = Duration.ofSeconds(10);
    }
}
