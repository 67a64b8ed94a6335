package com.csd.vulnscan.service;

import com.csd.vulnscan.client.OsvClient;
import com.csd.vulnscan.client.PackageRegistryClient;
import com.csd.vulnscan.client.RetryPolicy;
import com.csd.vulnscan.client.StubHttpServer;
import com.csd.vulnscan.exception.DetectionFailureException;
import com.csd.vulnscan.exception.LockfileMissingException;
import com.csd.vulnscan.exception.ManifestMissingException;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.LockfileMode;
import com.csd.vulnscan.model.ScanInput;
import com.csd.vulnscan.model.ScanOptions;
import com.csd.vulnscan.model.ScanResult;
import com.csd.vulnscan.process.RecordingCommandRunner;
import com.csd.vulnscan.provider.GoProvider;
import com.csd.vulnscan.provider.NodeProvider;
import com.csd.vulnscan.provider.PipProvider;
import com.csd.vulnscan.provider.PoetryProvider;
import com.csd.vulnscan.provider.ProviderRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScanServiceTest {

    private static final String OSV_RESULTS = """
            {"results": [
              {"vulns": [{
                "id": "GHSA-7h4p-27mh-hmrw",
                "summary": "Django potential denial-of-service in file uploads",
                "aliases": ["CVE-2023-24580"],
                "database_specific": {"severity": "HIGH"},
                "affected": [{"ranges": [{"type": "ECOSYSTEM", "events": [{"introduced": "4.2"}, {"fixed": "4.2.1"}]}]}]
              }]},
              {"vulns": [{
                "id": "GHSA-j8r2-6x86-q33q",
                "summary": "Unintended leak of Proxy-Authorization header in requests",
                "database_specific": {"severity": "MODERATE"}
              }]}
            ]}
            """;

    @TempDir
    Path dir;

    private StubHttpServer osv;
    private RecordingCommandRunner runner;
    private ScanService scanService;

    @BeforeEach
    void setUp() throws IOException {
        osv = new StubHttpServer();
        runner = new RecordingCommandRunner();
        RetryPolicy retry = new RetryPolicy(1, Duration.ofMillis(5), Duration.ofMillis(5), Duration.ofSeconds(5));
        ObjectMapper mapper = new ObjectMapper();

        OsvClient osvClient = new OsvClient(WebClient.builder().baseUrl(osv.baseUrl()).build(), mapper, retry, false);
        ProviderRegistry registry = new ProviderRegistry(List.of(
                new NodeProvider(runner), new GoProvider(runner), new PoetryProvider(runner), new PipProvider(runner)));
        PackageRegistryClient registryClient = new PackageRegistryClient(WebClient.builder().build(), mapper, retry,
                osv.baseUrl(), osv.baseUrl());

        scanService = new ScanService(registry,
                new AdvisoryQueryEngine(osvClient, null, 50),
                new AdvisoryMerger(),
                new IgnoreService(mapper),
                new MaintenanceService(registryClient, Clock.systemUTC(), 365));
    }

    @AfterEach
    void tearDown() {
        osv.close();
    }

    @Test
    void scanMergesAndAppliesIgnoreFile() throws IOException {
        Files.writeString(dir.resolve("requirements.txt"), "django==4.2.0\nrequests==2.31.0\n");
        Files.writeString(dir.resolve(".vuln-ignore.json"),
                "{\"ignores\": [{\"package\": \"requests\", \"reason\": \"proxy not used\"}]}");
        osv.respond("/v1/querybatch", 200, OSV_RESULTS);

        ScanResult result = scanService.scan(dir, ScanOptions.defaults());

        assertEquals("pip", result.getDetection().getName());
        assertEquals(List.of(new Dependency("django", "4.2.0", "PyPI"), new Dependency("requests", "2.31.0", "PyPI")),
                result.getDeps());
        assertEquals(List.of("django@4.2.0"), List.copyOf(result.getAdvisoriesByPackage().keySet()));
        assertEquals("4.2.1", result.getAdvisoriesByPackage().get("django@4.2.0").get(0).getFirstPatchedVersion());
        assertEquals(1, result.getSuppressedCount());
        assertEquals(1, result.totalAdvisories());
        assertTrue(result.getMaintenance().isEmpty());
        assertTrue(runner.getCommands().isEmpty());
    }

    @Test
    void noDependenciesSkipsAdvisoryQueries() throws IOException {
        Files.writeString(dir.resolve("requirements.txt"), "# nothing pinned yet\n");

        ScanResult result = scanService.scan(dir, ScanOptions.defaults());

        assertTrue(result.getDeps().isEmpty());
        assertTrue(result.getAdvisoriesByPackage().isEmpty());
        assertTrue(osv.getRequests().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> result.getDeps().add(new Dependency("x", "1", "PyPI")));
    }

    @Test
    void scanResultCollectionsAreReadOnly() throws IOException {
        Files.writeString(dir.resolve("requirements.txt"), "django==4.2.0\nrequests==2.31.0\n");
        osv.respond("/v1/querybatch", 200, OSV_RESULTS);

        ScanResult result = scanService.scan(dir, ScanOptions.defaults());

        assertThrows(UnsupportedOperationException.class, () -> result.getDeps().add(new Dependency("x", "1", "PyPI")));
        assertThrows(UnsupportedOperationException.class, () -> result.getAdvisoriesByPackage().clear());
        assertThrows(UnsupportedOperationException.class,
                () -> result.getAdvisoriesByPackage().get("django@4.2.0").clear());
        assertThrows(UnsupportedOperationException.class, () -> result.getMaintenance().clear());
        assertEquals(2, result.getDeps().size());
    }

    @Test
    void lockfileModeRunsPackageManagerFirst() throws IOException {
        Files.writeString(dir.resolve("go.mod"), "module example.com/app\n\ngo 1.21\n");
        Files.writeString(dir.resolve("go.sum"), "");

        ScanResult result = scanService.scan(dir, ScanOptions.builder().lockfileMode(LockfileMode.CHECK).build());

        assertEquals(List.of(List.of("go", "mod", "verify")), runner.getCommands());
        assertTrue(result.getDeps().isEmpty());
    }

    @Test
    void legacyFlagsMapToLockfileModes() {
        assertEquals(LockfileMode.REFRESH, ScanOptions.builder().refreshLock(true).validateLock(true).build().effectiveLockfileMode());
        assertEquals(LockfileMode.CHECK, ScanOptions.builder().validateLock(true).build().effectiveLockfileMode());
        assertEquals(LockfileMode.NONE, ScanOptions.defaults().effectiveLockfileMode());
    }

    @Test
    void standalonePackageJsonOutsideProjectNeedsLockfile() throws IOException {
        Path renamed = Files.writeString(dir.resolve("upload-package.json"), "{\"dependencies\": {\"lodash\": \"^4\"}}");

        assertThrows(LockfileMissingException.class, () -> scanService.scan(renamed, ScanOptions.defaults()));
    }

    @Test
    void inputResolution() throws IOException {
        Path manifest = Files.writeString(dir.resolve("package.json"), "{}");
        Path upload = Files.writeString(dir.resolve("8a161a-pnpm-lock.yaml"), "lockfileVersion: '9.0'\n");
        Path notes = Files.writeString(dir.resolve("notes.txt"), "");

        ScanInput fromManifest = scanService.resolveInput(manifest);
        assertFalse(fromManifest.isStandalone());
        assertEquals(dir.toAbsolutePath(), fromManifest.getDirectory());

        ScanInput fromUpload = scanService.resolveInput(upload);
        assertTrue(fromUpload.isStandalone());
        assertEquals("8a161a-pnpm-lock.yaml", fromUpload.fileName());

        DetectionFailureException unsupported = assertThrows(DetectionFailureException.class,
                () -> scanService.resolveInput(notes));
        assertTrue(unsupported.getMessage().startsWith("Unsupported file: notes.txt"));
        assertThrows(ManifestMissingException.class, () -> scanService.resolveInput(dir.resolve("missing")));
    }

    @Test
    void concurrencyMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> scanService.scan(dir, ScanOptions.builder().concurrency(0).build()));
    }
}
