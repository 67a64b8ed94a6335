package com.csd.vulnscan.service;

import com.csd.vulnscan.client.GhsaAdvisory;
import com.csd.vulnscan.client.GhsaClient;
import com.csd.vulnscan.client.GitHubTokenProvider;
import com.csd.vulnscan.client.OsvClient;
import com.csd.vulnscan.client.RetryPolicy;
import com.csd.vulnscan.client.StubHttpServer;
import com.csd.vulnscan.exception.AdvisorySourceException;
import com.csd.vulnscan.model.AdvisorySeverity;
import com.csd.vulnscan.model.AdvisorySource;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.UnifiedAdvisory;
import com.csd.vulnscan.process.RecordingCommandRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class AdvisoryQueryEngineTest {

    private static final String GHSA_PAGE = """
            {"data": {"securityVulnerabilities": {
              "nodes": [{
                "advisory": {"ghsaId": "GHSA-p6mc-m468-83gw", "severity": "MODERATE",
                             "identifiers": [{"type": "CVE", "value": "CVE-2020-8203"}]},
                "package": {"name": "lodash", "ecosystem": "NPM"},
                "vulnerableVersionRange": "< 4.17.19",
                "firstPatchedVersion": {"identifier": "4.17.19"}
              }],
              "pageInfo": {"hasNextPage": false}
            }}}
            """;

    private final RetryPolicy retry = new RetryPolicy(1, Duration.ofMillis(5), Duration.ofMillis(5), Duration.ofSeconds(5));
    private StubHttpServer osv;
    private StubHttpServer github;
    private OsvClient osvClient;
    private GhsaClient ghsaClient;

    private final Dependency oldLodash = new Dependency("lodash", "4.17.11", "npm");
    private final Dependency newLodash = new Dependency("lodash", "4.17.21", "npm");

    @BeforeEach
    void setUp() throws IOException {
        osv = new StubHttpServer();
        github = new StubHttpServer();
        osvClient = new OsvClient(WebClient.builder().baseUrl(osv.baseUrl()).build(), new ObjectMapper(), retry, false);
        GitHubTokenProvider tokens = new GitHubTokenProvider("GITHUB_TOKEN", name -> "ghp_test", new RecordingCommandRunner());
        ghsaClient = new GhsaClient(new OkHttpClient(), new ObjectMapper(), tokens, retry, github.baseUrl() + "/graphql", 100);
    }

    @AfterEach
    void tearDown() {
        osv.close();
        github.close();
    }

    @Test
    void ghsaAdvisoriesFilteredByAffectedRange() {
        osv.respond("/v1/querybatch", 200, "{\"results\": [{}]}");
        github.respond("/graphql", 200, GHSA_PAGE);

        AdvisoryQueryResult result = new AdvisoryQueryEngine(osvClient, ghsaClient, 1)
                .query(List.of(oldLodash, newLodash), 3);

        assertEquals(2, osv.count("/v1/querybatch"));
        assertEquals(List.of(), result.getOsv().get("lodash@4.17.11"));

        List<UnifiedAdvisory> hits = result.getGhsa().get("lodash@4.17.11");
        assertEquals(1, hits.size());
        assertEquals(AdvisorySource.GHSA, hits.get(0).getSource());
        assertEquals(AdvisorySeverity.MEDIUM, hits.get(0).getSeverity());
        assertEquals("4.17.19", hits.get(0).getFirstPatchedVersion());
        assertEquals(List.of(), result.getGhsa().get("lodash@4.17.21"));
    }

    @Test
    void disabledGithubSourceIsSkipped() {
        osv.respond("/v1/querybatch", 200, "{\"results\": [{}, {}]}");

        AdvisoryQueryResult result = new AdvisoryQueryEngine(osvClient, null, 50).query(List.of(oldLodash, newLodash), 2);

        assertTrue(result.getGhsa().isEmpty());
        assertEquals(2, result.getOsv().size());
        assertTrue(github.getRequests().isEmpty());
    }

    @Test
    void anyFailedTaskFailsTheWholeQuery() {
        osv.respond("/v1/querybatch", 400, "{}");
        github.respond("/graphql", 200, GHSA_PAGE);

        AdvisorySourceException ex = assertThrows(AdvisorySourceException.class,
                () -> new AdvisoryQueryEngine(osvClient, ghsaClient, 50).query(List.of(oldLodash), 2));
        assertEquals(AdvisorySource.OSV, ex.getSource());
    }

    @Test
    void concurrencyMustBePositive() {
        AdvisoryQueryEngine engine = new AdvisoryQueryEngine(osvClient, null, 50);
        assertThrows(IllegalArgumentException.class, () -> engine.query(List.of(oldLodash), 0));
    }

    @Test
    void inFlightLookupsNeverExceedConcurrency() {
        List<Dependency> deps = packages(40);
        osv.respond("/v1/querybatch", 200, emptyBatch(deps.size()));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Set<String> seen = ConcurrentHashMap.newKeySet();

        GhsaClient slow = new GhsaClient(new OkHttpClient(), new ObjectMapper(), null, retry, github.baseUrl(), 100) {
            @Override
            public List<GhsaAdvisory> queryAdvisories(String ecosystem, String packageName) {
                peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                try {
                    pause(20);
                    seen.add(packageName);
                    return List.of();
                } finally {
                    inFlight.decrementAndGet();
                }
            }
        };

        AdvisoryQueryResult result = new AdvisoryQueryEngine(osvClient, slow, 50).query(deps, 3);

        assertTrue(peak.get() <= 3, "peak in-flight was " + peak.get());
        assertEquals(40, seen.size());
        assertEquals(40, result.getGhsa().size());
    }

    @Test
    void failedLookupLetsSiblingsFinishBeforeRethrowing() {
        List<Dependency> deps = packages(10);
        osv.respond("/v1/querybatch", 200, emptyBatch(deps.size()));
        Set<String> completed = ConcurrentHashMap.newKeySet();

        GhsaClient flaky = new GhsaClient(new OkHttpClient(), new ObjectMapper(), null, retry, github.baseUrl(), 100) {
            @Override
            public List<GhsaAdvisory> queryAdvisories(String ecosystem, String packageName) {
                if (packageName.equals("pkg-0")) {
                    throw new AdvisorySourceException(AdvisorySource.GHSA, "GitHub returned 502");
                }
                pause(20);
                completed.add(packageName);
                return List.of();
            }
        };

        AdvisorySourceException ex = assertThrows(AdvisorySourceException.class,
                () -> new AdvisoryQueryEngine(osvClient, flaky, 50).query(deps, 2));

        assertEquals(AdvisorySource.GHSA, ex.getSource());
        assertEquals(9, completed.size());
        assertFalse(completed.contains("pkg-0"));
    }

    private static List<Dependency> packages(int count) {
        List<Dependency> deps = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            deps.add(new Dependency("pkg-" + i, "1.0.0", "npm"));
        }
        return deps;
    }

    private static String emptyBatch(int size) {
        return "{\"results\": [" + String.join(", ", Collections.nCopies(size, "{}")) + "]}";
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
