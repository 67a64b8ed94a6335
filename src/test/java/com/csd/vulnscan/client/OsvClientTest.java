package com.csd.vulnscan.client;

import com.csd.vulnscan.exception.AdvisorySourceException;
import com.csd.vulnscan.model.AdvisorySeverity;
import com.csd.vulnscan.model.AdvisorySource;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.UnifiedAdvisory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OsvClientTest {

    private static final String FULL_RECORD = """
            {
              "id": "GHSA-jf85-cpcp-j695",
              "summary": "Prototype Pollution in lodash",
              "details": "Versions of lodash before 4.17.12 are vulnerable",
              "aliases": ["CVE-2019-10744"],
              "database_specific": {"severity": "CRITICAL"},
              "affected": [{
                "package": {"ecosystem": "npm", "name": "lodash"},
                "ranges": [{"type": "SEMVER", "events": [{"introduced": "0"}, {"fixed": "4.17.12"}]}]
              }],
              "references": [{"type": "ADVISORY", "url": "https://nvd.nist.gov/vuln/detail/CVE-2019-10744"}]
            }
            """;

    private StubHttpServer server;
    private OsvClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubHttpServer();
        RetryPolicy retry = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofSeconds(5));
        client = new OsvClient(WebClient.builder().baseUrl(server.baseUrl()).build(), new ObjectMapper(), retry, true);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void oversizedBatchRejectedWithoutRequest() {
        List<Dependency> deps = new ArrayList<>();
        for (int i = 0; i < 51; i++) {
            deps.add(new Dependency("pkg" + i, "1.0.0", "npm"));
        }

        AdvisorySourceException ex = assertThrows(AdvisorySourceException.class, () -> client.queryBatch(deps));
        assertEquals(AdvisorySource.OSV, ex.getSource());
        assertTrue(ex.getMessage().contains("exceeds maximum of 50"));
        assertTrue(server.getRequests().isEmpty());
    }

    @Test
    void emptyBatchSendsNothing() {
        assertEquals(List.of(), client.queryBatch(List.of()));
        assertTrue(server.getRequests().isEmpty());
    }

    @Test
    void idOnlyResultsAreHydratedOnce() {
        server.respond("/v1/querybatch", 200,
                "{\"results\":[{\"vulns\":[{\"id\":\"GHSA-jf85-cpcp-j695\",\"modified\":\"2024-01-01T00:00:00Z\"}]},{}]}");
        server.respond("/v1/vulns/GHSA-jf85-cpcp-j695", 200, FULL_RECORD);

        List<Dependency> deps = List.of(
                new Dependency("lodash", "4.17.11", "npm"),
                new Dependency("left-pad", "1.3.0", "npm"));
        List<List<UnifiedAdvisory>> first = client.queryBatch(deps);
        client.queryBatch(deps);

        assertEquals(2, first.size());
        assertTrue(first.get(1).isEmpty());
        UnifiedAdvisory advisory = first.get(0).get(0);
        assertEquals("GHSA-jf85-cpcp-j695", advisory.getId());
        assertEquals(AdvisorySeverity.CRITICAL, advisory.getSeverity());
        assertEquals("4.17.12", advisory.getFirstPatchedVersion());
        assertEquals(List.of("CVE-2019-10744"), advisory.getCveIds());
        assertEquals(1, server.count("/v1/vulns/GHSA-jf85-cpcp-j695"));
        assertTrue(server.getRequests().get(0).body.contains("\"ecosystem\":\"npm\""));
    }

    @Test
    void serviceUnavailableIsRetried() {
        server.respond("/v1/querybatch", 503, "")
                .respond("/v1/querybatch", 200, "{\"results\":[{\"vulns\":[" + FULL_RECORD + "]}]}");

        List<List<UnifiedAdvisory>> results = client.queryBatch(List.of(new Dependency("lodash", "4.17.11", "npm")));

        assertEquals(1, results.get(0).size());
        assertEquals(2, server.count("/v1/querybatch"));
        assertEquals(0, server.count("/v1/vulns/GHSA-jf85-cpcp-j695"));
    }

    @Test
    void clientErrorIsNotRetried() {
        server.respond("/v1/querybatch", 400, "{\"message\":\"bad ecosystem\"}");

        AdvisorySourceException ex = assertThrows(AdvisorySourceException.class,
                () -> client.queryBatch(List.of(new Dependency("lodash", "4.17.11", "npm"))));
        assertTrue(ex.getMessage().contains("HTTP 400"));
        assertEquals(1, server.count("/v1/querybatch"));
    }

    @Test
    void persistentServerErrorExhaustsAttempts() {
        server.respond("/v1/querybatch", 502, "");

        assertThrows(AdvisorySourceException.class,
                () -> client.queryBatch(List.of(new Dependency("lodash", "4.17.11", "npm"))));
        assertEquals(3, server.count("/v1/querybatch"));
    }

    @Test
    void resultCountMismatchIsMalformed() {
        server.respond("/v1/querybatch", 200, "{\"results\":[]}");

        AdvisorySourceException ex = assertThrows(AdvisorySourceException.class,
                () -> client.queryBatch(List.of(new Dependency("lodash", "4.17.11", "npm"))));
        assertTrue(ex.getMessage().contains("Malformed"));
    }

    @Test
    void severityFallsBackThroughSources() throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals(AdvisorySeverity.MEDIUM, OsvClient.extractSeverity(mapper.readTree(
                "{\"affected\":[{\"ecosystem_specific\":{\"severity\":\"MODERATE\"}}]}")));
        assertEquals(AdvisorySeverity.HIGH, OsvClient.extractSeverity(mapper.readTree(
                "{\"severity\":[{\"type\":\"CVSS_V3\",\"score\":\"7.5\"}]}")));
        assertEquals(AdvisorySeverity.UNKNOWN, OsvClient.extractSeverity(mapper.readTree(
                "{\"severity\":[{\"type\":\"CVSS_V3\",\"score\":\"CVSS:3.1/AV:N/AC:L\"}]}")));
    }
}
