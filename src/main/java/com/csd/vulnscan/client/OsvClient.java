package com.csd.vulnscan.client;

import com.csd.vulnscan.config.ScannerProperties;
import com.csd.vulnscan.exception.AdvisorySourceException;
import com.csd.vulnscan.model.AdvisorySeverity;
import com.csd.vulnscan.model.AdvisorySource;
import com.csd.vulnscan.model.Dependency;
import com.csd.vulnscan.model.UnifiedAdvisory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client for the OSV.dev batch query API.
 * Batch answers only carry advisory ids, so full records are fetched per id and cached.
 */
@Service
@Slf4j
public class OsvClient {

    public static final int MAX_BATCH_SIZE = 50;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final boolean hydrate;

    // advisory id -> full OSV record
    private final Map<String, JsonNode> vulnCache = new ConcurrentHashMap<>();

    @Autowired
    public OsvClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, ScannerProperties properties) {
        this(webClientBuilder.baseUrl(properties.getOsv().getBaseUrl()).build(),
                objectMapper,
                RetryPolicy.from(properties.getRetry()),
                properties.getOsv().isHydrate());
    }

    public OsvClient(WebClient webClient, ObjectMapper objectMapper, RetryPolicy retryPolicy, boolean hydrate) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.hydrate = hydrate;
    }

    /**
     * Queries up to {@value #MAX_BATCH_SIZE} dependencies in one request.
     *
     * @return one advisory list per input dependency, in input order
     * @throws AdvisorySourceException for an oversized batch (before any request), a failed request, or a malformed answer
     */
    public List<List<UnifiedAdvisory>> queryBatch(List<Dependency> deps) {
        if (deps.size() > MAX_BATCH_SIZE) {
            throw new AdvisorySourceException(AdvisorySource.OSV,
                    "Batch size " + deps.size() + " exceeds maximum of " + MAX_BATCH_SIZE);
        }
        if (deps.isEmpty()) {
            return List.of();
        }

        ObjectNode request = objectMapper.createObjectNode();
        ArrayNode queries = request.putArray("queries");
        for (Dependency dep : deps) {
            ObjectNode query = queries.addObject();
            query.putObject("package")
                    .put("ecosystem", dep.getEcosystem())
                    .put("name", dep.getName());
            query.put("version", dep.getVersion());
        }

        log.debug("Querying OSV.dev batch of {} packages", deps.size());
        String body = execute(webClient.post()
                .uri("/v1/querybatch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request.toString())
                .retrieve()
                .onStatus(HttpStatusCode::isError, OsvClient::toStatusException)
                .bodyToMono(String.class), "querybatch");

        JsonNode results = readTree(body, "querybatch").path("results");
        if (!results.isArray() || results.size() != deps.size()) {
            throw new AdvisorySourceException(AdvisorySource.OSV, "Malformed querybatch response: expected "
                    + deps.size() + " results but got " + (results.isArray() ? results.size() : "none"));
        }

        List<List<UnifiedAdvisory>> out = new ArrayList<>(deps.size());
        for (JsonNode result : results) {
            List<UnifiedAdvisory> advisories = new ArrayList<>();
            for (JsonNode vuln : result.path("vulns")) {
                advisories.add(toAdvisory(hydrate ? resolve(vuln) : vuln));
            }
            out.add(advisories);
        }
        return out;
    }

    /**
     * Full record for one advisory id, from cache when already fetched.
     */
    public JsonNode fetchVulnerability(String id) {
        JsonNode cached = vulnCache.get(id);
        if (cached != null) {
            log.debug("Cache hit for {}", id);
            return cached;
        }
        String body = execute(webClient.get()
                .uri("/v1/vulns/{id}", id)
                .retrieve()
                .onStatus(HttpStatusCode::isError, OsvClient::toStatusException)
                .bodyToMono(String.class), "vulns/" + id);
        JsonNode vuln = readTree(body, "vulns/" + id);
        vulnCache.put(id, vuln);
        return vuln;
    }

    public void clearCache() {
        vulnCache.clear();
        log.info("OSV advisory cache cleared");
    }

    private JsonNode resolve(JsonNode vuln) {
        boolean idOnly = !vuln.has("summary") && !vuln.has("details") && !vuln.has("affected");
        if (!idOnly || !vuln.hasNonNull("id")) {
            return vuln;
        }
        return fetchVulnerability(vuln.get("id").asText());
    }

    static UnifiedAdvisory toAdvisory(JsonNode vuln) {
        String id = vuln.path("id").asText();
        UnifiedAdvisory.UnifiedAdvisoryBuilder builder = UnifiedAdvisory.builder()
                .id(id)
                .source(AdvisorySource.OSV)
                .severity(extractSeverity(vuln))
                .summary(textOrNull(vuln, "summary"))
                .details(textOrNull(vuln, "details"))
                .firstPatchedVersion(extractFirstPatchedVersion(vuln));

        for (JsonNode ref : vuln.path("references")) {
            if (ref.hasNonNull("url")) {
                builder.reference(ref.get("url").asText());
            }
        }

        List<String> cveIds = new ArrayList<>();
        if (id.startsWith("CVE-")) {
            cveIds.add(id);
        }
        for (JsonNode alias : vuln.path("aliases")) {
            String value = alias.asText();
            if (value.startsWith("CVE-") && !cveIds.contains(value)) {
                cveIds.add(value);
            }
        }
        return builder.cveIds(cveIds).build();
    }

    static AdvisorySeverity extractSeverity(JsonNode vuln) {
        JsonNode dbSeverity = vuln.path("database_specific").path("severity");
        if (dbSeverity.isTextual() && !dbSeverity.asText().isBlank()) {
            return AdvisorySeverity.parse(dbSeverity.asText());
        }

        for (JsonNode affected : vuln.path("affected")) {
            JsonNode ecoSeverity = affected.path("ecosystem_specific").path("severity");
            if (ecoSeverity.isTextual() && !ecoSeverity.asText().isBlank()) {
                return AdvisorySeverity.parse(ecoSeverity.asText());
            }
        }

        // severity[].score is usually a CVSS vector; only a bare number is usable here
        for (JsonNode severity : vuln.path("severity")) {
            JsonNode score = severity.path("score");
            if (score.isNumber()) {
                return AdvisorySeverity.fromScore(score.asDouble());
            }
            if (score.isTextual()) {
                try {
                    return AdvisorySeverity.fromScore(Double.parseDouble(score.asText().trim()));
                } catch (NumberFormatException e) {
                    log.trace("Non-numeric severity score {} on {}", score.asText(), vuln.path("id").asText());
                }
            }
        }
        return AdvisorySeverity.UNKNOWN;
    }

    static String extractFirstPatchedVersion(JsonNode vuln) {
        for (JsonNode affected : vuln.path("affected")) {
            for (JsonNode range : affected.path("ranges")) {
                for (JsonNode event : range.path("events")) {
                    if (event.hasNonNull("fixed")) {
                        return event.get("fixed").asText();
                    }
                }
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Mono<? extends Throwable> toStatusException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.releaseBody()
                .then(Mono.fromSupplier(() -> new HttpStatusException(status, "OSV.dev request failed")));
    }

    private String execute(Mono<String> call, String what) {
        String body;
        try {
            body = retryPolicy.apply(call, "OSV " + what).block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            throw new AdvisorySourceException(AdvisorySource.OSV, what + " failed: " + cause.getMessage(), cause);
        }
        if (body == null) {
            throw new AdvisorySourceException(AdvisorySource.OSV, "Empty response from " + what);
        }
        return body;
    }

    private JsonNode readTree(String body, String what) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AdvisorySourceException(AdvisorySource.OSV, "Malformed " + what + " response: " + e.getOriginalMessage(), e);
        }
    }
}
