package com.csd.vulnscan.client;

import com.csd.vulnscan.exception.AdvisorySourceException;
import com.csd.vulnscan.exception.CredentialMissingException;
import com.csd.vulnscan.model.AdvisorySource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * GitHub Advisory Database over GraphQL. One package per query; pages are followed until exhausted
 * and the vulnerable ranges are grouped under their advisory.
 */
@Slf4j
public class GhsaClient {

    static final String QUERY = """
            query($ecosystem: SecurityAdvisoryEcosystem!, $package: String!, $first: Int!, $after: String) {
              securityVulnerabilities(first: $first, after: $after, ecosystem: $ecosystem, package: $package) {
                nodes {
                  advisory {
                    ghsaId
                    summary
                    description
                    severity
                    publishedAt
                    updatedAt
                    identifiers { type value }
                    references { url }
                    cvss { score }
                  }
                  package { name ecosystem }
                  vulnerableVersionRange
                  firstPatchedVersion { identifier }
                }
                pageInfo { hasNextPage endCursor }
              }
            }
            """;

    private static final Map<String, String> ECOSYSTEMS = Map.of(
            "npm", "NPM",
            "PyPI", "PIP",
            "Go", "GO",
            "Maven", "MAVEN",
            "RubyGems", "RUBYGEMS",
            "NuGet", "NUGET",
            "Packagist", "COMPOSER",
            "crates.io", "RUST");

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final GitHubTokenProvider tokenProvider;
    private final RetryPolicy retryPolicy;
    private final String endpoint;
    private final int pageSize;

    public GhsaClient(OkHttpClient httpClient, ObjectMapper objectMapper, GitHubTokenProvider tokenProvider,
                      RetryPolicy retryPolicy, String endpoint, int pageSize) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.tokenProvider = tokenProvider;
        this.retryPolicy = retryPolicy;
        this.endpoint = endpoint;
        this.pageSize = pageSize;
    }

    /**
     * All advisories GitHub lists for a package, in first-seen order.
     *
     * @param ecosystem OSV ecosystem name, e.g. {@code npm} or {@code PyPI}
     * @throws CredentialMissingException when no token can be resolved; no request is sent
     * @throws AdvisorySourceException on transport failure, non-success status or GraphQL errors
     */
    public List<GhsaAdvisory> queryAdvisories(String ecosystem, String packageName) {
        String token = tokenProvider.requireToken();
        String ghsaEcosystem = mapEcosystem(ecosystem);

        Map<String, GhsaAdvisory> byId = new LinkedHashMap<>();
        String cursor = null;
        int pages = 0;
        do {
            JsonNode connection = fetchPage(token, ghsaEcosystem, packageName, cursor);
            pages++;
            for (JsonNode node : connection.path("nodes")) {
                addNode(byId, node);
            }
            JsonNode pageInfo = connection.path("pageInfo");
            cursor = pageInfo.path("hasNextPage").asBoolean(false) && pageInfo.hasNonNull("endCursor")
                    ? pageInfo.get("endCursor").asText()
                    : null;
        } while (cursor != null);

        log.debug("GHSA returned {} advisories for {} ({}) over {} page(s)", byId.size(), packageName, ghsaEcosystem, pages);
        return new ArrayList<>(byId.values());
    }

    static String mapEcosystem(String osvEcosystem) {
        String mapped = ECOSYSTEMS.get(osvEcosystem);
        return mapped != null ? mapped : osvEcosystem.toUpperCase(Locale.ROOT);
    }

    private static void addNode(Map<String, GhsaAdvisory> byId, JsonNode node) {
        JsonNode adv = node.path("advisory");
        String ghsaId = text(adv, "ghsaId");
        if (ghsaId == null) {
            return;
        }

        GhsaAdvisory advisory = byId.get(ghsaId);
        if (advisory == null) {
            advisory = new GhsaAdvisory();
            advisory.setGhsaId(ghsaId);
            advisory.setSummary(text(adv, "summary"));
            advisory.setDescription(text(adv, "description"));
            advisory.setSeverity(text(adv, "severity"));
            advisory.setPublishedAt(text(adv, "publishedAt"));
            advisory.setUpdatedAt(text(adv, "updatedAt"));
            JsonNode score = adv.path("cvss").path("score");
            if (score.isNumber()) {
                advisory.setCvssScore(score.asDouble());
            }
            for (JsonNode ref : adv.path("references")) {
                if (ref.hasNonNull("url")) {
                    advisory.getReferences().add(ref.get("url").asText());
                }
            }
            for (JsonNode identifier : adv.path("identifiers")) {
                String value = text(identifier, "value");
                if ("CVE".equals(text(identifier, "type")) && value != null && !advisory.getCveIds().contains(value)) {
                    advisory.getCveIds().add(value);
                }
            }
            byId.put(ghsaId, advisory);
        }

        advisory.getVulnerabilities().add(new GhsaAdvisory.VulnerableRange(
                text(node.path("package"), "name"),
                text(node.path("package"), "ecosystem"),
                text(node, "vulnerableVersionRange"),
                text(node.path("firstPatchedVersion"), "identifier")));
    }

    private JsonNode fetchPage(String token, String ecosystem, String packageName, String cursor) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("query", QUERY);
        ObjectNode variables = payload.putObject("variables");
        variables.put("ecosystem", ecosystem);
        variables.put("package", packageName);
        variables.put("first", pageSize);
        if (cursor != null) {
            variables.put("after", cursor);
        } else {
            variables.putNull("after");
        }

        Request request = new Request.Builder()
                .url(endpoint)
                .header("Authorization", "Bearer " + token)
                .post(RequestBody.create(payload.toString(), JSON))
                .build();

        // blocking OkHttp call; run it off the caller so the per-attempt timeout can fire
        Mono<String> call = Mono.fromCallable(() -> execute(request)).subscribeOn(Schedulers.boundedElastic());
        String body;
        try {
            body = retryPolicy.apply(call, "GHSA " + packageName).block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            throw new AdvisorySourceException(AdvisorySource.GHSA,
                    "Query for " + packageName + " failed: " + cause.getMessage(), cause);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new AdvisorySourceException(AdvisorySource.GHSA, "Malformed response for " + packageName, e);
        }

        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new AdvisorySourceException(AdvisorySource.GHSA, "GraphQL errors: " + errors);
        }
        JsonNode connection = root.path("data").path("securityVulnerabilities");
        if (!connection.isObject()) {
            throw new AdvisorySourceException(AdvisorySource.GHSA, "Malformed response for " + packageName
                    + ": missing securityVulnerabilities");
        }
        return connection;
    }

    private String execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw new HttpStatusException(response.code(), "GHSA API error " + response.message());
            }
            return text;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
