package com.csd.vulnscan.client;

import com.csd.vulnscan.config.ScannerProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Release history lookups against the npm registry and PyPI.
 */
@Service
@Slf4j
public class PackageRegistryClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final String npmRegistryUrl;
    private final String pypiUrl;

    @Autowired
    public PackageRegistryClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, ScannerProperties properties) {
        this(webClientBuilder.build(), objectMapper,
                new RetryPolicy(2, properties.getRetry().getMinBackoff(), Duration.ofSeconds(10),
                        properties.getMaintenance().getTimeout()),
                properties.getMaintenance().getNpmRegistryUrl(),
                properties.getMaintenance().getPypiUrl());
    }

    public PackageRegistryClient(WebClient webClient, ObjectMapper objectMapper, RetryPolicy retryPolicy,
                                 String npmRegistryUrl, String pypiUrl) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.npmRegistryUrl = npmRegistryUrl;
        this.pypiUrl = pypiUrl;
    }

    /**
     * Newest publish time in the packument's {@code time} map, ignoring the created/modified bookkeeping keys.
     *
     * @throws HttpStatusException when the registry answers with an error status (404 for unknown packages)
     */
    public Optional<Instant> npmLastRelease(String packageName) {
        JsonNode packument = get(npmRegistryUrl + "/{name}", packageName);
        Instant latest = null;
        Iterator<Map.Entry<String, JsonNode>> times = packument.path("time").fields();
        while (times.hasNext()) {
            Map.Entry<String, JsonNode> entry = times.next();
            String key = entry.getKey();
            if ("created".equals(key) || "modified".equals(key) || key.startsWith("unpublished")) {
                continue;
            }
            latest = later(latest, parseInstant(entry.getValue().asText()));
        }
        return Optional.ofNullable(latest);
    }

    /**
     * Newest upload time across every file of every release.
     *
     * @throws HttpStatusException when PyPI answers with an error status (404 for unknown projects)
     */
    public Optional<Instant> pypiLastRelease(String packageName) {
        JsonNode project = get(pypiUrl + "/pypi/{name}/json", packageName);
        Instant latest = null;
        for (JsonNode files : project.path("releases")) {
            for (JsonNode file : files) {
                latest = later(latest, parseInstant(file.path("upload_time_iso_8601").asText()));
            }
        }
        return Optional.ofNullable(latest);
    }

    private JsonNode get(String uriTemplate, String packageName) {
        Mono<String> call = webClient.get()
                .uri(uriTemplate, packageName)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> {
                    int status = response.statusCode().value();
                    return response.releaseBody()
                            .then(Mono.fromSupplier(() -> new HttpStatusException(status, "Registry lookup failed for " + packageName)));
                })
                .bodyToMono(String.class);

        String body;
        try {
            body = retryPolicy.apply(call, "Registry " + packageName).block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
        try {
            return objectMapper.readTree(body == null ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException("Malformed registry response for " + packageName, e));
        }
    }

    private static Instant parseInstant(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.trace("Unparseable release timestamp {}", text);
            return null;
        }
    }

    private static Instant later(Instant current, Instant candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.isAfter(current) ? candidate : current;
    }
}
