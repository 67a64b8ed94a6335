package com.csd.vulnscan.client;

import com.csd.vulnscan.config.ScannerProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Per-attempt timeout plus capped exponential backoff, shared by every advisory source.
 * Only rate limiting, gateway/server errors, timeouts and I/O failures are retried.
 */
@Slf4j
@Getter
public class RetryPolicy {

    static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final int maxAttempts;
    private final Duration minBackoff;
    private final Duration maxBackoff;
    private final Duration timeout;

    public RetryPolicy(int maxAttempts, Duration minBackoff, Duration maxBackoff, Duration timeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.minBackoff = minBackoff;
        this.maxBackoff = maxBackoff;
        this.timeout = timeout;
    }

    public static RetryPolicy from(ScannerProperties.Retry settings) {
        return new RetryPolicy(settings.getMaxAttempts(), settings.getMinBackoff(),
                settings.getMaxBackoff(), settings.getTimeout());
    }

    /**
     * Wraps a cold publisher; each retry resubscribes and so re-issues the request.
     * When attempts run out the last failure is emitted unchanged.
     */
    public <T> Mono<T> apply(Mono<T> call, String label) {
        return call
                .timeout(timeout)
                .retryWhen(Retry.backoff(maxAttempts - 1, minBackoff)
                        .maxBackoff(maxBackoff)
                        .filter(RetryPolicy::isRetryable)
                        .doBeforeRetry(signal -> log.warn("{} failed (attempt {}/{}): {}",
                                label, signal.totalRetries() + 1, maxAttempts, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    public static boolean isRetryable(Throwable error) {
        if (error instanceof HttpStatusException) {
            return RETRYABLE_STATUSES.contains(((HttpStatusException) error).getStatus());
        }
        if (error instanceof TimeoutException || error instanceof WebClientRequestException) {
            return true;
        }
        return error instanceof IOException || error.getCause() instanceof IOException;
    }
}
