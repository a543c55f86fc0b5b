package com.yourcompany.entraid.tools.pipeline;

import java.time.Duration;
import java.util.function.Predicate;

import org.identityconnectors.common.logging.Log;

import com.yourcompany.entraid.tools.EntraIDConfiguration;
import com.yourcompany.entraid.tools.GraphRequestException;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Bounded retry with exponential backoff for enrichment calls. Only
 * throttling, server errors and transport failures are retried; any other
 * failure is final on the first attempt.
 */
public final class EnrichmentRetryPolicy {

    private static final Log LOG = Log.getLog(EnrichmentRetryPolicy.class);

    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Predicate<Throwable> retryable;

    public EnrichmentRetryPolicy(int maxAttempts, Duration initialBackoff) {
        this(maxAttempts, initialBackoff, EnrichmentRetryPolicy::isRetryable);
    }

    public EnrichmentRetryPolicy(int maxAttempts, Duration initialBackoff, Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (initialBackoff.toMillis() < 1) {
            throw new IllegalArgumentException("initialBackoff must be at least 1ms, got " + initialBackoff);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.retryable = retryable;
    }

    public static EnrichmentRetryPolicy fromConfiguration(EntraIDConfiguration configuration) {
        return new EnrichmentRetryPolicy(configuration.getEnrichMaxAttempts(),
                Duration.ofMillis(configuration.getEnrichInitialBackoffMillis()));
    }

    public static EnrichmentRetryPolicy noRetry() {
        return new EnrichmentRetryPolicy(1, Duration.ofMillis(1));
    }

    static boolean isRetryable(Throwable failure) {
        return failure instanceof GraphRequestException && ((GraphRequestException) failure).isRetryable();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    /**
     * Builds the resilience4j retry for one dispatch.
     */
    Retry toRetry(String name) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, BACKOFF_MULTIPLIER))
                .retryOnException(retryable)
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> LOG.warn("Retrying {0} (attempt {1}) in {2}ms after: {3}",
                event.getName(), event.getNumberOfRetryAttempts() + 1, event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()));
        return retry;
    }
}
