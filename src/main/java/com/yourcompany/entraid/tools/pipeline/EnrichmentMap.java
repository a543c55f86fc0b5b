package com.yourcompany.entraid.tools.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enrichment outcomes keyed by record identity. Safe for concurrent writers;
 * each key is written exactly once.
 *
 * @param <V> Secondary value type.
 */
public final class EnrichmentMap<V> {

    private final ConcurrentHashMap<String, EnrichmentOutcome<V>> outcomes = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if an outcome was already recorded for {@code key}.
     */
    public void record(String key, EnrichmentOutcome<V> outcome) {
        if (key == null || outcome == null) {
            throw new IllegalArgumentException("Key and outcome are required");
        }
        EnrichmentOutcome<V> previous = outcomes.putIfAbsent(key, outcome);
        if (previous != null) {
            throw new IllegalStateException("Enrichment outcome already recorded for " + key);
        }
    }

    /**
     * @return The outcome for {@code key}, or {@code null} if the record was never enriched.
     */
    public EnrichmentOutcome<V> get(String key) {
        return outcomes.get(key);
    }

    public boolean contains(String key) {
        return outcomes.containsKey(key);
    }

    public int size() {
        return outcomes.size();
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(outcomes.keySet());
    }

    /**
     * @return Failure message per key, for every failed enrichment.
     */
    public Map<String, String> failures() {
        Map<String, String> failures = new LinkedHashMap<>();
        outcomes.forEach((key, outcome) -> {
            if (!outcome.isSuccess()) {
                failures.put(key, outcome.getFailureMessage());
            }
        });
        return failures;
    }
}
