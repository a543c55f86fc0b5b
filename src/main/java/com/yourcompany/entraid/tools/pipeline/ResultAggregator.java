package com.yourcompany.entraid.tools.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Joins the primary records with their enrichment outcomes and applies the
 * audit predicate. Pure: no I/O, and the result order is always the order of
 * {@code records}.
 */
public class ResultAggregator {

    /**
     * @param records     Primary records in discovery order.
     * @param keyFunction Identity of a record.
     * @param outcomes    Outcomes of the completed dispatch.
     * @param predicate   Evaluated only for records with a successful outcome.
     */
    public <R, V> AuditReport<R> aggregate(List<R> records, Function<? super R, String> keyFunction,
            EnrichmentMap<V> outcomes, BiPredicate<? super R, ? super V> predicate) {
        List<R> matches = new ArrayList<>();
        Set<String> matchedKeys = new LinkedHashSet<>();
        Map<String, UndeterminedRecord> undetermined = new LinkedHashMap<>();

        for (R record : records) {
            String key = keyFunction.apply(record);
            EnrichmentOutcome<V> outcome = key == null ? null : outcomes.get(key);
            if (outcome == null) {
                // filtered out before enrichment, or no key
                continue;
            }
            if (!outcome.isSuccess()) {
                undetermined.putIfAbsent(key, new UndeterminedRecord(key, outcome.getFailureMessage()));
                continue;
            }
            if (predicate.test(record, outcome.getValue())) {
                matches.add(record);
                matchedKeys.add(key);
            }
        }

        return new AuditReport<>(matches, new ArrayList<>(matchedKeys), new ArrayList<>(undetermined.values()),
                records.size(), outcomes.size());
    }
}
