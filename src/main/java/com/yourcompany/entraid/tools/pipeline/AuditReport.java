package com.yourcompany.entraid.tools.pipeline;

import java.util.List;

/**
 * Outcome of one audit run.
 * <p>
 * {@link #getMatches()} holds every matching record and
 * {@link #getMatchedKeys()} every distinct matching identity, both in the
 * order the records were discovered. Records whose enrichment failed are
 * neither matches nor non-matches; they are listed in {@link #getUndetermined()}.
 * </p>
 *
 * @param <R> Record type.
 */
public final class AuditReport<R> {

    private final List<R> matches;
    private final List<String> matchedKeys;
    private final List<UndeterminedRecord> undetermined;
    private final int examinedCount;
    private final int enrichedCount;

    public AuditReport(List<R> matches, List<String> matchedKeys, List<UndeterminedRecord> undetermined,
            int examinedCount, int enrichedCount) {
        this.matches = List.copyOf(matches);
        this.matchedKeys = List.copyOf(matchedKeys);
        this.undetermined = List.copyOf(undetermined);
        this.examinedCount = examinedCount;
        this.enrichedCount = enrichedCount;
    }

    public List<R> getMatches() {
        return matches;
    }

    public List<String> getMatchedKeys() {
        return matchedKeys;
    }

    public int getMatchCount() {
        return matchedKeys.size();
    }

    public List<UndeterminedRecord> getUndetermined() {
        return undetermined;
    }

    /**
     * @return Number of primary records considered.
     */
    public int getExaminedCount() {
        return examinedCount;
    }

    /**
     * @return Number of distinct records that went through enrichment, failed ones included.
     */
    public int getEnrichedCount() {
        return enrichedCount;
    }

    @Override
    public String toString() {
        return "AuditReport[matched=" + matchedKeys + ", undetermined=" + undetermined.size() + ", examined="
                + examinedCount + "]";
    }
}
