package com.yourcompany.entraid.tools.pipeline;

/**
 * A record whose enrichment failed, so the audit predicate could not be evaluated.
 */
public final class UndeterminedRecord {

    private final String key;
    private final String reason;

    public UndeterminedRecord(String key, String reason) {
        this.key = key;
        this.reason = reason;
    }

    public String getKey() {
        return key;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return key + " (" + reason + ")";
    }
}
