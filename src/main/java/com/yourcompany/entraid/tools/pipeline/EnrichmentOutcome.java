package com.yourcompany.entraid.tools.pipeline;

/**
 * Result of enriching one record: either the secondary value or the reason it
 * could not be obtained.
 *
 * @param <V> Secondary value type.
 */
public final class EnrichmentOutcome<V> {

    private final boolean success;
    private final V value;
    private final String failureMessage;

    private EnrichmentOutcome(boolean success, V value, String failureMessage) {
        this.success = success;
        this.value = value;
        this.failureMessage = failureMessage;
    }

    /**
     * @param value The secondary value, may be {@code null} when the resource has no content.
     */
    public static <V> EnrichmentOutcome<V> success(V value) {
        return new EnrichmentOutcome<>(true, value, null);
    }

    public static <V> EnrichmentOutcome<V> failure(String message) {
        return new EnrichmentOutcome<>(false, null, message == null ? "unknown error" : message);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @throws IllegalStateException if this is a failure outcome.
     */
    public V getValue() {
        if (!success) {
            throw new IllegalStateException("Failed enrichment has no value: " + failureMessage);
        }
        return value;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    @Override
    public String toString() {
        return success ? "Success[" + value + "]" : "Failure[" + failureMessage + "]";
    }
}
