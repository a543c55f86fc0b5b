package com.yourcompany.entraid.tools;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Access token attached to every Graph request of one run.
 */
public final class BearerToken {

    private final String value;
    private final OffsetDateTime expiresAt;

    public BearerToken(String value, OffsetDateTime expiresAt) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Bearer token cannot be null or empty");
        }
        this.value = value;
        this.expiresAt = expiresAt;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return The expiry reported by the identity provider, or {@code null} if unknown.
     */
    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    String authorizationHeader() {
        return "Bearer " + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BearerToken)) {
            return false;
        }
        BearerToken that = (BearerToken) o;
        return value.equals(that.value) && Objects.equals(expiresAt, that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, expiresAt);
    }

    @Override
    public String toString() {
        // never print the token itself
        return "BearerToken[expiresAt=" + expiresAt + "]";
    }
}
