package com.yourcompany.entraid.tools.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code /users/{id}/mailboxSettings}, reduced to the mailbox purpose.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MailboxSettings {

    public static final String PURPOSE_SHARED = "shared";

    private final String userPurpose;

    @JsonCreator
    public MailboxSettings(@JsonProperty("userPurpose") String userPurpose) {
        this.userPurpose = userPurpose;
    }

    /**
     * @return e.g. {@code user}, {@code shared}, {@code room}; {@code null} when the mailbox reports none.
     */
    public String getUserPurpose() {
        return userPurpose;
    }

    /**
     * Case-insensitive check for a shared mailbox.
     */
    public boolean isShared() {
        return PURPOSE_SHARED.equalsIgnoreCase(userPurpose);
    }

    @Override
    public String toString() {
        return "MailboxSettings[userPurpose=" + userPurpose + "]";
    }
}
