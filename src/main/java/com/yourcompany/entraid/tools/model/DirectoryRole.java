package com.yourcompany.entraid.tools.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An activated directory role.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DirectoryRole {

    private final String id;
    private final String displayName;

    @JsonCreator
    public DirectoryRole(@JsonProperty("id") String id, @JsonProperty("displayName") String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName + " (" + id + ")";
    }
}
