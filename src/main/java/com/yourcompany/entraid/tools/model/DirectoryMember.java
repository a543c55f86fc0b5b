package com.yourcompany.entraid.tools.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A member of a directory role. Members may be users, groups or service
 * principals; only users carry a user principal name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DirectoryMember {

    private final String id;
    private final String displayName;
    private final String userPrincipalName;
    private final String odataType;

    @JsonCreator
    public DirectoryMember(@JsonProperty("id") String id,
            @JsonProperty("displayName") String displayName,
            @JsonProperty("userPrincipalName") String userPrincipalName,
            @JsonProperty("@odata.type") String odataType) {
        this.id = id;
        this.displayName = displayName;
        this.userPrincipalName = userPrincipalName;
        this.odataType = odataType;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getUserPrincipalName() {
        return userPrincipalName;
    }

    public String getOdataType() {
        return odataType;
    }

    public boolean hasUserPrincipalName() {
        return userPrincipalName != null && !userPrincipalName.isEmpty();
    }
}
