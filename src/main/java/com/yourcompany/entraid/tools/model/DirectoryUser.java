package com.yourcompany.entraid.tools.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The subset of a Graph {@code user} the audits select.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DirectoryUser {

    /** {@code $select} list matching the fields of this class. */
    public static final String SELECT = "id,userPrincipalName,displayName,accountEnabled,assignedLicenses";

    private final String id;
    private final String userPrincipalName;
    private final String displayName;
    private final Boolean accountEnabled;
    private final List<AssignedLicense> assignedLicenses;

    @JsonCreator
    public DirectoryUser(@JsonProperty("id") String id,
            @JsonProperty("userPrincipalName") String userPrincipalName,
            @JsonProperty("displayName") String displayName,
            @JsonProperty("accountEnabled") Boolean accountEnabled,
            @JsonProperty("assignedLicenses") List<AssignedLicense> assignedLicenses) {
        this.id = id;
        this.userPrincipalName = userPrincipalName;
        this.displayName = displayName;
        this.accountEnabled = accountEnabled;
        this.assignedLicenses = assignedLicenses == null ? List.of() : List.copyOf(assignedLicenses);
    }

    public String getId() {
        return id;
    }

    public String getUserPrincipalName() {
        return userPrincipalName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return {@code null} when the attribute was not selected.
     */
    public Boolean getAccountEnabled() {
        return accountEnabled;
    }

    public List<AssignedLicense> getAssignedLicenses() {
        return assignedLicenses;
    }

    public boolean hasLicenses() {
        return !assignedLicenses.isEmpty();
    }

    /**
     * @return {@code true} only if sign-in is explicitly enabled.
     */
    public boolean isSignInEnabled() {
        return Boolean.TRUE.equals(accountEnabled);
    }

    @Override
    public String toString() {
        return "DirectoryUser[" + userPrincipalName + "]";
    }
}
