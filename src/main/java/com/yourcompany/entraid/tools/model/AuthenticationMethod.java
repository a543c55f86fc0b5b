package com.yourcompany.entraid.tools.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An entry of {@code /users/{id}/authentication/methods}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AuthenticationMethod {

    public static final String SOFTWARE_OATH_TYPE = "#microsoft.graph.softwareOathAuthenticationMethod";

    private final String id;
    private final String odataType;

    @JsonCreator
    public AuthenticationMethod(@JsonProperty("id") String id, @JsonProperty("@odata.type") String odataType) {
        this.id = id;
        this.odataType = odataType;
    }

    public String getId() {
        return id;
    }

    public String getOdataType() {
        return odataType;
    }

    public boolean isSoftwareOath() {
        return SOFTWARE_OATH_TYPE.equals(odataType);
    }

    @Override
    public String toString() {
        return odataType + " " + id;
    }
}
