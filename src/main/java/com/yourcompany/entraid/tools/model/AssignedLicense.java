package com.yourcompany.entraid.tools.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class AssignedLicense {

    private final String skuId;

    @JsonCreator
    public AssignedLicense(@JsonProperty("skuId") String skuId) {
        this.skuId = skuId;
    }

    public String getSkuId() {
        return skuId;
    }

    @Override
    public String toString() {
        return skuId;
    }
}
