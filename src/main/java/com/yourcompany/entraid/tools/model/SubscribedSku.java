package com.yourcompany.entraid.tools.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A commercial subscription of the tenant ({@code /subscribedSkus}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SubscribedSku {

    private final String skuId;
    private final String skuPartNumber;
    private final int consumedUnits;
    private final int enabledUnits;

    @JsonCreator
    public SubscribedSku(@JsonProperty("skuId") String skuId,
            @JsonProperty("skuPartNumber") String skuPartNumber,
            @JsonProperty("consumedUnits") Integer consumedUnits,
            @JsonProperty("prepaidUnits") PrepaidUnits prepaidUnits) {
        this.skuId = skuId;
        this.skuPartNumber = skuPartNumber;
        this.consumedUnits = consumedUnits == null ? 0 : consumedUnits;
        this.enabledUnits = prepaidUnits == null || prepaidUnits.enabled == null ? 0 : prepaidUnits.enabled;
    }

    public String getSkuId() {
        return skuId;
    }

    public String getSkuPartNumber() {
        return skuPartNumber;
    }

    public int getConsumedUnits() {
        return consumedUnits;
    }

    public int getEnabledUnits() {
        return enabledUnits;
    }

    /**
     * @return Enabled prepaid units not yet assigned; negative when over-assigned.
     */
    public int getRemainingUnits() {
        return enabledUnits - consumedUnits;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class PrepaidUnits {

        private final Integer enabled;

        @JsonCreator
        PrepaidUnits(@JsonProperty("enabled") Integer enabled) {
            this.enabled = enabled;
        }
    }
}
