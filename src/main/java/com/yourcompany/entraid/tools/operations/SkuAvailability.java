package com.yourcompany.entraid.tools.operations;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Remaining assignable units of one SKU.
 */
@JsonPropertyOrder({ "skuPartNumber", "remainingUnits" })
public final class SkuAvailability {

    private final String skuPartNumber;
    private final int remainingUnits;

    public SkuAvailability(String skuPartNumber, int remainingUnits) {
        this.skuPartNumber = skuPartNumber;
        this.remainingUnits = remainingUnits;
    }

    public String getSkuPartNumber() {
        return skuPartNumber;
    }

    public int getRemainingUnits() {
        return remainingUnits;
    }
}
