package com.yourcompany.entraid.tools.operations;

import java.util.ArrayList;
import java.util.List;

import com.yourcompany.entraid.tools.GraphRestClient;
import com.yourcompany.entraid.tools.model.SubscribedSku;
import com.yourcompany.entraid.tools.pipeline.PaginatedFetcher;

/**
 * License capacity of the tenant.
 */
public class LicenseInventory {

    public static final String ALL_SKUS = "*";

    private final GraphRestClient client;

    public LicenseInventory(GraphRestClient client) {
        this.client = client;
    }

    /**
     * @param skuPartNumbers Part numbers to report, or the single value {@code *} for every SKU.
     * @return One entry per selected SKU, in the order Graph lists them.
     */
    public List<SkuAvailability> availability(List<String> skuPartNumbers) {
        List<SkuAvailability> result = new ArrayList<>();
        for (SubscribedSku sku : new PaginatedFetcher<>(client, SubscribedSku.class).fetchAll("/subscribedSkus")) {
            if (selects(skuPartNumbers, sku.getSkuPartNumber())) {
                result.add(new SkuAvailability(sku.getSkuPartNumber(), sku.getRemainingUnits()));
            }
        }
        return result;
    }

    static boolean selects(List<String> skuPartNumbers, String skuPartNumber) {
        if (skuPartNumbers.size() == 1 && ALL_SKUS.equals(skuPartNumbers.get(0))) {
            return true;
        }
        return skuPartNumbers.contains(skuPartNumber);
    }
}
