package com.yourcompany.entraid.tools.operations;

import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.yourcompany.entraid.tools.GraphMockSupport;

public class LicenseInventoryTest extends GraphMockSupport {

    @BeforeEach
    public void stubSkus() {
        graph.stubFor(get(urlPathEqualTo("/v1.0/subscribedSkus")).willReturn(okJson(page(null,
                "{\"skuId\":\"s1\",\"skuPartNumber\":\"ENTERPRISEPACK\",\"consumedUnits\":18,"
                        + "\"prepaidUnits\":{\"enabled\":25,\"suspended\":0,\"warning\":0}}",
                "{\"skuId\":\"s2\",\"skuPartNumber\":\"EMS\",\"consumedUnits\":5,"
                        + "\"prepaidUnits\":{\"enabled\":5}}",
                "{\"skuId\":\"s3\",\"skuPartNumber\":\"POWER_BI_STANDARD\",\"consumedUnits\":3}"))));
    }

    @Test
    public void reportsRemainingUnitsOfSelectedSkus() {
        List<SkuAvailability> availability = new LicenseInventory(client()).availability(List.of("EMS",
                "ENTERPRISEPACK"));

        assertThat(availability).extracting(SkuAvailability::getSkuPartNumber, SkuAvailability::getRemainingUnits)
                .containsExactly(tuple("ENTERPRISEPACK", 7), tuple("EMS", 0));
    }

    @Test
    public void wildcardSelectsEverySku() {
        List<SkuAvailability> availability = new LicenseInventory(client()).availability(List.of("*"));

        assertThat(availability).extracting(SkuAvailability::getSkuPartNumber)
                .containsExactly("ENTERPRISEPACK", "EMS", "POWER_BI_STANDARD");
        assertThat(availability.get(2).getRemainingUnits()).isEqualTo(-3);
    }

    @Test
    public void unknownSkuSelectsNothing() {
        assertThat(new LicenseInventory(client()).availability(List.of("VISIOCLIENT"))).isEmpty();
    }

    @Test
    public void wildcardOnlyCountsAlone() {
        assertThat(LicenseInventory.selects(List.of("*", "EMS"), "ENTERPRISEPACK")).isFalse();
    }
}
