package com.yourcompany.entraid.tools.cli;

import java.util.List;

import com.yourcompany.entraid.tools.operations.LicenseInventory;
import com.yourcompany.entraid.tools.operations.SkuAvailability;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "license-availability", description = "Show the remaining units of subscribed SKUs")
public class LicenseAvailabilityCommand extends AbstractToolCommand {

    @Parameters(arity = "1..*", paramLabel = "SKU",
            description = "SKU part numbers, e.g. ENTERPRISEPACK, or * for all")
    List<String> skuPartNumbers;

    @Override
    protected int run() throws Exception {
        GraphSession session = openSession();
        List<SkuAvailability> availability = new LicenseInventory(session.getClient()).availability(skuPartNumbers);
        out().println(session.getClient().getObjectMapper().writerWithDefaultPrettyPrinter()
                .writeValueAsString(availability));
        return 0;
    }
}
