package com.yourcompany.entraid.tools.cli;

import java.util.List;

import org.identityconnectors.common.logging.Log;
import org.identityconnectors.framework.common.exceptions.ConnectorException;

import com.microsoft.graph.models.Organization;
import com.microsoft.graph.models.OrganizationCollectionResponse;
import com.microsoft.graph.serviceclient.GraphServiceClient;
import com.yourcompany.entraid.tools.EntraIDConfiguration;
import com.yourcompany.entraid.tools.EntraIDCredentialProvider;

import picocli.CommandLine.Command;

/**
 * Verifies credentials and permissions by reading the tenant's organization
 * through the Graph SDK.
 */
@Command(name = "check", description = "Verify connectivity to Microsoft Graph")
public class CheckCommand extends AbstractToolCommand {

    private static final Log LOG = Log.getLog(CheckCommand.class);

    @Override
    protected int run() {
        EntraIDConfiguration configuration = parent.loadConfiguration();
        EntraIDCredentialProvider provider = new EntraIDCredentialProvider(configuration);
        GraphServiceClient graphClient = new GraphServiceClient(provider.getCredential(), provider.getScope());

        OrganizationCollectionResponse response;
        try {
            response = graphClient.organization().get();
        } catch (Exception e) {
            throw new ConnectorException("Connection check failed: " + e.getMessage(), e);
        }

        List<Organization> organizations = response == null || response.getValue() == null ? List.of()
                : response.getValue();
        LOG.info("Connection check returned {0} organizations", organizations.size());
        for (Organization organization : organizations) {
            out().println("Connected to organization: " + organization.getDisplayName());
        }
        out().println("Connection check succeeded");
        return 0;
    }
}
