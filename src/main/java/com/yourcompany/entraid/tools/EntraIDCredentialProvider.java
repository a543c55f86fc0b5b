package com.yourcompany.entraid.tools;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.identity.ClientSecretCredentialBuilder;

import org.identityconnectors.common.logging.Log;

/**
 * Client-credentials token acquisition against Microsoft Entra ID.
 * <p>
 * Requests the {@code /.default} scope of the configured Graph endpoint, i.e.
 * all application permissions granted to the app registration.
 * </p>
 */
public class EntraIDCredentialProvider implements CredentialProvider {

    private static final Log LOG = Log.getLog(EntraIDCredentialProvider.class);

    private final TokenCredential credential;
    private final String scope;

    public EntraIDCredentialProvider(EntraIDConfiguration configuration) {
        configuration.validate();
        // ClientSecretCredential for daemon (app-only) access, no signed-in user.
        this.credential = new ClientSecretCredentialBuilder()
                .tenantId(configuration.getTenantId())
                .clientId(configuration.getClientId())
                .clientSecret(configuration.revealClientSecret())
                .build();
        this.scope = defaultScope(configuration.getGraphEndpoint());
    }

    /**
     * @return The {@code /.default} scope for a Graph endpoint such as {@code https://graph.microsoft.com}.
     */
    public static String defaultScope(String graphEndpoint) {
        String base = graphEndpoint.endsWith("/") ? graphEndpoint.substring(0, graphEndpoint.length() - 1)
                : graphEndpoint;
        return base + "/.default";
    }

    public TokenCredential getCredential() {
        return credential;
    }

    public String getScope() {
        return scope;
    }

    @Override
    public BearerToken acquireToken() {
        LOG.ok("Requesting access token for scope {0}", scope);
        AccessToken token;
        try {
            token = credential.getTokenSync(new TokenRequestContext().addScopes(scope));
        } catch (RuntimeException e) {
            throw new AuthenticationException("Failed to obtain access token: " + e.getMessage(), e);
        }
        if (token == null || token.getToken() == null || token.getToken().isEmpty()) {
            throw new AuthenticationException("Identity provider returned an empty access token");
        }
        LOG.info("Access token obtained, expires at {0}", token.getExpiresAt());
        return new BearerToken(token.getToken(), token.getExpiresAt());
    }
}
