package com.yourcompany.entraid.tools;

import org.identityconnectors.common.StringUtil;
import org.identityconnectors.common.security.GuardedString;
import org.identityconnectors.framework.spi.AbstractConfiguration;
import org.identityconnectors.framework.spi.ConfigurationProperty;

/**
 * Configuration shared by every Entra ID tool.
 * <p>
 * Holds the app registration used for the client-credentials flow (tenant ID,
 * client ID and client secret), the Microsoft Graph endpoint, and the limits
 * applied to the enrichment fan-out of the audit tools.
 * </p>
 */
public class EntraIDConfiguration extends AbstractConfiguration {

    public static final String DEFAULT_GRAPH_ENDPOINT = "https://graph.microsoft.com";

    private String tenantId;
    private String clientId;
    private GuardedString clientSecret;
    private String graphEndpoint = DEFAULT_GRAPH_ENDPOINT;
    private int maxConcurrency = 8;
    private int enrichMaxAttempts = 3;
    private long enrichInitialBackoffMillis = 500;
    private int requestTimeoutSeconds = 30;

    /**
     * Helper method to validate that a property is not missing.
     *
     * @param value The value to check.
     * @param key   The name of the property.
     */
    private void valid(Object value, String key) {
        if (value instanceof String) {
            String str = (String) value;
            if (StringUtil.isBlank(str)) {
                throw new IllegalArgumentException("Property " + key + " cannot be null or empty");
            }
        } else if (value == null) {
            throw new IllegalArgumentException("Property " + key + " cannot be null");
        }
    }

    private void positive(long value, String key) {
        if (value <= 0) {
            throw new IllegalArgumentException("Property " + key + " must be greater than zero, got " + value);
        }
    }

    /**
     * Validates the configuration.
     * <p>
     * Ensures that {@code tenantId}, {@code clientId}, {@code clientSecret} and
     * {@code graphEndpoint} are provided and that the numeric limits are usable.
     * </p>
     *
     * @throws IllegalArgumentException if any required property is missing or out of range.
     */
    @Override
    public void validate() {
        valid(tenantId, "tenantId");
        valid(clientId, "clientId");
        valid(clientSecret, "clientSecret");
        valid(graphEndpoint, "graphEndpoint");
        positive(maxConcurrency, "maxConcurrency");
        positive(enrichMaxAttempts, "enrichMaxAttempts");
        positive(enrichInitialBackoffMillis, "enrichInitialBackoffMillis");
        positive(requestTimeoutSeconds, "requestTimeoutSeconds");
    }

    /**
     * Returns the clear-text client secret, or {@code null} when none is set.
     */
    public String revealClientSecret() {
        if (clientSecret == null) {
            return null;
        }
        final StringBuilder buf = new StringBuilder();
        clientSecret.access(buf::append);
        return buf.toString();
    }

    /**
     * Gets the Tenant ID.
     *
     * @return The Directory (Tenant) ID.
     */
    @ConfigurationProperty(order = 1, displayMessageKey = "tenantId.display", helpMessageKey = "tenantId.help", required = true)
    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    /**
     * Gets the Client ID.
     *
     * @return The Application (Client) ID.
     */
    @ConfigurationProperty(order = 2, displayMessageKey = "clientId.display", helpMessageKey = "clientId.help", required = true)
    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    /**
     * Gets the Client Secret.
     *
     * @return The Client Secret.
     */
    @ConfigurationProperty(order = 3, displayMessageKey = "clientSecret.display", helpMessageKey = "clientSecret.help", required = true, confidential = true)
    public GuardedString getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(GuardedString clientSecret) {
        this.clientSecret = clientSecret;
    }

    /**
     * Gets the Graph Endpoint.
     *
     * @return The Graph Endpoint, without the API version.
     */
    @ConfigurationProperty(order = 4, displayMessageKey = "GRAPH_ENDPOINT", helpMessageKey = "Base URL for Microsoft Graph (e.g. https://graph.microsoft.com for Commercial, https://graph.microsoft.us for US Gov)")
    public String getGraphEndpoint() {
        return graphEndpoint;
    }

    public void setGraphEndpoint(String graphEndpoint) {
        this.graphEndpoint = graphEndpoint;
    }

    /**
     * Gets the upper bound on simultaneously in-flight enrichment requests.
     *
     * @return The maximum enrichment concurrency.
     */
    @ConfigurationProperty(order = 5, displayMessageKey = "maxConcurrency.display", helpMessageKey = "maxConcurrency.help")
    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * Gets the number of attempts (first call included) for one enrichment request.
     *
     * @return The maximum number of attempts.
     */
    @ConfigurationProperty(order = 6, displayMessageKey = "enrichMaxAttempts.display", helpMessageKey = "enrichMaxAttempts.help")
    public int getEnrichMaxAttempts() {
        return enrichMaxAttempts;
    }

    public void setEnrichMaxAttempts(int enrichMaxAttempts) {
        this.enrichMaxAttempts = enrichMaxAttempts;
    }

    /**
     * Gets the wait before the first enrichment retry. Later waits double.
     *
     * @return The initial backoff in milliseconds.
     */
    @ConfigurationProperty(order = 7, displayMessageKey = "enrichInitialBackoffMillis.display", helpMessageKey = "enrichInitialBackoffMillis.help")
    public long getEnrichInitialBackoffMillis() {
        return enrichInitialBackoffMillis;
    }

    public void setEnrichInitialBackoffMillis(long enrichInitialBackoffMillis) {
        this.enrichInitialBackoffMillis = enrichInitialBackoffMillis;
    }

    /**
     * Gets the timeout applied to connecting and to each Graph request.
     *
     * @return The timeout in seconds.
     */
    @ConfigurationProperty(order = 8, displayMessageKey = "requestTimeoutSeconds.display", helpMessageKey = "requestTimeoutSeconds.help")
    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }
}
