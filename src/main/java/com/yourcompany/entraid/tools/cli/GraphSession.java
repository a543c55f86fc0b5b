package com.yourcompany.entraid.tools.cli;

import com.yourcompany.entraid.tools.BearerToken;
import com.yourcompany.entraid.tools.EntraIDConfiguration;
import com.yourcompany.entraid.tools.GraphRestClient;

/**
 * Everything one tool invocation needs to talk to Graph: the configuration,
 * the token acquired for this run and the client carrying it.
 */
public final class GraphSession {

    private final EntraIDConfiguration configuration;
    private final BearerToken token;
    private final GraphRestClient client;

    public GraphSession(EntraIDConfiguration configuration, BearerToken token, GraphRestClient client) {
        this.configuration = configuration;
        this.token = token;
        this.client = client;
    }

    public EntraIDConfiguration getConfiguration() {
        return configuration;
    }

    public BearerToken getToken() {
        return token;
    }

    public GraphRestClient getClient() {
        return client;
    }
}
