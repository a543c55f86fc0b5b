package com.yourcompany.entraid.tools.cli;

import java.nio.file.Path;

import org.identityconnectors.framework.common.exceptions.ConfigurationException;

import com.yourcompany.entraid.tools.BearerToken;
import com.yourcompany.entraid.tools.EntraIDConfiguration;
import com.yourcompany.entraid.tools.EntraIDCredentialProvider;
import com.yourcompany.entraid.tools.EnvironmentConfigurationLoader;
import com.yourcompany.entraid.tools.GraphRestClient;

/**
 * Loads the configuration from the environment, acquires one token with the
 * client-credentials flow and builds the client around it.
 */
public class DefaultGraphSessionFactory implements GraphSessionFactory {

    @Override
    public GraphSession open(Path envFile) {
        EntraIDConfiguration configuration = loadConfiguration(envFile);
        BearerToken token = new EntraIDCredentialProvider(configuration).acquireToken();
        return new GraphSession(configuration, token, new GraphRestClient(configuration, token));
    }

    static EntraIDConfiguration loadConfiguration(Path envFile) {
        EnvironmentConfigurationLoader loader = envFile == null ? EnvironmentConfigurationLoader.fromWorkingDirectory()
                : EnvironmentConfigurationLoader.fromFile(envFile);
        try {
            return loader.load();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }
}
