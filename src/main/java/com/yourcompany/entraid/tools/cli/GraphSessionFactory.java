package com.yourcompany.entraid.tools.cli;

import java.nio.file.Path;

/**
 * Opens the {@link GraphSession} of one tool invocation.
 */
@FunctionalInterface
public interface GraphSessionFactory {

    /**
     * @param envFile The dotenv file given on the command line, or {@code null} for {@code .env} in the working directory.
     * @throws org.identityconnectors.framework.common.exceptions.ConfigurationException if the configuration is incomplete.
     * @throws com.yourcompany.entraid.tools.AuthenticationException                     if no token could be obtained.
     */
    GraphSession open(Path envFile);
}
