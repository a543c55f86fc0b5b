package com.yourcompany.entraid.tools;

import java.nio.file.Path;

import org.identityconnectors.common.StringUtil;
import org.identityconnectors.common.logging.Log;
import org.identityconnectors.common.security.GuardedString;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Builds an {@link EntraIDConfiguration} from the process environment and an
 * optional dotenv file. Process variables win over values from the file.
 */
public class EnvironmentConfigurationLoader {

    private static final Log LOG = Log.getLog(EnvironmentConfigurationLoader.class);

    public static final String TENANT_ID = "TENANT_ID";
    public static final String CLIENT_ID = "CLIENT_ID";
    public static final String CLIENT_SECRET = "CLIENT_SECRET";
    public static final String GRAPH_ENDPOINT = "GRAPH_ENDPOINT";
    public static final String MAX_CONCURRENCY = "GRAPH_MAX_CONCURRENCY";
    public static final String ENRICH_MAX_ATTEMPTS = "GRAPH_ENRICH_MAX_ATTEMPTS";
    public static final String ENRICH_BACKOFF_MS = "GRAPH_ENRICH_BACKOFF_MS";
    public static final String REQUEST_TIMEOUT_SECONDS = "GRAPH_REQUEST_TIMEOUT_SECONDS";

    private final Dotenv dotenv;

    EnvironmentConfigurationLoader(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    /**
     * Creates a loader reading {@code .env} from the working directory.
     */
    public static EnvironmentConfigurationLoader fromWorkingDirectory() {
        return new EnvironmentConfigurationLoader(Dotenv.configure().ignoreIfMissing().load());
    }

    /**
     * Creates a loader reading the given dotenv file. A missing file is ignored.
     *
     * @param envFile Path of the dotenv file.
     */
    public static EnvironmentConfigurationLoader fromFile(Path envFile) {
        Path absolute = envFile.toAbsolutePath();
        Path directory = absolute.getParent();
        LOG.ok("Loading environment file {0}", absolute);
        return new EnvironmentConfigurationLoader(Dotenv.configure()
                .directory(directory == null ? "." : directory.toString())
                .filename(absolute.getFileName().toString())
                .ignoreIfMissing()
                .load());
    }

    /**
     * Reads and validates the configuration.
     *
     * @return A validated configuration.
     * @throws IllegalArgumentException if a required value is missing or a value is malformed.
     */
    public EntraIDConfiguration load() {
        EntraIDConfiguration config = new EntraIDConfiguration();
        config.setTenantId(dotenv.get(TENANT_ID));
        config.setClientId(dotenv.get(CLIENT_ID));

        String secret = dotenv.get(CLIENT_SECRET);
        if (secret != null) {
            config.setClientSecret(new GuardedString(secret.toCharArray()));
        }

        String endpoint = dotenv.get(GRAPH_ENDPOINT);
        if (StringUtil.isNotBlank(endpoint)) {
            config.setGraphEndpoint(stripTrailingSlash(endpoint.trim()));
        }

        Long value = readNumber(MAX_CONCURRENCY);
        if (value != null) {
            config.setMaxConcurrency(value.intValue());
        }
        value = readNumber(ENRICH_MAX_ATTEMPTS);
        if (value != null) {
            config.setEnrichMaxAttempts(value.intValue());
        }
        value = readNumber(ENRICH_BACKOFF_MS);
        if (value != null) {
            config.setEnrichInitialBackoffMillis(value);
        }
        value = readNumber(REQUEST_TIMEOUT_SECONDS);
        if (value != null) {
            config.setRequestTimeoutSeconds(value.intValue());
        }

        config.validate();
        LOG.ok("Configuration loaded for tenant {0}, Graph endpoint {1}", config.getTenantId(),
                config.getGraphEndpoint());
        return config;
    }

    private Long readNumber(String key) {
        String raw = dotenv.get(key);
        if (StringUtil.isBlank(raw)) {
            return null;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            if (parsed > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Variable " + key + " is out of range: " + raw);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Variable " + key + " must be a whole number, got '" + raw + "'", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
