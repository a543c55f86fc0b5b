package com.yourcompany.entraid.tools;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.identityconnectors.common.logging.Log;
import org.identityconnectors.framework.common.exceptions.ConnectorException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Thin authenticated REST client for Microsoft Graph.
 * <p>
 * One instance is created per run and shared by every task of that run: the
 * underlying {@link HttpClient} and its connection pool are thread-safe and
 * the client itself holds no mutable state.
 * </p>
 */
public class GraphRestClient {

    private static final Log LOG = Log.getLog(GraphRestClient.class);

    public static final String API_VERSION = "v1.0";

    private static final String CONSISTENCY_LEVEL_HEADER = "ConsistencyLevel";
    private static final String CONSISTENCY_LEVEL_EVENTUAL = "eventual";
    private static final String CONTENT_TYPE_JSON = "application/json";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final BearerToken token;
    private final Duration requestTimeout;

    public GraphRestClient(EntraIDConfiguration configuration, BearerToken token) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(configuration.getRequestTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
                newObjectMapper(),
                configuration.getGraphEndpoint(),
                token,
                Duration.ofSeconds(configuration.getRequestTimeoutSeconds()));
    }

    public GraphRestClient(HttpClient httpClient, ObjectMapper objectMapper, String graphEndpoint, BearerToken token,
            Duration requestTimeout) {
        if (token == null) {
            throw new IllegalArgumentException("A bearer token is required");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        String endpoint = graphEndpoint.endsWith("/") ? graphEndpoint.substring(0, graphEndpoint.length() - 1)
                : graphEndpoint;
        this.baseUrl = endpoint + "/" + API_VERSION;
        this.token = token;
        this.requestTimeout = requestTimeout;
    }

    /**
     * @return The mapper used for every Graph payload (unknown properties are ignored).
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Percent-encodes one path segment, such as a user principal name.
     * {@code @} is a legal path character and is left as-is.
     */
    public static String segment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%40", "@");
    }

    /**
     * Percent-encodes one query parameter value.
     */
    public static String queryValue(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Resolves a path such as {@code /users} against the versioned Graph base
     * URL. Absolute URLs (e.g. {@code @odata.nextLink} cursors) are returned unchanged.
     */
    public String resolve(String pathOrUrl) {
        if (pathOrUrl.startsWith("http://") || pathOrUrl.startsWith("https://")) {
            return pathOrUrl;
        }
        return baseUrl + (pathOrUrl.startsWith("/") ? pathOrUrl : "/" + pathOrUrl);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Issues a GET and returns the body of a 2xx response.
     *
     * @throws GraphRequestException on a non-2xx status or when no response was received.
     */
    public String get(String pathOrUrl) {
        return get(pathOrUrl, false);
    }

    /**
     * Issues a GET, optionally with {@code ConsistencyLevel: eventual} as
     * required by advanced queries such as {@code $search} and {@code $count}.
     */
    public String get(String pathOrUrl, boolean eventualConsistency) {
        HttpRequest.Builder builder = newRequest(pathOrUrl).GET();
        if (eventualConsistency) {
            builder.header(CONSISTENCY_LEVEL_HEADER, CONSISTENCY_LEVEL_EVENTUAL);
        }
        return send(builder.build());
    }

    /**
     * Issues a GET and maps the body onto {@code type}.
     *
     * @throws GraphRequestException on a non-2xx status.
     * @throws ConnectorException    if the body does not match {@code type}.
     */
    public <T> T getJson(String pathOrUrl, Class<T> type) {
        String body = get(pathOrUrl);
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ConnectorException("Failed to parse response from " + resolve(pathOrUrl) + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * Issues a POST with a JSON body and returns the response text (often empty).
     */
    public String post(String pathOrUrl, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ConnectorException("Failed to serialize request body for " + pathOrUrl, e);
        }
        HttpRequest request = newRequest(pathOrUrl)
                .header("Content-Type", CONTENT_TYPE_JSON)
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        return send(request);
    }

    public void delete(String pathOrUrl) {
        send(newRequest(pathOrUrl).DELETE().build());
    }

    private HttpRequest.Builder newRequest(String pathOrUrl) {
        URI uri;
        try {
            uri = URI.create(resolve(pathOrUrl));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed Graph URL: " + pathOrUrl, e);
        }
        return HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Authorization", token.authorizationHeader())
                .header("Accept", CONTENT_TYPE_JSON);
    }

    private String send(HttpRequest request) {
        LOG.ok("{0} {1}", request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new GraphRequestException("Failed to send " + request.method() + " " + request.uri() + ": "
                    + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphRequestException("Interrupted while waiting for " + request.uri(), e);
        }

        int status = response.statusCode();
        LOG.ok("Response status: {0}", status);
        if (status >= 200 && status < 300) {
            return response.body() == null ? "" : response.body();
        }
        throw new GraphRequestException(request.method() + " " + request.uri() + " failed: " + status + " - "
                + response.body(), status, response.body());
    }
}
