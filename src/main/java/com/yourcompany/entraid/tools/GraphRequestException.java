package com.yourcompany.entraid.tools;

import org.identityconnectors.framework.common.exceptions.ConnectorException;

/**
 * A single Graph REST call that did not complete with a 2xx status.
 * <p>
 * A status of {@code 0} means no response was received at all (connection
 * refused, timeout, interrupted). The response body is kept verbatim so that
 * callers can surface Graph's own error document.
 * </p>
 */
public class GraphRequestException extends ConnectorException {

    private static final long serialVersionUID = 1L;

    public static final int NO_RESPONSE = 0;

    private final int statusCode;
    private final String responseBody;

    public GraphRequestException(String message, int statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public GraphRequestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
        this.responseBody = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean hasResponse() {
        return statusCode != NO_RESPONSE;
    }

    /**
     * Whether a later attempt of the same request may succeed: throttling,
     * server-side failures and transport failures.
     */
    public boolean isRetryable() {
        return statusCode == NO_RESPONSE || statusCode == 429 || statusCode >= 500;
    }

    /**
     * 401 and 403, i.e. the token was rejected or lacks the required permission.
     */
    public boolean isUnauthorized() {
        return statusCode == 401 || statusCode == 403;
    }
}
