package com.yourcompany.entraid.tools;

import org.identityconnectors.framework.common.exceptions.ConnectorException;

/**
 * Failure of a paginated listing. A listing is all-or-nothing, so this always
 * aborts the whole run and no partially collected records are reported.
 */
public class FetchException extends ConnectorException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** The token was rejected (401) or lacks permission (403). */
        UNAUTHORIZED,
        /** Any other non-success status. */
        REMOTE_ERROR,
        /** A page body that is not a valid collection page. */
        DECODE_ERROR,
        /** No response was received. */
        TRANSPORT_ERROR
    }

    private final Kind kind;
    private final int statusCode;
    private final String responseBody;

    private FetchException(Kind kind, String message, int statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * Classifies a failed page request.
     *
     * @param url   The page URL.
     * @param cause The failure of the underlying request.
     */
    public static FetchException fromRequest(String url, GraphRequestException cause) {
        if (!cause.hasResponse()) {
            return new FetchException(Kind.TRANSPORT_ERROR, "No response fetching " + url + ": " + cause.getMessage(),
                    GraphRequestException.NO_RESPONSE, null, cause);
        }
        Kind kind = cause.isUnauthorized() ? Kind.UNAUTHORIZED : Kind.REMOTE_ERROR;
        return new FetchException(kind,
                "HTTP error fetching " + url + ": " + cause.getStatusCode() + " - " + cause.getResponseBody(),
                cause.getStatusCode(), cause.getResponseBody(), cause);
    }

    public static FetchException decode(String url, String detail, Throwable cause) {
        return new FetchException(Kind.DECODE_ERROR, "Failed to parse page from " + url + ": " + detail,
                GraphRequestException.NO_RESPONSE, null, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
