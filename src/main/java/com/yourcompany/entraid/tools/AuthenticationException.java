package com.yourcompany.entraid.tools;

import org.identityconnectors.framework.common.exceptions.ConnectorException;

/**
 * Thrown when no access token could be obtained from the identity provider.
 * Always fatal: nothing is fetched without a token.
 */
public class AuthenticationException extends ConnectorException {

    private static final long serialVersionUID = 1L;

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
