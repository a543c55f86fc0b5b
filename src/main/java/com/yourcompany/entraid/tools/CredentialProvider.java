package com.yourcompany.entraid.tools;

/**
 * Supplies the bearer token for a run.
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * Acquires a token using the client-credentials flow.
     *
     * @return A non-empty bearer token.
     * @throws AuthenticationException if the identity provider could not be reached or refused the credentials.
     */
    BearerToken acquireToken();
}
