package cloud.recordstore.sdk.auth;

import cloud.recordstore.sdk.AuthException;

/**
 * Contract for obtaining access tokens.
 */
public interface TokenProvider {

    /**
     * Returns the cached token, performing the first exchange when nothing is cached yet.
     */
    AccessToken currentToken() throws AuthException;

    /**
     * Performs a token exchange and replaces the cached token. Callers that were waiting on an exchange already in
     * progress reuse its result.
     */
    AccessToken forceRefresh() throws AuthException;

    /**
     * Replaces {@code rejected} with a fresh token. If another caller has already replaced it, the cached token is
     * returned without a new exchange.
     */
    default AccessToken refresh(AccessToken rejected) throws AuthException {
        return forceRefresh();
    }
}
