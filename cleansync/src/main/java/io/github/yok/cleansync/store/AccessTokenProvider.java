package io.github.yok.cleansync.store;

import io.github.yok.cleansync.exception.AuthException;

/**
 * Source of the OAuth 2.0 bearer token sent with every Drive API request.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface AccessTokenProvider {

    /**
     * Returns the current access token.
     *
     * @return bearer token
     * @throws AuthException if no token is available
     */
    String getAccessToken();
}
