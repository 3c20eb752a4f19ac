package ai.convoy.util.auth;

import ai.convoy.util.auth.exceptions.AuthException;

public interface AuthenticateService {

    /**
     * Resolves the caller behind an {@code Authorization} header value.
     *
     * @throws AuthException if the credentials are missing, malformed, expired or rejected
     */
    Principal authenticate(String authorizationHeader) throws AuthException;

}
