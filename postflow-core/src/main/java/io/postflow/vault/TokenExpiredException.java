package io.postflow.vault;

/**
 * The access token is expired (or about to be) and cannot be refreshed, either because the
 * connection has no refresh token or because the connection is unknown or inactive.
 */
public class TokenExpiredException extends CredentialException {

    public TokenExpiredException(String message) {
        super(message);
    }
}
