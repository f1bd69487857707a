package io.postflow.vault;

/**
 * The platform's token endpoint rejected the refresh or could not be reached.
 */
public class TokenRefreshException extends CredentialException {

    public TokenRefreshException(String message, Throwable cause) {
        super(message, cause);
    }
}
