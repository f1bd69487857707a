package io.postflow.vault;

/**
 * A usable access token could not be produced for a platform connection.
 *
 * <p>The dispatcher treats every {@code CredentialException} as an authentication failure
 * of the attempt.
 */
public class CredentialException extends RuntimeException {

    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
