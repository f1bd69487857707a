package io.postflow.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the stores in
 * {@link io.postflow.jdbc.store}.
 */
public final class PostflowStoreException extends RuntimeException {
    public PostflowStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
