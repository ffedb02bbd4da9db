package dev.tributary.connector;

/**
 * Raised when a connector cannot reach its source or its credentials are rejected. Fatal for the
 * connector's batch.
 */
public class ConnectionException extends Exception {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
