package com.trender.pipeline.connection;

/**
 * A run cannot start: credentials were rejected, a warehouse dataset is missing,
 * or the warehouse stayed unreachable after retries. Always fatal.
 */
public class ConnectionException extends Exception {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
