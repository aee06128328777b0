package com.archivist.sync.remote;

/**
 * Transport or service failure talking to the remote campaign service.
 * {@link #getStatusCode()} is 0 when no HTTP response was received.
 */
public class RemoteServiceException extends RuntimeException {

    private final int statusCode;

    public RemoteServiceException(String message) {
        this(message, 0, null);
    }

    public RemoteServiceException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public RemoteServiceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
