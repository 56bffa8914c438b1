package com.streamfirst.canvas.sync.ports;

/**
 * Raised by {@link RemoteStorePort} implementations for any backend failure. The gateway turns these
 * into {@code Result} failures; they never reach the host application.
 */
public class RemoteStoreException extends RuntimeException {

    private final int statusCode;

    public RemoteStoreException(String message) {
        this(message, 0, null);
    }

    public RemoteStoreException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public RemoteStoreException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP-like status reported by the backend, or 0 when the request never got an answer.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
