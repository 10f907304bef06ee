package dev.reviewgate.exception;

/**
 * A call to the code hosting service failed: transport error, non-2xx status, or an
 * unreadable response.
 */
public class HostingClientException extends RuntimeException {

    private final int statusCode;

    public HostingClientException(String message) {
        this(message, 0, null);
    }

    public HostingClientException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public HostingClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed call, or 0 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
