package dev.reviewgate.exception;

/**
 * The reviewing agent could not produce a reply.
 */
public class ReviewAgentException extends RuntimeException {

    public ReviewAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
