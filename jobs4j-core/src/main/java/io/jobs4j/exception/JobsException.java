package io.jobs4j.exception;

/**
 * Base type for errors raised by jobs4j itself. Engine and handler errors are propagated as-is.
 */
public class JobsException extends RuntimeException {

    public JobsException(String message) {
        super(message);
    }

    public JobsException(String message, Throwable cause) {
        super(message, cause);
    }
}
