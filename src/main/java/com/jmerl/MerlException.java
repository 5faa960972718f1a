package com.jmerl;

/**
 * Base class of the fatal errors raised by jmerl. A failed match is not an error and is never
 * reported through this hierarchy.
 */
public class MerlException extends RuntimeException {
    public MerlException(String message) {
        super(message);
    }

    public MerlException(String message, Throwable cause) {
        super(message, cause);
    }
}
