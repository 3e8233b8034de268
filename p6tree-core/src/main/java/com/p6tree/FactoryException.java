package com.p6tree;

/**
 * Raised when a match tree cannot be turned into elements.
 */
public class FactoryException extends RuntimeException {

    public FactoryException(String message) {
        super(message);
    }

    public FactoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
