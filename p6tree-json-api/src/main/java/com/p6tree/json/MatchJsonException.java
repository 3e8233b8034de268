package com.p6tree.json;

/**
 * Exception thrown when a match tree cannot be read from or written to JSON.
 */
public class MatchJsonException extends RuntimeException {

    public MatchJsonException(String message) {
        super(message);
    }

    public MatchJsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public MatchJsonException(Throwable cause) {
        super(cause);
    }
}
