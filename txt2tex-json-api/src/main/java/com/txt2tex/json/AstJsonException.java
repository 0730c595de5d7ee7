package com.txt2tex.json;

/**
 * Thrown when a txt2tex tree cannot be written to or read back from JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public AstJsonException(Throwable cause) {
        super(cause);
    }
}
