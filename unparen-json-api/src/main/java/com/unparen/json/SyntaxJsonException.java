package com.unparen.json;

/**
 * Thrown when a syntax node cannot be written as JSON, or when JSON text does
 * not describe a well-formed syntax tree. The cause carries the provider's own
 * failure.
 */
public class SyntaxJsonException extends RuntimeException {

    public SyntaxJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
