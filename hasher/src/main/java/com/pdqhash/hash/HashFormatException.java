package com.pdqhash.hash;

/**
 * Raised when a textual or binary hash encoding cannot be parsed.
 */
public class HashFormatException extends IllegalArgumentException {

    public HashFormatException(String message) {
        super(message);
    }

    public HashFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
