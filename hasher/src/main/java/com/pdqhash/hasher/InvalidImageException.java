package com.pdqhash.hasher;

/**
 * Raised when a pixel grid cannot be hashed: missing, zero-sized, or with a
 * channel buffer that does not match its dimensions.
 */
public class InvalidImageException extends IllegalArgumentException {

    public InvalidImageException(String message) {
        super("Invalid image: " + message);
    }

    public InvalidImageException(String message, Throwable cause) {
        super("Invalid image: " + message, cause);
    }
}
