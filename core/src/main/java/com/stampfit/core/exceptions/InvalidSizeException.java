package com.stampfit.core.exceptions;

/**
 * Raised when a patch or a requested output size does not agree with the side
 * length of a collection.
 */
public class InvalidSizeException extends IllegalArgumentException {

    public InvalidSizeException(String message) {
        super(message);
    }
}
