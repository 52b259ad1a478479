package com.stampfit.core.exceptions;

/**
 * Failure of a single patch fit. The fitter records it against the patch
 * identifier and keeps going with the rest of the batch.
 */
public class PatchFitException extends RuntimeException {

    public PatchFitException(String message) {
        super(message);
    }

    public PatchFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
