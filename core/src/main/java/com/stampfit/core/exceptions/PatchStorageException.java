package com.stampfit.core.exceptions;

public class PatchStorageException extends RuntimeException {

    public PatchStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
