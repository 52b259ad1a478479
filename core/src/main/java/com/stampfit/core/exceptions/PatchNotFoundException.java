package com.stampfit.core.exceptions;

import java.util.NoSuchElementException;

public class PatchNotFoundException extends NoSuchElementException {

    public PatchNotFoundException(Object identifier) {
        super(identifier + " is not used to identify a patch in this collection.");
    }
}
