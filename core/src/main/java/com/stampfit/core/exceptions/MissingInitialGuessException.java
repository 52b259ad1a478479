package com.stampfit.core.exceptions;

import java.util.List;

public class MissingInitialGuessException extends IllegalArgumentException {

    private final List<String> missing;

    public MissingInitialGuessException(List<String> missing) {
        super("No initial guess supplied for parameters " + missing);
        this.missing = List.copyOf(missing);
    }

    public List<String> getMissing() {
        return missing;
    }
}
