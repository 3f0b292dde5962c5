package com.ambr.core;

import java.io.IOException;

/**
 * Fatal setup error: a mandatory input file, sheet, column or value is missing.
 */
public class MissingInputException extends IOException {
    private final String resource;

    public MissingInputException(String resource, String message) {
        super(message);
        this.resource = resource;
    }

    public MissingInputException(String resource, String message, Throwable cause) {
        super(message, cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
