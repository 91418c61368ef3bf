package com.treeroll.service.core.fact;

/** The fact table could not be acquired. */
public class FactSourceException extends IllegalStateException {

    public FactSourceException(String message) {
        super(message);
    }

    public FactSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
