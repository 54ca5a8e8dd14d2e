package com.lf2x.config;

/** A field is present but has the wrong shape (for example {@code nodes} is not an array). */
public final class MalformedExportException extends FlowExportException {
    public MalformedExportException(String message) {
        super(message);
    }

    public MalformedExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
