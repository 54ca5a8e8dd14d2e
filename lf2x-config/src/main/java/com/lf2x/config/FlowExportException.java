package com.lf2x.config;

import java.io.IOException;

/** A flow export could not be turned into a document. Raised before any conversion work starts. */
public class FlowExportException extends IOException {
    public FlowExportException(String message) {
        super(message);
    }

    public FlowExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
