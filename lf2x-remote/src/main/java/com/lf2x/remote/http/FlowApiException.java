package com.lf2x.remote.http;

import java.io.IOException;

/** The flow server answered with an error status or an unexpected payload. */
public class FlowApiException extends IOException {
    private final int statusCode;

    public FlowApiException(String message) {
        this(message, -1);
    }

    public FlowApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed response, or -1 when the failure was not a status code. */
    public int statusCode() {
        return statusCode;
    }
}
