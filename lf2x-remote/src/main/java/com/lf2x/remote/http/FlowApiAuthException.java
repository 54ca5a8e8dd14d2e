package com.lf2x.remote.http;

/** HTTP 401 or 403. */
public final class FlowApiAuthException extends FlowApiException {
    public FlowApiAuthException(int statusCode) {
        super("Authentication failed for flow API request", statusCode);
    }
}
