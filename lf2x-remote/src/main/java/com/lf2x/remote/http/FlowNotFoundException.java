package com.lf2x.remote.http;

public final class FlowNotFoundException extends FlowApiException {
    private final String flowId;

    public FlowNotFoundException(String flowId) {
        super("Flow '" + flowId + "' was not found", 404);
        this.flowId = flowId;
    }

    public String flowId() {
        return flowId;
    }
}
