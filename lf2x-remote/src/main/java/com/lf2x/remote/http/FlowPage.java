package com.lf2x.remote.http;

import java.util.List;

/** A page of flow summaries plus the server's pagination window. */
public record FlowPage(List<FlowSummary> flows, int total, int offset, int limit) {
    public FlowPage {
        flows = List.copyOf(flows);
    }

    public boolean hasMore() {
        return offset + flows.size() < total;
    }
}
