package com.lf2x.remote.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/** One entry of a flow listing. */
public record FlowSummary(String flowId, String name, List<String> tags) {
    public FlowSummary {
        flowId = Objects.requireNonNull(flowId, "flowId");
        name = Objects.requireNonNull(name, "name");
        tags = List.copyOf(tags);
    }

    /**
     * Reads {@code id} (or {@code flow_id}), {@code name} defaulting to the id, and {@code tags}
     * given either as a list or as an object whose values are the tags.
     */
    static FlowSummary fromJson(JsonNode payload) throws FlowApiException {
        if (payload == null || !payload.isObject()) {
            throw new FlowApiException("Flow summary must be a JSON object");
        }
        String flowId = text(payload.get("id"));
        if (flowId == null) flowId = text(payload.get("flow_id"));
        if (flowId == null) throw new FlowApiException("Flow summary is missing an identifier");

        String name = text(payload.get("name"));
        List<String> tags = new ArrayList<>();
        JsonNode tagsNode = payload.get("tags");
        if (tagsNode != null && tagsNode.isContainerNode()) {
            Iterator<JsonNode> values = tagsNode.elements();
            while (values.hasNext()) tags.add(values.next().asText());
        }
        return new FlowSummary(flowId, name != null ? name : flowId, tags);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) return null;
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }
}
