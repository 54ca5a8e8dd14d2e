package com.lf2x.config;

/** Raised under {@link DanglingEdgePolicy#REJECT} when an edge names a node the export does not declare. */
public final class DanglingEdgeException extends FlowExportException {
    private final String edgeId;
    private final String missingNodeId;

    public DanglingEdgeException(String edgeId, String missingNodeId) {
        super("Edge '" + edgeId + "' references unknown node '" + missingNodeId + "'");
        this.edgeId = edgeId;
        this.missingNodeId = missingNodeId;
    }

    public String edgeId() {
        return edgeId;
    }

    public String missingNodeId() {
        return missingNodeId;
    }
}
