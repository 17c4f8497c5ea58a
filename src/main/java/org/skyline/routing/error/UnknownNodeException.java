package org.skyline.routing.error;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when an operation references a node id that is not part of the graph.
 */
@Getter
@Accessors(fluent = true)
public final class UnknownNodeException extends PathfinderException {
    public static final String REASON = "GRAPH_UNKNOWN_NODE";

    private final String nodeId;

    public UnknownNodeException(String nodeId) {
        super(REASON, "unknown node: " + nodeId);
        this.nodeId = nodeId;
    }

    public UnknownNodeException(String nodeId, Throwable cause) {
        super(REASON, "unknown node: " + nodeId, cause);
        this.nodeId = nodeId;
    }
}
