package org.skyline.routing.error;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a node id is registered twice while building a graph.
 */
@Getter
@Accessors(fluent = true)
public final class DuplicateNodeException extends PathfinderException {
    public static final String REASON = "GRAPH_DUPLICATE_NODE";

    private final String nodeId;

    public DuplicateNodeException(String nodeId) {
        super(REASON, "node already exists: " + nodeId);
        this.nodeId = nodeId;
    }
}
