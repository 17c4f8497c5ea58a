package org.skyline.routing.error;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when an edge weight is negative or not finite.
 */
@Getter
@Accessors(fluent = true)
public final class InvalidWeightException extends PathfinderException {
    public static final String REASON = "GRAPH_INVALID_WEIGHT";

    private final double weight;

    public InvalidWeightException(String fromNodeId, String toNodeId, double weight) {
        super(REASON, "edge " + fromNodeId + " <-> " + toNodeId + " has invalid weight: " + weight);
        this.weight = weight;
    }
}
