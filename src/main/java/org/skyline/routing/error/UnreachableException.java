package org.skyline.routing.error;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when no path connects two nodes.
 *
 * <p>During route optimization this is fatal for the whole request: a critical node that cannot
 * be reached makes every tour infeasible.</p>
 */
@Getter
@Accessors(fluent = true)
public final class UnreachableException extends PathfinderException {
    public static final String REASON = "SEARCH_UNREACHABLE";

    private final String sourceNodeId;
    private final String destinationNodeId;

    public UnreachableException(String sourceNodeId, String destinationNodeId) {
        super(REASON, "no path from " + sourceNodeId + " to " + destinationNodeId);
        this.sourceNodeId = sourceNodeId;
        this.destinationNodeId = destinationNodeId;
    }
}
