package org.skyline.routing.heuristic;

import org.skyline.routing.error.PathfinderException;

/**
 * Thrown when a heuristic provider cannot be created for a graph.
 */
public final class HeuristicConfigurationException extends PathfinderException {

    public HeuristicConfigurationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
