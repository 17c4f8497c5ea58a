package org.skyline.routing.tour;

import lombok.experimental.UtilityClass;
import org.skyline.routing.error.EmptyCriticalSetException;
import org.skyline.routing.reduce.ReducedGraph;

import java.util.Objects;

/**
 * Argument checks shared by tour solvers.
 */
@UtilityClass
class TourPreconditions {

    /**
     * Validates inputs and returns the anchor index of the start node.
     */
    static int requireStartAnchor(ReducedGraph graph, int startNodeId, TourMode mode) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(mode, "mode");
        if (graph.size() == 0) {
            throw new EmptyCriticalSetException("reduced graph has no anchors to visit");
        }
        return graph.indexOf(startNodeId);
    }
}
