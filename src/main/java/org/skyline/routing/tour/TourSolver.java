package org.skyline.routing.tour;

import org.skyline.routing.error.EmptyCriticalSetException;
import org.skyline.routing.reduce.ReducedGraph;

/**
 * Orders the anchors of a reduced graph into a tour starting at a given node.
 */
public interface TourSolver {

    /**
     * @return strategy implemented by this solver.
     */
    TourStrategy strategy();

    /**
     * Solves the tour.
     *
     * @param graph complete reduced graph.
     * @param startNodeId original graph id of the start anchor.
     * @param mode closed or open tour.
     * @return tour visiting every anchor exactly once (the start twice when closed).
     * @throws EmptyCriticalSetException if the reduced graph has no anchors.
     * @throws IllegalArgumentException if the start node is not an anchor.
     */
    Tour solve(ReducedGraph graph, int startNodeId, TourMode mode);
}
