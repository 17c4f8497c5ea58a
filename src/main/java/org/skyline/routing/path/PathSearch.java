package org.skyline.routing.path;

import org.skyline.routing.error.UnreachableException;
import org.skyline.routing.graph.BuildingGraph;

/**
 * Point-to-point shortest-path search over a building graph.
 */
@FunctionalInterface
public interface PathSearch {

    /**
     * Computes a minimum-cost path.
     *
     * @param graph immutable graph to search.
     * @param source internal source node id.
     * @param destination internal destination node id.
     * @return optimal path from source to destination.
     * @throws UnreachableException when the destination cannot be reached.
     */
    Path shortestPath(BuildingGraph graph, int source, int destination);
}
