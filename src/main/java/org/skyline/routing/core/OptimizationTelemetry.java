package org.skyline.routing.core;

import lombok.Builder;
import lombok.Value;
import org.skyline.routing.heuristic.HeuristicType;
import org.skyline.routing.path.SearchAlgorithm;

/**
 * Work counters of one optimization request.
 */
@Value
@Builder
public class OptimizationTelemetry {
    /** Anchors in the reduced graph, start included. */
    int anchorCount;
    /** Edges of the complete reduced graph. */
    int reducedEdgeCount;
    /** Shortest-path searches actually executed. */
    int pathSearches;
    /** Paths held by the request cache at the end. */
    int cachedPaths;
    SearchAlgorithm algorithm;
    HeuristicType heuristicType;
}
