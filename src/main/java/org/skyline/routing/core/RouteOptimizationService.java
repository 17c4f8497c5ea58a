package org.skyline.routing.core;

import org.skyline.routing.expand.Route;
import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.tour.TourStrategy;

/**
 * Public route optimization contract.
 *
 * <p>Implementations validate input deterministically and fail with reason-coded runtime
 * exceptions. A failure never yields a partial route.</p>
 */
public interface RouteOptimizationService {

    /**
     * Computes the route visiting every critical node of the graph from {@code startNodeId}.
     *
     * @param graph immutable building graph.
     * @param startNodeId external id of the start node.
     * @param strategy tour solving strategy.
     * @return expanded route.
     */
    Route computeRoute(BuildingGraph graph, String startNodeId, TourStrategy strategy);

    /**
     * Executes one fully specified request.
     *
     * @param graph immutable building graph.
     * @param request optimization request.
     * @return response with route, tour and telemetry.
     */
    OptimizationResponse optimize(BuildingGraph graph, OptimizationRequest request);
}
