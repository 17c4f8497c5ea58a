package org.skyline.app;

import org.skyline.routing.core.OptimizationRequest;
import org.skyline.routing.core.OptimizationResponse;
import org.skyline.routing.core.OptimizerConfig;
import org.skyline.routing.core.RouteOptimizer;
import org.skyline.routing.estimate.DeliveryTimeEstimator;
import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.graph.BuildingNode;
import org.skyline.routing.graph.CorridorConnector;
import org.skyline.routing.tour.TourStrategy;

import java.util.Locale;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Builds a small two-floor building, routes through all of its classrooms and prints the route
 * with a delivery-time estimate.</p>
 */
public class Main {
    static final String START_ROOM = "R101";

    /**
     * Runs the sample route.
     *
     * @param args optional tour strategy name ({@code EXACT} or {@code GREEDY}, default GREEDY).
     */
    public static void main(String[] args) {
        TourStrategy strategy = args.length > 0
                ? TourStrategy.valueOf(args[0].trim().toUpperCase(Locale.ROOT))
                : TourStrategy.GREEDY;

        BuildingGraph graph = sampleBuilding();
        RouteOptimizer optimizer = RouteOptimizer.builder()
                .config(OptimizerConfig.defaults())
                .build();
        OptimizationResponse response = optimizer.optimize(
                graph,
                OptimizationRequest.builder()
                        .startNodeId(START_ROOM)
                        .strategy(strategy)
                        .build()
        );

        System.out.println("Strategy: " + response.getStrategy() + " (" + response.getTourMode() + ")");
        System.out.println("Classrooms to visit: " + response.getTourExternalNodeIds());
        System.out.println("Route: " + response.getPathExternalNodeIds());
        System.out.printf(Locale.ROOT, "Distance: %.2f%n", response.getTotalCost());
        System.out.println("Time needed: " + DeliveryTimeEstimator.defaults().estimate(response));
    }

    /**
     * Two floors of three hallway junctions joined by a staircase, with two classrooms per floor
     * attached to the nearest corridor.
     */
    static BuildingGraph sampleBuilding() {
        BuildingGraph.Builder builder = BuildingGraph.builder()
                .addNode(BuildingNode.transit("H0-1", 0, 0, 0))
                .addNode(BuildingNode.transit("H0-2", 100, 0, 0))
                .addNode(BuildingNode.transit("H0-3", 200, 0, 0))
                .addNode(BuildingNode.transit("H1-1", 0, 0, 10))
                .addNode(BuildingNode.transit("H1-2", 100, 0, 10))
                .addNode(BuildingNode.transit("H1-3", 200, 0, 10))
                .addNode(BuildingNode.critical("R101", 50, 20, 0))
                .addNode(BuildingNode.critical("R102", 150, -20, 0))
                .addNode(BuildingNode.critical("R201", 30, 15, 10))
                .addNode(BuildingNode.critical("R202", 170, 20, 10))
                .addEuclideanEdge("H0-1", "H0-2")
                .addEuclideanEdge("H0-2", "H0-3")
                .addEuclideanEdge("H1-1", "H1-2")
                .addEuclideanEdge("H1-2", "H1-3")
                .addEuclideanEdge("H0-3", "H1-3");
        CorridorConnector.connectIsolatedCriticalNodes(builder);
        return builder.build();
    }
}
