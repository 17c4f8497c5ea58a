package org.skyline.routing.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.skyline.routing.cache.PathCache;
import org.skyline.routing.error.EmptyCriticalSetException;
import org.skyline.routing.error.PathfinderException;
import org.skyline.routing.expand.Route;
import org.skyline.routing.expand.RouteExpander;
import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.path.AStarPathSearch;
import org.skyline.routing.reduce.GraphReducer;
import org.skyline.routing.reduce.ReducedGraph;
import org.skyline.routing.tour.Tour;
import org.skyline.routing.tour.TourMode;
import org.skyline.routing.tour.TourSolver;
import org.skyline.routing.tour.TourSolvers;
import org.skyline.routing.tour.TourStrategy;

import java.util.List;
import java.util.Objects;

/**
 * Main route optimization entry point.
 *
 * <p>Execution flow for one request:</p>
 * <ul>
 * <li>Validate the request and map external ids to internal node ids.</li>
 * <li>Collect the anchors: the requested critical nodes (or all critical nodes) plus the start.</li>
 * <li>Reduce the graph to the anchors through a fresh request-scoped {@link PathCache}.</li>
 * <li>Solve the tour with the requested strategy.</li>
 * <li>Expand the tour back into a walk over the original graph.</li>
 * </ul>
 *
 * <p>Pipeline exceptions propagate unchanged, so callers see
 * {@link org.skyline.routing.error.UnreachableException} and friends directly.</p>
 */
@Slf4j
public final class RouteOptimizer implements RouteOptimizationService {
    public static final String REASON_GRAPH_REQUIRED = "OPTIMIZER_GRAPH_REQUIRED";
    public static final String REASON_REQUEST_REQUIRED = "OPTIMIZER_REQUEST_REQUIRED";
    public static final String REASON_START_NODE_REQUIRED = "OPTIMIZER_START_NODE_REQUIRED";
    public static final String REASON_STRATEGY_REQUIRED = "OPTIMIZER_STRATEGY_REQUIRED";
    public static final String REASON_CRITICAL_NODE_REQUIRED = "OPTIMIZER_CRITICAL_NODE_REQUIRED";

    private final OptimizerConfig config;
    private final AStarPathSearch search;
    private final GraphReducer reducer;
    private final RouteExpander expander;

    /**
     * Creates an optimizer.
     *
     * @param config runtime settings; {@code null} loads {@link OptimizerConfig#defaults()}.
     */
    @Builder
    public RouteOptimizer(OptimizerConfig config) {
        this.config = config == null ? OptimizerConfig.defaults() : config;
        this.search = AStarPathSearch.of(this.config.getAlgorithm(), this.config.getHeuristicType());
        this.reducer = new GraphReducer(search, this.config.getReducerParallelism());
        this.expander = new RouteExpander();
    }

    public OptimizerConfig config() {
        return config;
    }

    @Override
    public Route computeRoute(BuildingGraph graph, String startNodeId, TourStrategy strategy) {
        OptimizationRequest request = OptimizationRequest.builder()
                .startNodeId(startNodeId)
                .strategy(strategy)
                .build();
        return execute(requireGraph(graph), request).route();
    }

    @Override
    public OptimizationResponse optimize(BuildingGraph graph, OptimizationRequest request) {
        Execution execution = execute(requireGraph(graph), request);
        return OptimizationResponse.builder()
                .pathExternalNodeIds(execution.route().externalIds())
                .tourExternalNodeIds(execution.tour().externalIds())
                .totalCost(execution.route().cost())
                .strategy(execution.strategy())
                .tourMode(execution.tour().mode())
                .telemetry(execution.telemetry())
                .build();
    }

    private Execution execute(BuildingGraph graph, OptimizationRequest request) {
        if (request == null) {
            throw new PathfinderException(REASON_REQUEST_REQUIRED, "optimization request must be provided");
        }
        if (request.getStartNodeId() == null || request.getStartNodeId().isBlank()) {
            throw new PathfinderException(REASON_START_NODE_REQUIRED, "startNodeId must be non-blank");
        }
        if (request.getStrategy() == null) {
            throw new PathfinderException(REASON_STRATEGY_REQUIRED, "strategy must be specified");
        }
        TourStrategy strategy = request.getStrategy();
        TourMode mode = request.getTourMode() == null ? config.getTourMode() : request.getTourMode();

        try {
            int startNodeId = graph.nodeIndex(request.getStartNodeId());
            int[] anchors = collectAnchors(graph, request.getCriticalNodeIds(), startNodeId);
            log.debug("Optimizing from {} over {} anchors with {} ({})", request.getStartNodeId(), anchors.length, strategy, mode);

            PathCache cache = new PathCache(graph);
            ReducedGraph reduced = reducer.reduce(graph, anchors, cache);
            log.debug("Reduced graph has {} anchors, {} edges, {} searches", reduced.size(), reduced.edgeCount(), cache.computations());

            TourSolver solver = TourSolvers.forStrategy(strategy, config.getMaxExactNodes(), config.getExactParallelism());
            Tour tour = solver.solve(reduced, startNodeId, mode);
            log.debug("Solved {}", tour);

            Route route = expander.expand(tour, cache);
            OptimizationTelemetry telemetry = OptimizationTelemetry.builder()
                    .anchorCount(reduced.size())
                    .reducedEdgeCount(reduced.edgeCount())
                    .pathSearches(cache.computations())
                    .cachedPaths(cache.size())
                    .algorithm(config.getAlgorithm())
                    .heuristicType(search.heuristicType())
                    .build();
            log.info("Route from {} visits {} anchors in {} hops, cost {}",
                    request.getStartNodeId(), reduced.size(), route.length() - 1, route.cost());
            return new Execution(tour, route, strategy, telemetry);
        } catch (PathfinderException ex) {
            log.warn("Route optimization from {} failed: {}", request.getStartNodeId(), ex.getMessage());
            throw ex;
        }
    }

    /**
     * Resolves the anchor set: requested (or flagged) critical nodes plus the start node.
     */
    private static int[] collectAnchors(BuildingGraph graph, List<String> requested, int startNodeId) {
        int[] critical;
        if (requested == null || requested.isEmpty()) {
            critical = graph.criticalNodeIds();
        } else {
            critical = new int[requested.size()];
            for (int i = 0; i < requested.size(); i++) {
                String id = requested.get(i);
                if (id == null || id.isBlank()) {
                    throw new PathfinderException(
                            REASON_CRITICAL_NODE_REQUIRED,
                            "criticalNodeIds[" + i + "] must be non-blank"
                    );
                }
                critical[i] = graph.nodeIndex(id);
            }
        }
        if (critical.length == 0) {
            throw new EmptyCriticalSetException("graph has no critical nodes to visit");
        }
        int[] anchors = new int[critical.length + 1];
        anchors[0] = startNodeId;
        System.arraycopy(critical, 0, anchors, 1, critical.length);
        return anchors;
    }

    private static BuildingGraph requireGraph(BuildingGraph graph) {
        if (graph == null) {
            throw new PathfinderException(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
        return graph;
    }

    private record Execution(Tour tour, Route route, TourStrategy strategy, OptimizationTelemetry telemetry) {
    }
}
