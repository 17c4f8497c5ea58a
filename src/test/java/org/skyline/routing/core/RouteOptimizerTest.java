package org.skyline.routing.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.skyline.routing.error.EmptyCriticalSetException;
import org.skyline.routing.error.PathfinderException;
import org.skyline.routing.error.UnknownNodeException;
import org.skyline.routing.error.UnreachableException;
import org.skyline.routing.expand.Route;
import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.graph.BuildingNode;
import org.skyline.routing.heuristic.HeuristicType;
import org.skyline.routing.path.SearchAlgorithm;
import org.skyline.routing.testutil.BuildingFixtureFactory;
import org.skyline.routing.tour.ExactTourSolver;
import org.skyline.routing.tour.TourMode;
import org.skyline.routing.tour.TourStrategy;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Route Optimizer Tests")
class RouteOptimizerTest {
    private static final OptimizerConfig DEFAULT_CONFIG = OptimizerConfig.builder().build();

    private static RouteOptimizer optimizer() {
        return RouteOptimizer.builder().config(DEFAULT_CONFIG).build();
    }

    @Nested
    @DisplayName("1. End-to-End Scenarios")
    class ScenarioTests {

        @ParameterizedTest
        @EnumSource(TourStrategy.class)
        @DisplayName("Four-cycle with diagonals: closed route [A, B, C, D, A] with cost 4")
        void testFourCycle(TourStrategy strategy) {
            Route route = optimizer().computeRoute(BuildingFixtureFactory.fourCycle(), "A", strategy);

            assertEquals(List.of("A", "B", "C", "D", "A"), route.externalIds());
            assertEquals(4.0, route.cost());
        }

        @ParameterizedTest
        @EnumSource(TourStrategy.class)
        @DisplayName("Disconnected critical node fails with UnreachableException, no partial route")
        void testDisconnectedCriticalNode(TourStrategy strategy) {
            BuildingGraph graph = BuildingFixtureFactory.withIsolatedRoom();

            UnreachableException ex = assertThrows(
                    UnreachableException.class,
                    () -> optimizer().computeRoute(graph, "A", strategy)
            );
            assertEquals("X", ex.destinationNodeId());
        }

        @Test
        @DisplayName("Transit start node is added to the anchors")
        void testTransitStart() {
            BuildingGraph graph = BuildingFixtureFactory.withIsolatedRoom();
            OptimizationResponse response = optimizer().optimize(graph, OptimizationRequest.builder()
                    .startNodeId("H2")
                    .criticalNodeId("A")
                    .criticalNodeId("B")
                    .strategy(TourStrategy.EXACT)
                    .build());

            assertEquals("H2", response.getPathExternalNodeIds().get(0));
            assertEquals("H2", response.getTourExternalNodeIds().get(0));
            assertEquals(List.of("H2", "H1", "A", "H1", "H2", "H3", "B", "H3", "H2"), response.getPathExternalNodeIds());
            assertEquals(60.0, response.getTotalCost(), 1e-9);
            assertEquals(3, response.getTelemetry().getAnchorCount());
            assertEquals(3, response.getTelemetry().getReducedEdgeCount());
        }

        @Test
        @DisplayName("Explicit critical list restricts the destinations")
        void testExplicitDestinations() {
            OptimizationResponse response = optimizer().optimize(BuildingFixtureFactory.fourCycle(),
                    OptimizationRequest.builder()
                            .startNodeId("A")
                            .criticalNodeId("C")
                            .strategy(TourStrategy.GREEDY)
                            .tourMode(TourMode.OPEN)
                            .build());

            assertEquals(List.of("A", "C"), response.getTourExternalNodeIds());
            assertEquals(2.0, response.getTotalCost());
            assertEquals(TourMode.OPEN, response.getTourMode());
            assertEquals(TourStrategy.GREEDY, response.getStrategy());
            assertEquals(1, response.getTelemetry().getPathSearches());
        }

        @Test
        @DisplayName("Start as the only critical node yields a zero-cost single-node route")
        void testSingleAnchor() {
            BuildingGraph graph = BuildingGraph.builder()
                    .addNode(BuildingNode.critical("Office", 0, 0, 0))
                    .addNode(BuildingNode.transit("Hall", 5, 0, 0))
                    .addEuclideanEdge("Office", "Hall")
                    .build();

            Route route = optimizer().computeRoute(graph, "Office", TourStrategy.EXACT);

            assertEquals(List.of("Office"), route.externalIds());
            assertEquals(0.0, route.cost());
        }

        @ParameterizedTest
        @EnumSource(TourStrategy.class)
        @Timeout(20)
        @DisplayName("Sample-sized building: parallel configuration matches sequential")
        void testParallelConfigMatches(TourStrategy strategy) {
            BuildingGraph graph = BuildingFixtureFactory.randomConnected(404L, 80, 120, 10);
            OptimizerConfig parallel = DEFAULT_CONFIG.toBuilder()
                    .reducerParallelism(4)
                    .exactParallelism(4)
                    .build();
            String start = graph.externalId(graph.criticalNodeIds()[0]);

            Route sequentialRoute = optimizer().computeRoute(graph, start, strategy);
            Route parallelRoute = RouteOptimizer.builder().config(parallel).build().computeRoute(graph, start, strategy);

            assertEquals(sequentialRoute.externalIds(), parallelRoute.externalIds());
            assertEquals(sequentialRoute.cost(), parallelRoute.cost());
        }

        @Test
        @DisplayName("Dijkstra configuration finds the same cost as A*")
        void testDijkstraConfig() {
            BuildingGraph graph = BuildingFixtureFactory.randomConnected(17L, 60, 80, 8);
            String start = graph.externalId(graph.criticalNodeIds()[0]);
            OptimizerConfig dijkstra = DEFAULT_CONFIG.toBuilder().algorithm(SearchAlgorithm.DIJKSTRA).build();

            OptimizationResponse aStar = optimizer().optimize(graph,
                    OptimizationRequest.builder().startNodeId(start).strategy(TourStrategy.EXACT).build());
            OptimizationResponse uniform = RouteOptimizer.builder().config(dijkstra).build().optimize(graph,
                    OptimizationRequest.builder().startNodeId(start).strategy(TourStrategy.EXACT).build());

            assertEquals(aStar.getTotalCost(), uniform.getTotalCost(), 1e-9);
            assertEquals(HeuristicType.NONE, uniform.getTelemetry().getHeuristicType());
            assertEquals(HeuristicType.EUCLIDEAN, aStar.getTelemetry().getHeuristicType());
        }
    }

    @Nested
    @DisplayName("2. Request Validation")
    class ValidationTests {

        @Test
        @DisplayName("Graph without critical nodes raises EmptyCriticalSetException")
        void testEmptyCriticalSet() {
            BuildingGraph graph = BuildingGraph.builder()
                    .addNode(BuildingNode.transit("H1", 0, 0, 0))
                    .addNode(BuildingNode.transit("H2", 1, 0, 0))
                    .addEdge("H1", "H2", 1.0)
                    .build();

            EmptyCriticalSetException ex = assertThrows(
                    EmptyCriticalSetException.class,
                    () -> optimizer().computeRoute(graph, "H1", TourStrategy.GREEDY)
            );
            assertEquals(EmptyCriticalSetException.REASON, ex.reasonCode());
        }

        @Test
        @DisplayName("Missing graph, request, start or strategy are reason-coded")
        void testRequiredFields() {
            BuildingGraph graph = BuildingFixtureFactory.fourCycle();

            assertReason(RouteOptimizer.REASON_GRAPH_REQUIRED,
                    () -> optimizer().computeRoute(null, "A", TourStrategy.EXACT));
            assertReason(RouteOptimizer.REASON_REQUEST_REQUIRED,
                    () -> optimizer().optimize(graph, null));
            assertReason(RouteOptimizer.REASON_START_NODE_REQUIRED,
                    () -> optimizer().computeRoute(graph, " ", TourStrategy.EXACT));
            assertReason(RouteOptimizer.REASON_STRATEGY_REQUIRED,
                    () -> optimizer().computeRoute(graph, "A", null));
            assertReason(RouteOptimizer.REASON_CRITICAL_NODE_REQUIRED,
                    () -> optimizer().optimize(graph, OptimizationRequest.builder()
                            .startNodeId("A")
                            .criticalNodeId("")
                            .strategy(TourStrategy.GREEDY)
                            .build()));
        }

        @Test
        @DisplayName("Unknown start or destination raises UnknownNodeException")
        void testUnknownNodes() {
            BuildingGraph graph = BuildingFixtureFactory.fourCycle();

            assertThrows(UnknownNodeException.class,
                    () -> optimizer().computeRoute(graph, "Z", TourStrategy.EXACT));
            assertThrows(UnknownNodeException.class,
                    () -> optimizer().optimize(graph, OptimizationRequest.builder()
                            .startNodeId("A")
                            .criticalNodeId("Q")
                            .strategy(TourStrategy.EXACT)
                            .build()));
        }

        @Test
        @DisplayName("Exact strategy above the configured ceiling fails fast")
        void testExactCeiling() {
            OptimizerConfig small = DEFAULT_CONFIG.toBuilder().maxExactNodes(3).build();
            PathfinderException ex = assertThrows(
                    PathfinderException.class,
                    () -> RouteOptimizer.builder().config(small).build()
                            .computeRoute(BuildingFixtureFactory.fourCycle(), "A", TourStrategy.EXACT)
            );
            assertEquals(ExactTourSolver.REASON_NODE_LIMIT_EXCEEDED, ex.reasonCode());
        }
    }

    private static void assertReason(String reason, Executable executable) {
        PathfinderException ex = assertThrows(PathfinderException.class, executable);
        assertEquals(reason, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[" + reason + "]"));
    }
}
