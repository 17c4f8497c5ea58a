package org.skyline.routing.reduce;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.skyline.routing.cache.PathCache;
import org.skyline.routing.error.UnreachableException;
import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.heuristic.HeuristicType;
import org.skyline.routing.path.AStarPathSearch;
import org.skyline.routing.testutil.BuildingFixtureFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Reducer Tests")
class GraphReducerTest {
    private static final double EPS = 1e-9;

    @ParameterizedTest(name = "parallelism {0}")
    @ValueSource(ints = {1, 4})
    @Timeout(10)
    @DisplayName("Completeness: k anchors give k(k-1)/2 shortest-path weights")
    void testCompleteness(int parallelism) {
        BuildingGraph graph = BuildingFixtureFactory.randomConnected(21L, 50, 70, 5);
        double[][] dist = BuildingFixtureFactory.floydWarshall(graph);
        int[] anchors = graph.criticalNodeIds();
        PathCache cache = new PathCache(graph);

        ReducedGraph reduced = new GraphReducer(new AStarPathSearch(HeuristicType.EUCLIDEAN), parallelism)
                .reduce(graph, anchors, cache);

        int k = anchors.length;
        assertEquals(k, reduced.size());
        assertEquals(k * (k - 1) / 2, reduced.edgeCount());
        assertEquals(k * (k - 1) / 2, cache.size());
        for (int i = 0; i < k; i++) {
            assertEquals(0.0, reduced.weight(i, i));
            for (int j = 0; j < k; j++) {
                assertEquals(reduced.weight(i, j), reduced.weight(j, i));
                assertEquals(dist[reduced.nodeId(i)][reduced.nodeId(j)], reduced.weight(i, j), EPS);
            }
        }
    }

    @Test
    @DisplayName("Anchors are deduplicated and ordered by node id")
    void testAnchorNormalization() {
        BuildingGraph graph = BuildingFixtureFactory.fourCycle();
        PathCache cache = new PathCache(graph);

        ReducedGraph reduced = new GraphReducer(new AStarPathSearch(HeuristicType.EUCLIDEAN))
                .reduce(graph, new int[]{3, 1, 3, 0}, cache);

        assertEquals(3, reduced.size());
        assertEquals(0, reduced.nodeId(0));
        assertEquals(1, reduced.nodeId(1));
        assertEquals(3, reduced.nodeId(2));
        assertEquals("D", reduced.externalId(2));
        assertEquals(2, reduced.indexOf(3));
        assertFalse(reduced.containsNode(2));
        assertThrows(IllegalArgumentException.class, () -> reduced.indexOf(2));
        assertEquals(2.0, reduced.weight(1, 2), EPS);
    }

    @Test
    @DisplayName("Existing cache entries are reused")
    void testReusesCache() {
        BuildingGraph graph = BuildingFixtureFactory.fourCycle();
        PathCache cache = new PathCache(graph);
        GraphReducer reducer = new GraphReducer(new AStarPathSearch(HeuristicType.EUCLIDEAN));

        reducer.reduce(graph, new int[]{0, 1, 2, 3}, cache);
        reducer.reduce(graph, new int[]{0, 1, 2, 3}, cache);

        assertEquals(6, cache.computations());
    }

    @ParameterizedTest(name = "parallelism {0}")
    @ValueSource(ints = {1, 3})
    @DisplayName("Disconnected anchor aborts the reduction")
    void testUnreachable(int parallelism) {
        BuildingGraph graph = BuildingFixtureFactory.withIsolatedRoom();
        PathCache cache = new PathCache(graph);

        assertThrows(
                UnreachableException.class,
                () -> new GraphReducer(new AStarPathSearch(HeuristicType.EUCLIDEAN), parallelism)
                        .reduce(graph, graph.criticalNodeIds(), cache)
        );
    }

    @Test
    @DisplayName("Cache bound to another graph is rejected")
    void testForeignCache() {
        BuildingGraph graph = BuildingFixtureFactory.fourCycle();
        PathCache foreign = new PathCache(BuildingFixtureFactory.fourCycle());
        GraphReducer reducer = new GraphReducer(new AStarPathSearch(HeuristicType.NONE));

        assertThrows(IllegalArgumentException.class, () -> reducer.reduce(graph, new int[]{0, 1}, foreign));
    }

    @Test
    @DisplayName("Weight-matrix construction validates shape, symmetry and sign")
    void testFromWeightsValidation() {
        ReducedGraph ok = ReducedGraph.fromWeights(List.of("P", "Q"), new double[][]{{0, 3}, {3, 0}});
        assertEquals(3.0, ok.sequenceCost(new int[]{0, 1, 0}) / 2);

        assertThrows(IllegalArgumentException.class,
                () -> ReducedGraph.fromWeights(List.of("P", "Q"), new double[][]{{0, 3}, {4, 0}}));
        assertThrows(IllegalArgumentException.class,
                () -> ReducedGraph.fromWeights(List.of("P", "Q"), new double[][]{{0, -1}, {-1, 0}}));
        assertThrows(IllegalArgumentException.class,
                () -> ReducedGraph.fromWeights(List.of("P", "Q"), new double[][]{{1, 3}, {3, 0}}));
        assertThrows(IllegalArgumentException.class,
                () -> ReducedGraph.fromWeights(List.of("P"), new double[][]{{0, 3}, {3, 0}}));
    }
}
