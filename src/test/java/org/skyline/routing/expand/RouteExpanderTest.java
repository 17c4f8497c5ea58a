package org.skyline.routing.expand;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.skyline.routing.cache.PathCache;
import org.skyline.routing.error.InconsistentCacheException;
import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.heuristic.HeuristicType;
import org.skyline.routing.path.AStarPathSearch;
import org.skyline.routing.reduce.GraphReducer;
import org.skyline.routing.reduce.ReducedGraph;
import org.skyline.routing.testutil.BuildingFixtureFactory;
import org.skyline.routing.tour.Tour;
import org.skyline.routing.tour.TourMode;
import org.skyline.routing.tour.TourSolvers;
import org.skyline.routing.tour.TourStrategy;

import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Route Expander Tests")
class RouteExpanderTest {

    @Test
    @DisplayName("Four-cycle tour expands to [A, B, C, D, A] with cost 4")
    void testFourCycle() {
        BuildingGraph graph = BuildingFixtureFactory.fourCycle();
        PathCache cache = new PathCache(graph);
        ReducedGraph reduced = new GraphReducer(new AStarPathSearch(HeuristicType.EUCLIDEAN))
                .reduce(graph, graph.criticalNodeIds(), cache);
        Tour tour = TourSolvers.forStrategy(TourStrategy.EXACT).solve(reduced, 0, TourMode.CLOSED);

        Route route = new RouteExpander().expand(tour, cache);

        assertEquals(List.of("A", "B", "C", "D", "A"), route.externalIds());
        assertEquals(4.0, route.cost());
    }

    @ParameterizedTest
    @EnumSource(TourStrategy.class)
    @DisplayName("Consistency: route cost equals tour cost exactly and every hop is an edge")
    void testConsistency(TourStrategy strategy) {
        for (long seed = 0; seed < 4; seed++) {
            BuildingGraph graph = BuildingFixtureFactory.randomConnected(seed, 45, 60, 6);
            PathCache cache = new PathCache(graph);
            ReducedGraph reduced = new GraphReducer(new AStarPathSearch(HeuristicType.EUCLIDEAN))
                    .reduce(graph, graph.criticalNodeIds(), cache);
            int start = graph.criticalNodeIds()[0];

            for (TourMode mode : TourMode.values()) {
                Tour tour = TourSolvers.forStrategy(strategy).solve(reduced, start, mode);
                Route route = new RouteExpander().expand(tour, cache);

                assertEquals(tour.cost(), route.cost(), "seed " + seed + " " + mode);
                assertEquals(start, route.nodeAt(0));
                for (int i = 1; i < route.length(); i++) {
                    OptionalDouble w = graph.findEdgeWeight(route.nodeAt(i - 1), route.nodeAt(i));
                    assertTrue(w.isPresent(), "gap between " + route.nodeAt(i - 1) + " and " + route.nodeAt(i));
                }
                assertAnchorsInTourOrder(tour, route);
            }
        }
    }

    @Test
    @DisplayName("Single-node tour expands to a single-node route")
    void testSingleNode() {
        BuildingGraph graph = BuildingFixtureFactory.fourCycle();
        PathCache cache = new PathCache(graph);
        ReducedGraph reduced = new GraphReducer(new AStarPathSearch(HeuristicType.NONE))
                .reduce(graph, new int[]{2}, cache);
        Tour tour = TourSolvers.forStrategy(TourStrategy.GREEDY).solve(reduced, 2, TourMode.CLOSED);

        Route route = new RouteExpander().expand(tour, cache);

        assertEquals(List.of("C"), route.externalIds());
        assertEquals(0.0, route.cost());
    }

    @Test
    @DisplayName("Missing cached leg raises InconsistentCacheException")
    void testMissingLeg() {
        BuildingGraph graph = BuildingFixtureFactory.fourCycle();
        PathCache filled = new PathCache(graph);
        ReducedGraph reduced = new GraphReducer(new AStarPathSearch(HeuristicType.EUCLIDEAN))
                .reduce(graph, graph.criticalNodeIds(), filled);
        Tour tour = TourSolvers.forStrategy(TourStrategy.GREEDY).solve(reduced, 0, TourMode.CLOSED);

        InconsistentCacheException ex = assertThrows(
                InconsistentCacheException.class,
                () -> new RouteExpander().expand(tour, new PathCache(graph))
        );
        assertEquals(InconsistentCacheException.REASON, ex.reasonCode());
    }

    private static void assertAnchorsInTourOrder(Tour tour, Route route) {
        int cursor = 0;
        for (int i = 0; i < tour.length(); i++) {
            int anchor = tour.nodeAt(i);
            while (cursor < route.length() && route.nodeAt(cursor) != anchor) {
                cursor++;
            }
            assertTrue(cursor < route.length(), "anchor " + anchor + " missing or out of order");
        }
    }
}
