package org.skyline.routing.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.skyline.routing.heuristic.HeuristicType;
import org.skyline.routing.path.SearchAlgorithm;
import org.skyline.routing.tour.TourMode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OptimizerConfigTest {
    private static final List<String> PROPERTIES = List.of(
            OptimizerConfig.PROP_HEURISTIC,
            OptimizerConfig.PROP_ALGORITHM,
            OptimizerConfig.PROP_TOUR_MODE,
            OptimizerConfig.PROP_EXACT_MAX_NODES,
            OptimizerConfig.PROP_EXACT_PARALLELISM,
            OptimizerConfig.PROP_REDUCER_PARALLELISM
    );

    @AfterEach
    void clearProperties() {
        PROPERTIES.forEach(System::clearProperty);
    }

    @Test
    @DisplayName("Built-in defaults without system properties")
    void testBuiltInDefaults() {
        OptimizerConfig config = OptimizerConfig.defaults();

        assertEquals(HeuristicType.EUCLIDEAN, config.getHeuristicType());
        assertEquals(SearchAlgorithm.A_STAR, config.getAlgorithm());
        assertEquals(TourMode.CLOSED, config.getTourMode());
        assertEquals(10, config.getMaxExactNodes());
        assertEquals(1, config.getExactParallelism());
        assertEquals(1, config.getReducerParallelism());
        assertEquals(OptimizerConfig.builder().build(), config);
    }

    @Test
    @DisplayName("System properties override defaults, case-insensitively for enums")
    void testPropertyOverrides() {
        System.setProperty(OptimizerConfig.PROP_HEURISTIC, "none");
        System.setProperty(OptimizerConfig.PROP_ALGORITHM, "DIJKSTRA");
        System.setProperty(OptimizerConfig.PROP_TOUR_MODE, " open ");
        System.setProperty(OptimizerConfig.PROP_EXACT_MAX_NODES, "8");
        System.setProperty(OptimizerConfig.PROP_EXACT_PARALLELISM, "4");
        System.setProperty(OptimizerConfig.PROP_REDUCER_PARALLELISM, "2");

        OptimizerConfig config = OptimizerConfig.defaults();

        assertEquals(HeuristicType.NONE, config.getHeuristicType());
        assertEquals(SearchAlgorithm.DIJKSTRA, config.getAlgorithm());
        assertEquals(TourMode.OPEN, config.getTourMode());
        assertEquals(8, config.getMaxExactNodes());
        assertEquals(4, config.getExactParallelism());
        assertEquals(2, config.getReducerParallelism());
    }

    @Test
    @DisplayName("Malformed or non-positive values fall back to defaults")
    void testMalformedValues() {
        System.setProperty(OptimizerConfig.PROP_HEURISTIC, "LANDMARK");
        System.setProperty(OptimizerConfig.PROP_EXACT_MAX_NODES, "ten");
        System.setProperty(OptimizerConfig.PROP_EXACT_PARALLELISM, "0");
        System.setProperty(OptimizerConfig.PROP_REDUCER_PARALLELISM, "-3");

        OptimizerConfig config = OptimizerConfig.defaults();

        assertEquals(HeuristicType.EUCLIDEAN, config.getHeuristicType());
        assertEquals(10, config.getMaxExactNodes());
        assertEquals(1, config.getExactParallelism());
        assertEquals(1, config.getReducerParallelism());
    }

    @Test
    @DisplayName("Optimizer without explicit config loads defaults")
    void testOptimizerFallsBackToDefaults() {
        System.setProperty(OptimizerConfig.PROP_TOUR_MODE, "OPEN");
        RouteOptimizer optimizer = RouteOptimizer.builder().build();
        assertEquals(TourMode.OPEN, optimizer.config().getTourMode());
    }
}
