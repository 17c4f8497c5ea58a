package org.skyline.routing.core;

import lombok.Builder;
import lombok.Value;
import org.skyline.routing.heuristic.HeuristicType;
import org.skyline.routing.path.SearchAlgorithm;
import org.skyline.routing.tour.ExactTourSolver;
import org.skyline.routing.tour.TourMode;

import java.util.Locale;

/**
 * Runtime settings of a {@link RouteOptimizer}.
 *
 * <p>{@link #defaults()} reads {@code skyline.routing.*} system properties; missing, blank or
 * malformed values fall back to the built-in default of that field.</p>
 */
@Value
@Builder(toBuilder = true)
public class OptimizerConfig {
    static final String PROP_HEURISTIC = "skyline.routing.heuristic";
    static final String PROP_ALGORITHM = "skyline.routing.algorithm";
    static final String PROP_TOUR_MODE = "skyline.routing.tourMode";
    static final String PROP_EXACT_MAX_NODES = "skyline.routing.exact.maxNodes";
    static final String PROP_EXACT_PARALLELISM = "skyline.routing.exact.parallelism";
    static final String PROP_REDUCER_PARALLELISM = "skyline.routing.reducer.parallelism";

    /** Heuristic bound by A* searches. */
    @Builder.Default
    HeuristicType heuristicType = HeuristicType.EUCLIDEAN;
    /** Pairwise search algorithm; DIJKSTRA ignores {@link #heuristicType}. */
    @Builder.Default
    SearchAlgorithm algorithm = SearchAlgorithm.A_STAR;
    /** Tour shape used when a request does not name one. */
    @Builder.Default
    TourMode tourMode = TourMode.CLOSED;
    /** Largest anchor count the exact solver accepts, start included. */
    @Builder.Default
    int maxExactNodes = ExactTourSolver.DEFAULT_MAX_ANCHORS;
    /** Worker threads for exact solver shards. */
    @Builder.Default
    int exactParallelism = 1;
    /** Worker threads for pairwise reduction searches. */
    @Builder.Default
    int reducerParallelism = 1;

    /**
     * Loads configuration from system properties.
     */
    public static OptimizerConfig defaults() {
        OptimizerConfig fallback = OptimizerConfig.builder().build();
        return OptimizerConfig.builder()
                .heuristicType(readEnum(PROP_HEURISTIC, HeuristicType.class, fallback.getHeuristicType()))
                .algorithm(readEnum(PROP_ALGORITHM, SearchAlgorithm.class, fallback.getAlgorithm()))
                .tourMode(readEnum(PROP_TOUR_MODE, TourMode.class, fallback.getTourMode()))
                .maxExactNodes(readPositiveInt(PROP_EXACT_MAX_NODES, fallback.getMaxExactNodes()))
                .exactParallelism(readPositiveInt(PROP_EXACT_PARALLELISM, fallback.getExactParallelism()))
                .reducerParallelism(readPositiveInt(PROP_REDUCER_PARALLELISM, fallback.getReducerParallelism()))
                .build();
    }

    private static <E extends Enum<E>> E readEnum(String property, Class<E> type, E fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return fallback;
        }
    }

    private static int readPositiveInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
