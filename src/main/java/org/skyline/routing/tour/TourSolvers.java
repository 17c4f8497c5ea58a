package org.skyline.routing.tour;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Factory resolving a {@link TourStrategy} to its solver.
 */
@UtilityClass
public class TourSolvers {

    public static TourSolver forStrategy(TourStrategy strategy) {
        return forStrategy(strategy, ExactTourSolver.DEFAULT_MAX_ANCHORS, 1);
    }

    /**
     * @param maxExactAnchors anchor ceiling for {@link TourStrategy#EXACT}.
     * @param exactParallelism shard workers for {@link TourStrategy#EXACT}.
     */
    public static TourSolver forStrategy(TourStrategy strategy, int maxExactAnchors, int exactParallelism) {
        Objects.requireNonNull(strategy, "strategy");
        return switch (strategy) {
            case EXACT -> new ExactTourSolver(maxExactAnchors, exactParallelism);
            case GREEDY -> new GreedyTourSolver();
        };
    }
}
