package org.skyline.routing.heuristic;

import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.graph.GeometryDistance;

import java.util.Objects;

/**
 * Admissibility calibration for the Euclidean heuristic.
 *
 * <p>Computes {@code cost_per_distance = min(1, min over edges of weight / straight_line_length)}.
 * When every edge weight is at least its physical length the factor is exactly {@code 1} and the
 * heuristic is the plain straight-line distance. Cheaper-than-geometry edges (escalators, manual
 * weights) scale the estimate down so it never overestimates and stays consistent.</p>
 */
public final class GeometryLowerBoundModel {
    public static final String REASON_INVALID_EDGE_RATIO = "HEURISTIC_INVALID_EDGE_RATIO";

    private static final double MAX_COST_PER_DISTANCE = 1.0d;

    private final double lowerBoundCostPerDistance;

    private GeometryLowerBoundModel(double lowerBoundCostPerDistance) {
        this.lowerBoundCostPerDistance = lowerBoundCostPerDistance;
    }

    public double lowerBoundCostPerDistance() {
        return lowerBoundCostPerDistance;
    }

    /**
     * Calibrates the lower-bound factor over all edges of a graph.
     *
     * <p>Zero-length edges (coincident endpoints) carry no geometric information and are skipped.
     * A graph without positive-length edges calibrates to {@code 1}: reachable nodes are then all
     * coincident, so every estimate is zero anyway.</p>
     */
    public static GeometryLowerBoundModel calibrateEuclidean(BuildingGraph graph) {
        Objects.requireNonNull(graph, "graph");
        double bestRatio = MAX_COST_PER_DISTANCE;
        for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
            double length = GeometryDistance.euclideanDistance(
                    graph.node(graph.edgeFrom(edgeId)),
                    graph.node(graph.edgeTo(edgeId))
            );
            if (length == 0.0d) {
                continue;
            }
            double ratio = graph.edgeWeight(edgeId) / length;
            if (!Double.isFinite(ratio) || ratio < 0.0d) {
                throw new HeuristicConfigurationException(
                        REASON_INVALID_EDGE_RATIO,
                        "edge " + edgeId + " has invalid lower-bound ratio: " + ratio
                );
            }
            if (ratio < bestRatio) {
                bestRatio = ratio;
            }
        }
        return new GeometryLowerBoundModel(bestRatio);
    }

    /**
     * Creates a model with an explicit factor in {@code [0, 1]}.
     */
    public static GeometryLowerBoundModel of(double lowerBoundCostPerDistance) {
        if (!Double.isFinite(lowerBoundCostPerDistance)
                || lowerBoundCostPerDistance < 0.0d
                || lowerBoundCostPerDistance > MAX_COST_PER_DISTANCE) {
            throw new IllegalArgumentException("lowerBoundCostPerDistance must be in [0, 1]: " + lowerBoundCostPerDistance);
        }
        return new GeometryLowerBoundModel(lowerBoundCostPerDistance);
    }
}
