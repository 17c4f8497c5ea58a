package org.skyline.routing.heuristic;

import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.graph.BuildingNode;
import org.skyline.routing.graph.GeometryDistance;

import java.util.Objects;

/**
 * Euclidean heuristic provider.
 *
 * <p>Uses straight-line 3D distance between node coordinates, scaled by the calibrated
 * admissible lower-bound cost-per-distance factor.</p>
 */
public final class EuclideanHeuristicProvider implements HeuristicProvider {
    private final BuildingGraph graph;
    private final double lowerBoundCostPerDistance;

    /**
     * Creates a Euclidean heuristic provider.
     *
     * @param graph graph whose node coordinates drive the estimate.
     * @param lowerBoundModel calibrated admissibility model.
     */
    public EuclideanHeuristicProvider(BuildingGraph graph, GeometryLowerBoundModel lowerBoundModel) {
        this.graph = Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(lowerBoundModel, "lowerBoundModel");
        this.lowerBoundCostPerDistance = lowerBoundModel.lowerBoundCostPerDistance();
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.EUCLIDEAN;
    }

    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeId) {
        BuildingNode goal = graph.node(goalNodeId);
        return new BoundEuclideanHeuristic(graph, goal.getX(), goal.getY(), goal.getZ(), lowerBoundCostPerDistance);
    }

    private static final class BoundEuclideanHeuristic implements GoalBoundHeuristic {
        private final BuildingGraph graph;
        private final double goalX;
        private final double goalY;
        private final double goalZ;
        private final double lowerBoundCostPerDistance;

        private BoundEuclideanHeuristic(
                BuildingGraph graph,
                double goalX,
                double goalY,
                double goalZ,
                double lowerBoundCostPerDistance
        ) {
            this.graph = graph;
            this.goalX = goalX;
            this.goalY = goalY;
            this.goalZ = goalZ;
            this.lowerBoundCostPerDistance = lowerBoundCostPerDistance;
        }

        @Override
        public double estimateFromNode(int nodeId) {
            BuildingNode node = graph.node(nodeId);
            double distance = GeometryDistance.euclideanDistance(
                    node.getX(), node.getY(), node.getZ(), goalX, goalY, goalZ
            );
            double estimate = distance * lowerBoundCostPerDistance;
            if (!Double.isFinite(estimate) || estimate < 0.0d) {
                // Preserve admissibility under extreme numeric ranges.
                return 0.0d;
            }
            return estimate;
        }
    }
}
