package org.skyline.routing.heuristic;

import org.skyline.routing.graph.BuildingGraph;

import java.util.Objects;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore turns A* into plain Dijkstra while still
 * honoring bound-check contracts.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    private final int nodeCount;
    private final GoalBoundHeuristic zeroEstimator;

    /**
     * Creates a null heuristic provider for one graph.
     *
     * @param graph graph used for node bound validation.
     */
    public NullHeuristicProvider(BuildingGraph graph) {
        Objects.requireNonNull(graph, "graph");
        int count = graph.nodeCount();
        this.nodeCount = count;
        this.zeroEstimator = nodeId -> {
            checkNode(nodeId, count);
            return 0.0d;
        };
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeId) {
        checkNode(goalNodeId, nodeCount);
        return zeroEstimator;
    }

    private static void checkNode(int nodeId, int nodeCount) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IllegalArgumentException("nodeId out of bounds: " + nodeId + " [0, " + nodeCount + ")");
        }
    }
}
