package org.skyline.routing.path;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.skyline.routing.graph.BuildingGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable walk through the original graph.
 *
 * <p>Consecutive nodes are joined by graph edges and {@link #cost()} is the sum of those edge
 * weights. A path walked backwards is the same path with the same cost.</p>
 */
public final class Path {
    private final int[] nodeIds;
    private final double cost;

    private Path(int[] nodeIds, double cost) {
        this.nodeIds = nodeIds;
        this.cost = cost;
    }

    /**
     * Creates a path from internal node ids.
     *
     * @param nodeIds at least one node id, source first.
     * @param cost finite, non-negative total cost.
     */
    public static Path of(int[] nodeIds, double cost) {
        if (nodeIds == null || nodeIds.length == 0) {
            throw new IllegalArgumentException("path must contain at least one node");
        }
        if (!Double.isFinite(cost) || cost < 0.0d) {
            throw new IllegalArgumentException("path cost must be finite and non-negative: " + cost);
        }
        return new Path(nodeIds.clone(), cost);
    }

    static Path of(IntArrayList nodeIds, double cost) {
        return new Path(nodeIds.toIntArray(), cost);
    }

    /**
     * Zero-cost path consisting of one node.
     */
    public static Path single(int nodeId) {
        return new Path(new int[]{nodeId}, 0.0d);
    }

    public int source() {
        return nodeIds[0];
    }

    public int destination() {
        return nodeIds[nodeIds.length - 1];
    }

    public double cost() {
        return cost;
    }

    /**
     * @return number of nodes on the path.
     */
    public int length() {
        return nodeIds.length;
    }

    public int nodeAt(int index) {
        return nodeIds[index];
    }

    public int[] nodeIds() {
        return nodeIds.clone();
    }

    /**
     * Returns the same path walked from destination to source.
     */
    public Path reversed() {
        int[] reversed = new int[nodeIds.length];
        for (int i = 0; i < nodeIds.length; i++) {
            reversed[i] = nodeIds[nodeIds.length - 1 - i];
        }
        return new Path(reversed, cost);
    }

    /**
     * Maps the node sequence to external ids.
     */
    public List<String> externalIds(BuildingGraph graph) {
        List<String> ids = new ArrayList<>(nodeIds.length);
        for (int nodeId : nodeIds) {
            ids.add(graph.externalId(nodeId));
        }
        return List.copyOf(ids);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Path)) return false;
        Path other = (Path) o;
        return Double.compare(cost, other.cost) == 0 && Arrays.equals(nodeIds, other.nodeIds);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(nodeIds) + Double.hashCode(cost);
    }

    @Override
    public String toString() {
        return "Path" + Arrays.toString(nodeIds) + " cost=" + cost;
    }
}
