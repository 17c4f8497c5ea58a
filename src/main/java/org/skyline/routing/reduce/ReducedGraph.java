package org.skyline.routing.reduce;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Complete undirected graph over the anchor nodes of one request.
 *
 * <p>Anchors are addressed by a dense anchor index {@code [0, size())}; each index also remembers
 * the original graph node id and its external id. Edge weights are shortest-path costs in the
 * original graph, so the matrix is symmetric with a zero diagonal. Immutable.</p>
 */
public final class ReducedGraph {
    private static final int MISSING = -1;

    private final int[] nodeIds;
    private final String[] externalIds;
    private final double[][] weights;
    private final Int2IntOpenHashMap indexByNodeId;

    ReducedGraph(int[] nodeIds, String[] externalIds, double[][] weights) {
        this.nodeIds = nodeIds;
        this.externalIds = externalIds;
        this.weights = weights;
        this.indexByNodeId = new Int2IntOpenHashMap(nodeIds.length);
        this.indexByNodeId.defaultReturnValue(MISSING);
        for (int i = 0; i < nodeIds.length; i++) {
            if (indexByNodeId.put(nodeIds[i], i) != MISSING) {
                throw new IllegalArgumentException("duplicate anchor node id: " + nodeIds[i]);
            }
        }
    }

    /**
     * Creates a reduced graph directly from a weight matrix; anchor {@code i} gets node id {@code i}.
     *
     * @param externalIds anchor labels, also used for deterministic tie-breaking.
     * @param weights symmetric, non-negative, zero-diagonal matrix.
     */
    public static ReducedGraph fromWeights(List<String> externalIds, double[][] weights) {
        Objects.requireNonNull(externalIds, "externalIds");
        Objects.requireNonNull(weights, "weights");
        int size = externalIds.size();
        if (weights.length != size) {
            throw new IllegalArgumentException("weights must be " + size + "x" + size);
        }
        double[][] copy = new double[size][];
        for (int i = 0; i < size; i++) {
            if (weights[i].length != size) {
                throw new IllegalArgumentException("weights must be " + size + "x" + size);
            }
            copy[i] = weights[i].clone();
        }
        for (int i = 0; i < size; i++) {
            if (copy[i][i] != 0.0d) {
                throw new IllegalArgumentException("diagonal weight must be zero at " + i);
            }
            for (int j = i + 1; j < size; j++) {
                double w = copy[i][j];
                if (!Double.isFinite(w) || w < 0.0d || Double.compare(w, copy[j][i]) != 0) {
                    throw new IllegalArgumentException("weight " + i + "," + j + " must be finite, non-negative and symmetric");
                }
            }
        }
        int[] nodeIds = new int[size];
        for (int i = 0; i < size; i++) {
            nodeIds[i] = i;
        }
        return new ReducedGraph(nodeIds, externalIds.toArray(new String[0]), copy);
    }

    /**
     * @return number of anchors.
     */
    public int size() {
        return nodeIds.length;
    }

    /**
     * @return number of undirected edges, always {@code k(k-1)/2}.
     */
    public int edgeCount() {
        int k = nodeIds.length;
        return k * (k - 1) / 2;
    }

    public int nodeId(int anchorIndex) {
        return nodeIds[anchorIndex];
    }

    public String externalId(int anchorIndex) {
        return externalIds[anchorIndex];
    }

    /**
     * Resolves an original graph node id to its anchor index.
     *
     * @throws IllegalArgumentException if the node is not an anchor.
     */
    public int indexOf(int nodeId) {
        int index = indexByNodeId.get(nodeId);
        if (index == MISSING) {
            throw new IllegalArgumentException("node " + nodeId + " is not an anchor of this reduced graph");
        }
        return index;
    }

    public boolean containsNode(int nodeId) {
        return indexByNodeId.containsKey(nodeId);
    }

    /**
     * Weight between two anchors by anchor index.
     */
    public double weight(int i, int j) {
        return weights[i][j];
    }

    /**
     * Sums consecutive weights along a sequence of anchor indices, left to right.
     */
    public double sequenceCost(int[] anchorOrder) {
        double cost = 0.0d;
        for (int i = 1; i < anchorOrder.length; i++) {
            cost += weights[anchorOrder[i - 1]][anchorOrder[i]];
        }
        return cost;
    }

    @Override
    public String toString() {
        return "ReducedGraph" + Arrays.toString(externalIds);
    }
}
