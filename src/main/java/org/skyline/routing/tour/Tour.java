package org.skyline.routing.tour;

import org.skyline.routing.reduce.ReducedGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered sequence of anchors produced by a {@link TourSolver}.
 *
 * <p>Node ids are original graph ids. A closed tour lists its start node again at the end, so
 * every adjacent pair is one leg. {@link #cost()} is the left-to-right sum of reduced-graph
 * weights over those legs.</p>
 */
public final class Tour {
    private final int[] nodeIds;
    private final List<String> externalIds;
    private final double cost;
    private final TourMode mode;

    private Tour(int[] nodeIds, List<String> externalIds, double cost, TourMode mode) {
        this.nodeIds = nodeIds;
        this.externalIds = externalIds;
        this.cost = cost;
        this.mode = mode;
    }

    /**
     * Builds a tour from an anchor order that starts with the start anchor, appending the
     * return leg for closed tours when more than one anchor exists.
     */
    static Tour fromAnchorOrder(ReducedGraph graph, int[] anchorOrder, TourMode mode) {
        int[] order = anchorOrder;
        if (mode == TourMode.CLOSED && anchorOrder.length > 1) {
            order = Arrays.copyOf(anchorOrder, anchorOrder.length + 1);
            order[anchorOrder.length] = anchorOrder[0];
        }
        int[] nodeIds = new int[order.length];
        List<String> externalIds = new ArrayList<>(order.length);
        for (int i = 0; i < order.length; i++) {
            nodeIds[i] = graph.nodeId(order[i]);
            externalIds.add(graph.externalId(order[i]));
        }
        return new Tour(nodeIds, List.copyOf(externalIds), graph.sequenceCost(order), mode);
    }

    public int[] nodeIds() {
        return nodeIds.clone();
    }

    public int nodeAt(int index) {
        return nodeIds[index];
    }

    /**
     * @return number of entries, including the repeated start of a closed tour.
     */
    public int length() {
        return nodeIds.length;
    }

    public int start() {
        return nodeIds[0];
    }

    public List<String> externalIds() {
        return externalIds;
    }

    public double cost() {
        return cost;
    }

    public TourMode mode() {
        return mode;
    }

    @Override
    public String toString() {
        return "Tour" + externalIds + " cost=" + cost + " mode=" + mode;
    }
}
