package org.skyline.routing.expand;

import java.util.Arrays;
import java.util.List;

/**
 * Concrete walk through the original graph that visits every tour anchor.
 *
 * <p>Consecutive node ids are joined by original graph edges. Intermediate transit nodes may
 * repeat; anchors appear in tour order.</p>
 */
public final class Route {
    private final int[] nodeIds;
    private final List<String> externalIds;
    private final double cost;

    Route(int[] nodeIds, List<String> externalIds, double cost) {
        this.nodeIds = nodeIds;
        this.externalIds = externalIds;
        this.cost = cost;
    }

    public int[] nodeIds() {
        return nodeIds.clone();
    }

    public int nodeAt(int index) {
        return nodeIds[index];
    }

    public int length() {
        return nodeIds.length;
    }

    public List<String> externalIds() {
        return externalIds;
    }

    public double cost() {
        return cost;
    }

    @Override
    public String toString() {
        return "Route" + Arrays.toString(nodeIds) + " cost=" + cost;
    }
}
