package org.skyline.routing.graph;

import lombok.Value;

/**
 * Immutable location in a building.
 *
 * <p>{@code z} carries the floor (or any vertical offset) so that straight-line distances stay
 * meaningful across storeys. Critical nodes must be visited by an optimized route; all other
 * nodes are transit-only (hallways, stair landings, corridor junctions).</p>
 */
@Value
public class BuildingNode {
    /** External node id, unique within one graph. */
    String id;
    double x;
    double y;
    double z;
    /** Whether the node must be visited by an optimized route. */
    boolean critical;

    /**
     * Creates a must-visit node.
     */
    public static BuildingNode critical(String id, double x, double y, double z) {
        return new BuildingNode(id, x, y, z, true);
    }

    /**
     * Creates a transit-only node.
     */
    public static BuildingNode transit(String id, double x, double y, double z) {
        return new BuildingNode(id, x, y, z, false);
    }
}
