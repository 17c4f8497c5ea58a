package org.skyline.routing.graph;

import lombok.experimental.UtilityClass;

/**
 * Straight-line distance helpers in building coordinate space.
 */
@UtilityClass
public final class GeometryDistance {

    /**
     * Computes 3D Euclidean distance.
     */
    public static double euclideanDistance(double x1, double y1, double z1, double x2, double y2, double z2) {
        double dx = x2 - x1;
        double dy = y2 - y1;
        double dz = z2 - z1;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * Computes 3D Euclidean distance between two nodes.
     */
    public static double euclideanDistance(BuildingNode a, BuildingNode b) {
        return euclideanDistance(a.getX(), a.getY(), a.getZ(), b.getX(), b.getY(), b.getZ());
    }
}
