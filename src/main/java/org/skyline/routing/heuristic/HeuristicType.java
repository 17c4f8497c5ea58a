package org.skyline.routing.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables heuristic guidance (pure Dijkstra behavior).</p>
 * <p>{@code EUCLIDEAN} uses the straight-line 3D distance to the goal as an admissible lower bound.</p>
 */
public enum HeuristicType {
    NONE,
    EUCLIDEAN
}
