package org.skyline.routing.path;

/**
 * Shortest-path search strategy.
 *
 * <p>{@code DIJKSTRA} always runs without heuristic guidance; {@code A_STAR} uses the configured
 * heuristic.</p>
 */
public enum SearchAlgorithm {
    DIJKSTRA,
    A_STAR
}
