package org.skyline.routing.tour;

/**
 * Tour solving strategy selector.
 *
 * <p>{@code EXACT} enumerates every ordering and is optimal but factorial in anchor count.
 * {@code GREEDY} follows the nearest unvisited anchor and is fast but not necessarily optimal.</p>
 */
public enum TourStrategy {
    EXACT,
    GREEDY
}
