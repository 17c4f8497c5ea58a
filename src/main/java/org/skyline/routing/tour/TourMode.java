package org.skyline.routing.tour;

/**
 * Shape of a tour.
 *
 * <p>{@code CLOSED} tours return to the start node (the start appears first and last);
 * {@code OPEN} tours end at the last visited anchor.</p>
 */
public enum TourMode {
    CLOSED,
    OPEN
}
