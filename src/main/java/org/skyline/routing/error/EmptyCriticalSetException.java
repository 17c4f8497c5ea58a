package org.skyline.routing.error;

/**
 * Thrown when a route is requested over a graph (or request) with no critical nodes.
 */
public final class EmptyCriticalSetException extends PathfinderException {
    public static final String REASON = "TOUR_EMPTY_CRITICAL_SET";

    public EmptyCriticalSetException(String message) {
        super(REASON, message);
    }
}
