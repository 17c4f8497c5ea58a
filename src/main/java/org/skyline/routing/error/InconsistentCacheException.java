package org.skyline.routing.error;

/**
 * Thrown when route expansion needs a path that the request cache never stored.
 *
 * <p>Every tour leg was cached while building the reduced graph, so this always indicates a
 * pipeline bug rather than bad input.</p>
 */
public final class InconsistentCacheException extends PathfinderException {
    public static final String REASON = "EXPAND_INCONSISTENT_CACHE";

    public InconsistentCacheException(String message) {
        super(REASON, message);
    }
}
