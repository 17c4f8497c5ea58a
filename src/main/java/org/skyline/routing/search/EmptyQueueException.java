package org.skyline.routing.search;

/**
 * Thrown when attempting to extract from an empty {@link FrontierQueue}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
