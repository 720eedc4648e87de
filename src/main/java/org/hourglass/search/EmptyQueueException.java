package org.hourglass.search;

/**
 * Thrown when attempting to pop or peek an empty {@link CostQueue}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
