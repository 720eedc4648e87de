package org.hourglass.srg;

/**
 * How queued candidate costs are maintained while seed regions grow.
 */
public enum GrowthPolicy {
    /**
     * A queued face always carries the minimum cost over all of its current seed neighbours.
     */
    DYNAMIC,
    /**
     * A queued face keeps the cost assigned when it was first reached (Adams and Bischof).
     * Faster, but the result depends on the order in which seeds are processed.
     */
    STATIC
}
