package org.hourglass.cost;

import org.hourglass.map.Dart;

import java.util.Objects;

/**
 * Cost of merging or traversing across one dart.
 * <p>
 * A non-finite result (conventionally {@link #NEVER}) means the dart must never be used. Costs
 * may be asymmetric: {@code +e} and {@code -e} are evaluated independently.
 * </p>
 */
@FunctionalInterface
public interface DartCostFunction {

    double NEVER = Double.POSITIVE_INFINITY;

    double cost(Dart dart);

    static DartCostFunction constant(double cost) {
        return dart -> cost;
    }

    /**
     * Looks costs up by edge label; labels outside the array cost {@link #NEVER}.
     * The array is not copied, so later writes are visible.
     */
    static DartCostFunction byEdgeLabel(double[] costs) {
        Objects.requireNonNull(costs, "costs");
        return dart -> {
            int edge = dart.edgeLabel();
            return edge < costs.length ? costs[edge] : NEVER;
        };
    }

    /**
     * Returns whether {@code cost} permits the operation.
     */
    static boolean isAllowed(double cost) {
        return Double.isFinite(cost);
    }
}
