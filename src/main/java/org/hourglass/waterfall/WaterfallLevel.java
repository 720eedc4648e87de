package org.hourglass.waterfall;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Outcome of one waterfall level.
 *
 * @param mstCosts     cost per edge label for MST edges, {@link Double#NaN} for all others.
 * @param minima       edge labels of the regional minima, ascending.
 * @param faceLabels   basin label per face label before the commit (0 for unreached faces).
 * @param merges       number of successful merge transactions.
 */
public record WaterfallLevel(double[] mstCosts, IntList minima, int[] faceLabels, int merges) {

    public boolean isMstEdge(int edge) {
        return edge < mstCosts.length && !Double.isNaN(mstCosts[edge]);
    }

    public int mstEdgeCount() {
        int count = 0;
        for (double cost : mstCosts) {
            if (!Double.isNaN(cost)) {
                count++;
            }
        }
        return count;
    }
}
