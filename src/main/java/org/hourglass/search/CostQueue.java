package org.hourglass.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Indexed min-priority queue keyed by cell label (edge, face or dart index).
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>One entry per label:</strong> {@link #insert(int, double)} and {@link #setCost(int, double)}
 * overwrite an existing entry in O(log n) through an internal position tracking array. Costs may
 * move in either direction.</li>
 * <li><strong>Lazy deletion:</strong> {@link #invalidate(int)} only marks an entry stale. Stale entries
 * are dropped when they surface at the root, so {@link #pop()} and {@link #top()} never return them.</li>
 * <li><strong>Deterministic ties:</strong> equal costs are ordered by ascending label.</li>
 * </ul>
 * </p>
 * <p>The queue knows nothing about topology. A live entry may still refer to an edge or face that
 * has been merged away; callers must re-validate popped labels against the map.</p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe.</p>
 */
public class CostQueue {

    /**
     * One popped or peeked queue entry.
     */
    public record Entry(int label, double cost) {
    }

    // Binary heap of labels (1-based indexing for easier parent/child math)
    private final int[] heap;
    private int heapSize = 0;

    // positions[label] = heapIndex, 0 means not queued
    private final int[] positions;
    private final double[] costs;
    private final boolean[] stale;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    /**
     * Creates a queue able to hold every label in {@code [0, maxLabel]}.
     *
     * @param maxLabel largest label that will ever be inserted. Must be non-negative.
     * @throws IllegalArgumentException if maxLabel is negative.
     */
    public CostQueue(int maxLabel) {
        if (maxLabel < 0) {
            throw new IllegalArgumentException("maxLabel must be non-negative");
        }
        this.heap = new int[maxLabel + 2];
        this.positions = new int[maxLabel + 1];
        this.costs = new double[maxLabel + 1];
        this.stale = new boolean[maxLabel + 1];
    }

    /**
     * Inserts {@code label} with the given cost, or overwrites its current cost.
     *
     * @throws IllegalArgumentException if the label is out of bounds or the cost is not finite.
     */
    public void insert(int label, double cost) {
        checkLabel(label);
        if (!Double.isFinite(cost)) {
            throw new IllegalArgumentException("cost for label " + label + " must be finite, got " + cost);
        }

        int index = positions[label];
        if (index > 0) {
            if (stale[label]) {
                stale[label] = false;
                size++;
            }
            double previous = costs[label];
            costs[label] = cost;
            if (cost < previous) {
                swim(index);
            } else if (cost > previous) {
                sink(index);
            }
            return;
        }

        costs[label] = cost;
        stale[label] = false;
        heapSize++;
        heap[heapSize] = label;
        positions[label] = heapSize;
        size++;
        swim(heapSize);
    }

    /**
     * Mutable-priority update; equivalent to {@link #insert(int, double)}.
     */
    public void setCost(int label, double cost) {
        insert(label, cost);
    }

    /**
     * Marks the entry for {@code label} as deleted without restructuring the heap.
     *
     * @return true if a live entry was invalidated.
     */
    public boolean invalidate(int label) {
        checkLabel(label);
        if (positions[label] == 0 || stale[label]) {
            return false;
        }
        stale[label] = true;
        size--;
        return true;
    }

    /**
     * Returns whether a live entry exists for {@code label}.
     */
    public boolean contains(int label) {
        checkLabel(label);
        return positions[label] > 0 && !stale[label];
    }

    /**
     * Returns the queued cost of {@code label}, or {@link Double#NaN} if it has no live entry.
     */
    public double cost(int label) {
        return contains(label) ? costs[label] : Double.NaN;
    }

    /**
     * Checks if the queue holds no live entry.
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the minimum live entry without removing it.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public Entry top() {
        dropStaleRoots();
        if (heapSize == 0) {
            throw new EmptyQueueException("Queue is empty");
        }
        int label = heap[1];
        return new Entry(label, costs[label]);
    }

    /**
     * Returns the minimum live cost, or {@link Double#POSITIVE_INFINITY} when empty.
     */
    public double topCost() {
        dropStaleRoots();
        return heapSize == 0 ? Double.POSITIVE_INFINITY : costs[heap[1]];
    }

    /**
     * Removes and returns the minimum live entry.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public Entry pop() {
        dropStaleRoots();
        if (heapSize == 0) {
            throw new EmptyQueueException("Queue is empty");
        }
        int label = heap[1];
        removeRoot();
        size--;
        return new Entry(label, costs[label]);
    }

    /**
     * Removes every entry, live or stale.
     */
    public void clear() {
        for (int i = 1; i <= heapSize; i++) {
            int label = heap[i];
            positions[label] = 0;
            stale[label] = false;
        }
        Arrays.fill(heap, 0, heapSize + 1, 0);
        heapSize = 0;
        size = 0;
    }

    @Override
    public String toString() {
        return "CostQueue{size=" + size + ", staleEntries=" + (heapSize - size) + '}';
    }

    // --- Heap Helper Methods ---

    private void checkLabel(int label) {
        if (label < 0 || label >= positions.length) {
            throw new IllegalArgumentException("label " + label + " out of bounds (max: " + (positions.length - 1) + ")");
        }
    }

    private void dropStaleRoots() {
        while (heapSize > 0 && stale[heap[1]]) {
            int label = heap[1];
            removeRoot();
            stale[label] = false;
        }
    }

    private void removeRoot() {
        int root = heap[1];
        int last = heap[heapSize];
        heap[heapSize] = 0;
        heapSize--;
        positions[root] = 0;
        if (heapSize > 0) {
            heap[1] = last;
            positions[last] = 1;
            sink(1);
        }
    }

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= heapSize) {
            int j = 2 * k;
            if (j < heapSize && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    /**
     * Returns whether heap index {@code i} has lower priority than index {@code j}.
     */
    private boolean greater(int i, int j) {
        int a = heap[i];
        int b = heap[j];
        int byCost = Double.compare(costs[a], costs[b]);
        if (byCost != 0) {
            return byCost > 0;
        }
        return a > b;
    }

    private void swap(int i, int j) {
        int a = heap[i];
        int b = heap[j];
        heap[i] = b;
        heap[j] = a;
        positions[a] = j;
        positions[b] = i;
    }
}
