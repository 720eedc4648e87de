package org.hourglass.waterfall;

/**
 * Disjoint sets over face labels with path compression and union by size.
 */
final class FaceUnionFind {
    private final int[] parent;
    private final int[] size;

    FaceUnionFind(int maxFaceLabel) {
        parent = new int[maxFaceLabel + 1];
        size = new int[maxFaceLabel + 1];
        for (int i = 0; i <= maxFaceLabel; i++) {
            parent[i] = i;
            size[i] = 1;
        }
    }

    int find(int face) {
        int root = face;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[face] != root) {
            int next = parent[face];
            parent[face] = root;
            face = next;
        }
        return root;
    }

    /**
     * @return false if both faces were already in the same set.
     */
    boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (size[rootA] < size[rootB]) {
            int swap = rootA;
            rootA = rootB;
            rootB = swap;
        }
        parent[rootB] = rootA;
        size[rootA] += size[rootB];
        return true;
    }
}
