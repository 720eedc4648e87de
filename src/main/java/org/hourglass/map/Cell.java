package org.hourglass.map;

import java.util.Objects;

/**
 * Label of a node, edge or face together with its kind.
 *
 * @param kind cell dimension.
 * @param label cell label within its kind.
 */
public record Cell(CellKind kind, int label) {

    public Cell {
        Objects.requireNonNull(kind, "kind");
        if (label < 0) {
            throw new IllegalArgumentException("label must be non-negative, got " + label);
        }
    }

    public static Cell node(int label) {
        return new Cell(CellKind.NODE, label);
    }

    public static Cell edge(int label) {
        return new Cell(CellKind.EDGE, label);
    }

    public static Cell face(int label) {
        return new Cell(CellKind.FACE, label);
    }

    @Override
    public String toString() {
        return kind.name().charAt(0) + kind.name().substring(1).toLowerCase() + " " + label;
    }
}
