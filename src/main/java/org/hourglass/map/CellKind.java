package org.hourglass.map;

/**
 * Dimension of a map cell.
 */
public enum CellKind {
    NODE,
    EDGE,
    FACE
}
