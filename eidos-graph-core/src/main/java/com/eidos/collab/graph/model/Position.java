package com.eidos.collab.graph.model;

/**
 * Layout coordinates of a node in the shared graph view.
 */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);

    public double distanceTo(Position other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
