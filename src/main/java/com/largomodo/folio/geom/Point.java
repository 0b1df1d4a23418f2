package com.largomodo.folio.geom;

/**
 * A position in a frame, measured from its top-left corner.
 */
public record Point(double x, double y) {

    public static final Point ZERO = new Point(0, 0);

    public static Point withX(double x) {
        return new Point(x, 0);
    }

    public static Point withY(double y) {
        return new Point(0, y);
    }

    public Point plus(Point other) {
        return new Point(x + other.x, y + other.y);
    }

    public double get(Axis axis) {
        return axis == Axis.X ? x : y;
    }
}
