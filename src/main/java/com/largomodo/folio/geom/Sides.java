package com.largomodo.folio.geom;

/**
 * Resolved lengths on the four sides of a rectangle.
 */
public record Sides(double left, double top, double right, double bottom) {

    public static Sides splat(double value) {
        return new Sides(value, value, value, value);
    }

    /**
     * Horizontal sum as width, vertical sum as height.
     */
    public Size sumByAxis() {
        return new Size(left + right, top + bottom);
    }
}
