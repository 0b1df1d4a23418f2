package com.largomodo.folio.geom;

/**
 * A width and a height in points. Components may be infinite.
 *
 * @param width  horizontal extent
 * @param height vertical extent
 */
public record Size(double width, double height) {

    public static final Size ZERO = new Size(0, 0);

    public double get(Axis axis) {
        return axis == Axis.X ? width : height;
    }

    public Size with(Axis axis, double value) {
        return axis == Axis.X ? new Size(value, height) : new Size(width, value);
    }

    public Size withHeight(double value) {
        return new Size(width, value);
    }

    public Size withWidth(double value) {
        return new Size(value, height);
    }

    public Size plus(Size other) {
        return new Size(width + other.width, height + other.height);
    }

    public Size minus(Size other) {
        return new Size(width - other.width, height - other.height);
    }

    public Size min(Size other) {
        return new Size(Math.min(width, other.width), Math.min(height, other.height));
    }

    public Size max(Size other) {
        return new Size(Math.max(width, other.width), Math.max(height, other.height));
    }

    /**
     * Picks per axis: the component of {@code ifTrue} where the mask is set, else of {@code ifFalse}.
     */
    public static Size select(Axes<Boolean> mask, Size ifTrue, Size ifFalse) {
        return new Size(
                mask.x() ? ifTrue.width : ifFalse.width,
                mask.y() ? ifTrue.height : ifFalse.height);
    }

    public Axes<Boolean> finite() {
        return new Axes<>(Double.isFinite(width), Double.isFinite(height));
    }

    public boolean isFinite() {
        return Double.isFinite(width) && Double.isFinite(height);
    }

    public Size flipped() {
        return new Size(height, width);
    }

    public Point toPoint() {
        return new Point(width, height);
    }
}
