package com.largomodo.folio.geom;

/**
 * A two-dimensional alignment.
 *
 * @param x horizontal component
 * @param y vertical component
 */
public record Align(HAlign x, VAlign y) {

    public static final Align START_TOP = new Align(HAlign.START, VAlign.TOP);
    public static final Align CENTER_BOTTOM = new Align(HAlign.CENTER, VAlign.BOTTOM);

    public Align {
        if (x == null || y == null) {
            throw new IllegalArgumentException("Alignment components cannot be null");
        }
    }

    public Align withX(HAlign newX) {
        return new Align(newX, y);
    }

    public Align withY(VAlign newY) {
        return new Align(x, newY);
    }

    /**
     * Resolves both components against the text direction.
     */
    public Axes<FixedAlignment> resolve(Dir textDir) {
        return new Axes<>(x.fix(textDir), y.fix());
    }
}
