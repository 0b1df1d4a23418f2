package com.largomodo.folio.geom;

/**
 * A length relative to some base, such as the size of the enclosing region.
 *
 * @param ratio  fraction of the base
 * @param length fixed part
 */
public record Rel(double ratio, Length length) {

    public static final Rel ZERO = new Rel(0, Length.ZERO);

    public Rel {
        if (length == null) {
            throw new IllegalArgumentException("Length cannot be null");
        }
    }

    public static Rel pt(double value) {
        return new Rel(0, Length.pt(value));
    }

    public static Rel ratio(double ratio) {
        return new Rel(ratio, Length.ZERO);
    }

    /**
     * Resolves against the base. A zero ratio ignores the base, so infinite bases
     * only matter when a ratio is actually present.
     */
    public double relativeTo(double base, double fontSize) {
        double fixed = length.at(fontSize);
        return ratio == 0 ? fixed : ratio * base + fixed;
    }
}
