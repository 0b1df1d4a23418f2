package com.largomodo.folio.geom;

/**
 * Spacing between blocks: either a relative length or a fraction of the
 * space left over in a region. Exactly one component is set.
 */
public record Spacing(Rel rel, Fr fr) {

    public Spacing {
        if ((rel == null) == (fr == null)) {
            throw new IllegalArgumentException("Spacing needs exactly one of a relative length or a fraction");
        }
    }

    public static Spacing of(Rel rel) {
        return new Spacing(rel, null);
    }

    public static Spacing pt(double value) {
        return of(Rel.pt(value));
    }

    public static Spacing of(Fr fr) {
        return new Spacing(null, fr);
    }

    public static Spacing fr(double value) {
        return of(new Fr(value));
    }

    public boolean isFractional() {
        return fr != null;
    }
}
