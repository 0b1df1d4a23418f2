package com.largomodo.folio.geom;

/**
 * A fractional unit of remaining space.
 *
 * @param value the non-negative weight
 */
public record Fr(double value) {

    public static final Fr ZERO = new Fr(0);

    public Fr {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Fraction must be finite and non-negative: " + value);
        }
    }

    public static Fr one() {
        return new Fr(1);
    }

    public Fr plus(Fr other) {
        return new Fr(value + other.value);
    }

    public boolean isZero() {
        return value == 0;
    }

    /**
     * This fraction's share of {@code remaining}, given the sum of all fractions.
     * Unbounded or overfilled space has nothing to share.
     */
    public double share(Fr total, double remaining) {
        if (value == 0 || total.value == 0 || !Double.isFinite(remaining)) {
            return 0;
        }
        double share = value / total.value * remaining;
        return Double.isFinite(share) ? Math.max(share, 0) : 0;
    }
}
