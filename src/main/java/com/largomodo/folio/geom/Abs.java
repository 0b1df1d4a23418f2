package com.largomodo.folio.geom;

/**
 * Helpers for absolute lengths in points.
 * <p>
 * Lengths are plain {@code double}s throughout the layout engine. Infinite values
 * mean "unbounded" and are legal for region sizes but never for finished frames.
 */
public final class Abs {

    /** Tolerance for length comparisons. */
    public static final double EPS = 1e-4;

    private Abs() {
    }

    /**
     * Whether {@code needed} fits into {@code available}, with tolerance.
     */
    public static boolean fits(double available, double needed) {
        return available + EPS >= needed;
    }

    public static boolean approxEq(double a, double b) {
        return a == b || Math.abs(a - b) < EPS;
    }

    public static boolean isFinite(double value) {
        return Double.isFinite(value);
    }

    /**
     * Rounds to whole raw units (points) for integer comparisons.
     */
    public static long toRaw(double value) {
        return Math.round(value);
    }

    public static double fromRaw(long raw) {
        return raw;
    }
}
