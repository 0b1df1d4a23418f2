package com.largomodo.folio.geom;

/**
 * An alignment resolved against a direction: start, center or end of an axis
 * in coordinate space.
 */
public enum FixedAlignment {
    START,
    CENTER,
    END;

    /**
     * Offset of an item aligned this way in free space of the given extent.
     */
    public double position(double extent) {
        return switch (this) {
            case START -> 0;
            case CENTER -> extent / 2;
            case END -> extent;
        };
    }

    public FixedAlignment inv() {
        return switch (this) {
            case START -> END;
            case CENTER -> CENTER;
            case END -> START;
        };
    }

    public static FixedAlignment max(FixedAlignment a, FixedAlignment b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static FixedAlignment min(FixedAlignment a, FixedAlignment b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
