package com.largomodo.folio.region;

import com.largomodo.folio.geom.Abs;

/**
 * A rectangular band of a paragraph in which lines are shortened.
 * <p>
 * Coordinates are whole raw units relative to the paragraph top. The vertical
 * range is half-open: {@code yStart} is inside, {@code yEnd} is not.
 */
public record ExclusionZone(long yStart, long yEnd, long left, long right) {

    public static ExclusionZone of(double yStart, double yEnd, double left, double right) {
        return new ExclusionZone(Abs.toRaw(yStart), Abs.toRaw(yEnd), Abs.toRaw(left), Abs.toRaw(right));
    }

    public boolean contains(long y) {
        return y >= yStart && y < yEnd;
    }
}
