package com.largomodo.folio.region;

import com.largomodo.folio.geom.Abs;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Horizontal space taken from a paragraph's lines by wrap floats.
 * <p>
 * Zones are sorted by their start so that queries can stop at the first zone
 * that begins below the queried offset. All comparisons happen on integer raw
 * units so that line breaks do not flip on rounding noise at zone edges.
 */
public final class ParExclusions {

    private static final ParExclusions NONE = new ParExclusions(List.of());

    private final List<ExclusionZone> zones;

    public ParExclusions(List<ExclusionZone> zones) {
        List<ExclusionZone> sorted = new ArrayList<>(zones);
        sorted.sort(Comparator.comparingLong(ExclusionZone::yStart));
        this.zones = List.copyOf(sorted);
    }

    public static ParExclusions none() {
        return NONE;
    }

    /**
     * Builds the exclusions for a paragraph starting at {@code parY} in region
     * coordinates with an estimated height of {@code parHeight}. Floats that do
     * not overlap the paragraph are dropped, the rest are clamped to it.
     */
    public static ParExclusions fromWrapFloats(double parY, double parHeight, List<WrapFloat> floats) {
        double parBottom = parY + parHeight;
        List<ExclusionZone> zones = new ArrayList<>(floats.size());
        for (WrapFloat wf : floats) {
            if (wf.bottom() <= parY || wf.y() >= parBottom) {
                continue;
            }
            double start = Math.max(wf.y() - parY, 0);
            double end = Math.min(wf.bottom() - parY, parHeight);
            zones.add(ExclusionZone.of(start, end, wf.leftMargin(), wf.rightMargin()));
        }
        return zones.isEmpty() ? NONE : new ParExclusions(zones);
    }

    public List<ExclusionZone> zones() {
        return zones;
    }

    public boolean isEmpty() {
        return zones.isEmpty();
    }

    /**
     * Width left for a line at offset {@code y}: the base width minus the widest
     * exclusion on each side, never negative.
     */
    public double availableWidth(double base, double y) {
        long yRaw = Abs.toRaw(y);
        long left = 0;
        long right = 0;
        for (ExclusionZone zone : zones) {
            if (yRaw < zone.yStart()) {
                break;
            }
            if (yRaw < zone.yEnd()) {
                left = Math.max(left, zone.left());
                right = Math.max(right, zone.right());
            }
        }
        return Math.max(base - Abs.fromRaw(left) - Abs.fromRaw(right), 0);
    }

    /**
     * Where a line at offset {@code y} starts, measured from the paragraph's left edge.
     */
    public double leftOffset(double y) {
        long yRaw = Abs.toRaw(y);
        long left = 0;
        for (ExclusionZone zone : zones) {
            if (yRaw < zone.yStart()) {
                break;
            }
            if (yRaw < zone.yEnd()) {
                left = Math.max(left, zone.left());
            }
        }
        return Abs.fromRaw(left);
    }

    public boolean hasExclusionAt(double y) {
        long yRaw = Abs.toRaw(y);
        return zones.stream().anyMatch(zone -> zone.contains(yRaw));
    }

    /**
     * The nearest offset below {@code y} at which the available width changes.
     */
    public OptionalDouble nextBoundary(double y) {
        long yRaw = Abs.toRaw(y);
        long best = Long.MAX_VALUE;
        for (ExclusionZone zone : zones) {
            if (zone.yStart() > yRaw) {
                best = Math.min(best, zone.yStart());
            }
            if (zone.yEnd() > yRaw) {
                best = Math.min(best, zone.yEnd());
            }
        }
        return best == Long.MAX_VALUE ? OptionalDouble.empty() : OptionalDouble.of(Abs.fromRaw(best));
    }

    /**
     * The narrowest width over the band {@code [y, y + height)}, following the
     * zone boundaries inside it.
     */
    public double minWidthOver(double base, double y, double height) {
        double width = availableWidth(base, y);
        double bottom = y + height;
        OptionalDouble boundary = nextBoundary(y);
        while (boundary.isPresent() && boundary.getAsDouble() < bottom) {
            double at = boundary.getAsDouble();
            width = Math.min(width, availableWidth(base, at));
            boundary = nextBoundary(at);
        }
        return width;
    }

    /**
     * The largest left offset over the band {@code [y, y + height)}.
     */
    public double maxLeftOffsetOver(double y, double height) {
        double offset = leftOffset(y);
        double bottom = y + height;
        OptionalDouble boundary = nextBoundary(y);
        while (boundary.isPresent() && boundary.getAsDouble() < bottom) {
            double at = boundary.getAsDouble();
            offset = Math.max(offset, leftOffset(at));
            boundary = nextBoundary(at);
        }
        return offset;
    }

    @Override
    public String toString() {
        return "ParExclusions" + zones;
    }
}
