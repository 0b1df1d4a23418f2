package com.largomodo.folio.region;

import com.largomodo.folio.geom.Abs;
import com.largomodo.folio.geom.Axes;
import com.largomodo.folio.geom.Size;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalDouble;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * A sequence of regions with the same width and varying heights.
 * <p>
 * The current region is described by {@link #size()} (what is left of it) and
 * {@link #full()} (its original height). Further regions come from the backlog
 * and then, if present, from an endlessly repeating last height.
 * <p>
 * Instances are owned by a single layout call. Children receive a {@link #copy()}
 * and may consume it freely.
 */
public class Regions {

    private Size size;
    private final Axes<Boolean> expand;
    private double full;
    private final Deque<Double> backlog;
    private final Double last;

    /**
     * @param size    the size of the first region
     * @param expand  per-axis expansion for all regions
     * @param backlog heights of the regions following the first one
     * @param last    height repeated forever after the backlog, or null for none
     */
    public Regions(Size size, Axes<Boolean> expand, List<Double> backlog, Double last) {
        if (size == null || expand == null || backlog == null) {
            throw new IllegalArgumentException("Size, expand flags and backlog cannot be null");
        }
        this.size = size;
        this.expand = expand;
        this.full = size.height();
        this.backlog = new ArrayDeque<>(backlog);
        this.last = last;
    }

    private Regions(Regions other, Axes<Boolean> expand) {
        this.size = other.size;
        this.expand = expand;
        this.full = other.full;
        this.backlog = new ArrayDeque<>(other.backlog);
        this.last = other.last;
    }

    /**
     * A single region without follow-ups.
     */
    public static Regions one(Size size, Axes<Boolean> expand) {
        return new Regions(size, expand, List.of(), null);
    }

    public static Regions of(Region region) {
        return one(region.size(), region.expand());
    }

    /**
     * An endless sequence of identical regions.
     */
    public static Regions repeat(Size size, Axes<Boolean> expand) {
        return new Regions(size, expand, List.of(), size.height());
    }

    public Regions copy() {
        return new Regions(this, expand);
    }

    /**
     * A copy with different expansion flags.
     */
    public Regions withExpand(Axes<Boolean> newExpand) {
        return new Regions(this, newExpand);
    }

    public Size size() {
        return size;
    }

    public double width() {
        return size.width();
    }

    /**
     * Remaining height of the current region.
     */
    public double height() {
        return size.height();
    }

    public Axes<Boolean> expand() {
        return expand;
    }

    public double full() {
        return full;
    }

    public List<Double> backlog() {
        return List.copyOf(backlog);
    }

    public OptionalDouble last() {
        return last == null ? OptionalDouble.empty() : OptionalDouble.of(last);
    }

    /**
     * The size relative lengths resolve against: the current width and the
     * original height of the current region.
     */
    public Size base() {
        return new Size(size.width(), full);
    }

    /**
     * Records consumption in the current region.
     */
    public void setHeight(double height) {
        this.size = size.withHeight(height);
    }

    /**
     * Whether the current region is used up and moving on would give more space.
     */
    public boolean isFull() {
        return Abs.fits(0, size.height()) && mayProgress();
    }

    /**
     * Whether there is another region after the current one.
     */
    public boolean mayBreak() {
        return !backlog.isEmpty() || last != null;
    }

    /**
     * Whether advancing to the next region would change the available height.
     */
    public boolean mayProgress() {
        return !backlog.isEmpty() || (last != null && !Abs.approxEq(size.height(), last));
    }

    /**
     * Advances to the next region. Does nothing when there is none.
     */
    public void next() {
        Double height = backlog.pollFirst();
        if (height == null) {
            height = last;
        }
        if (height != null) {
            size = size.withHeight(height);
            full = height;
        }
    }

    /**
     * Applies a size transformation to all regions. The transformation sees the
     * current width for every region.
     */
    public Regions map(UnaryOperator<Size> f) {
        double width = size.width();
        Size mapped = f.apply(size);
        List<Double> mappedBacklog = new ArrayList<>(backlog.size());
        for (Double height : backlog) {
            mappedBacklog.add(f.apply(new Size(width, height)).height());
        }
        Double mappedLast = last == null ? null : f.apply(new Size(width, last)).height();
        Regions result = new Regions(mapped, expand, mappedBacklog, mappedLast);
        result.full = f.apply(new Size(width, full)).height();
        return result;
    }

    /**
     * The sizes of all regions in order: the current one, the backlog, then the
     * last height repeated forever. Infinite when a last height is present.
     */
    public Stream<Size> sizes() {
        double width = size.width();
        Stream<Size> first = Stream.concat(
                Stream.of(size),
                backlog.stream().map(h -> new Size(width, h)));
        if (last == null) {
            return first;
        }
        Size repeated = new Size(width, last);
        return Stream.concat(first, Stream.generate(() -> repeated));
    }

    @Override
    public String toString() {
        return "Regions[size=" + size + ", full=" + full + ", expand=" + expand
                + ", backlog=" + backlog + ", last=" + last + "]";
    }
}
