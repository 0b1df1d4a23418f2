package com.largomodo.folio.layout.inline;

import com.largomodo.folio.region.ParExclusions;

import java.util.List;

/**
 * A paragraph ready for line breaking: the merged text with the advance of
 * every character, its bidi embedding levels and paragraph-wide metrics.
 */
public final class Preparation {

    private final String text;
    private final List<Segment> segments;
    private final ParExclusions exclusions;
    private final ParConfig config;
    /** prefix[i] is the width of text[0, i). */
    private final double[] prefix;
    private final byte[] levels;
    private final double ascent;
    private final double descent;
    private final double spaceWidth;
    private final double hyphenWidth;

    Preparation(Collected collected, ParConfig config, double[] advances, byte[] levels,
                double ascent, double descent, double spaceWidth, double hyphenWidth) {
        this.text = collected.text();
        this.segments = collected.segments();
        this.exclusions = collected.exclusions();
        this.config = config;
        this.levels = levels;
        this.ascent = ascent;
        this.descent = descent;
        this.spaceWidth = spaceWidth;
        this.hyphenWidth = hyphenWidth;
        this.prefix = new double[advances.length + 1];
        for (int i = 0; i < advances.length; i++) {
            prefix[i + 1] = prefix[i] + advances[i];
        }
    }

    public String text() {
        return text;
    }

    public List<Segment> segments() {
        return segments;
    }

    public ParExclusions exclusions() {
        return exclusions;
    }

    public ParConfig config() {
        return config;
    }

    public double ascent() {
        return ascent;
    }

    public double lineHeight() {
        return ascent + descent;
    }

    /**
     * Vertical distance from the top of one line to the top of the next.
     */
    public double linePitch() {
        return lineHeight() + config.leading();
    }

    public double spaceWidth() {
        return spaceWidth;
    }

    public double hyphenWidth() {
        return hyphenWidth;
    }

    public int level(int index) {
        return levels[index];
    }

    /**
     * Summed advances of {@code text[start, end)}.
     */
    public double width(int start, int end) {
        return prefix[end] - prefix[start];
    }

    /**
     * The end of the visible part of a line, without trailing spaces and newlines.
     */
    public int trimEnd(int start, int end) {
        int i = end;
        while (i > start && isTrailing(text.charAt(i - 1))) {
            i--;
        }
        return i;
    }

    private static boolean isTrailing(char c) {
        return c == ' ' || c == '\n' || c == '\u00AD';
    }

    /**
     * Number of spaces in {@code text[start, end)} that justification may adjust.
     */
    public int justifiables(int start, int end) {
        int count = 0;
        for (int i = start; i < end; i++) {
            if (text.charAt(i) == ' ') {
                count++;
            }
        }
        return count;
    }

    /**
     * Builds a line over {@code text[start, end)} with its natural width.
     */
    public Line line(int start, int end, Breakpoint breakpoint) {
        double width = width(start, trimEnd(start, end));
        if (breakpoint == Breakpoint.HYPHEN) {
            width += hyphenWidth;
        }
        return new Line(start, end, breakpoint, width);
    }

    /**
     * The segment containing the given text index.
     */
    public Segment segmentAt(int index) {
        for (Segment segment : segments) {
            if (index >= segment.start() && index < segment.end()) {
                return segment;
            }
        }
        throw new IndexOutOfBoundsException("No segment at index " + index);
    }
}
