package com.largomodo.folio.layout.inline;

import com.largomodo.folio.geom.Abs;
import com.largomodo.folio.style.Linebreaks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Breaks lines at spaces, newlines and (when hyphenation is on) soft hyphens.
 * <p>
 * Strategy: {@link Linebreaks#SIMPLE} fills each line greedily. {@link Linebreaks#OPTIMIZED}
 * follows Knuth and Plass: every break opportunity gets the cheapest sequence of
 * lines leading up to it, where a line costs {@code (1 + badness + penalty)^2}
 * and badness grows with the cube of how much its spaces must stretch or shrink.
 */
public class DefaultLineBreaker implements LineBreaker {

    private static final double DEFAULT_HYPH_COST = 135.0;
    private static final double DEFAULT_RUNT_COST = 100.0;
    /** Below this stretch ratio a justified line is overfull. */
    private static final double MIN_RATIO = -1.0;
    private static final double OVERFULL_BADNESS = 1_000_000.0;
    /** Hyphenating closer than this to a word edge costs extra. */
    private static final int HYPHEN_EDGE_LIMIT = 5;

    @FunctionalInterface
    private interface BreakpointConsumer {
        void accept(int end, Breakpoint breakpoint);
    }

    @Override
    public List<Line> breakLines(Preparation p, AvailableWidth width, Linebreaks linebreaks) {
        return switch (linebreaks) {
            case SIMPLE -> breakSimple(p, width);
            case OPTIMIZED -> breakOptimized(p, width);
        };
    }

    private static double widthOfLine(Preparation p, AvailableWidth width, int index) {
        return width.at(index * p.linePitch(), index == 0);
    }

    private List<Line> breakSimple(Preparation p, AvailableWidth width) {
        List<Line> lines = new ArrayList<>();
        int[] start = {0};
        Line[] last = {null};
        int[] lastEnd = {0};

        breakpoints(p, (end, breakpoint) -> {
            Line attempt = p.line(start[0], end, breakpoint);

            // Commit the last attempt that fit and start over from its end.
            if (!Abs.fits(widthOfLine(p, width, lines.size()), attempt.width()) && last[0] != null) {
                lines.add(last[0]);
                start[0] = lastEnd[0];
                last[0] = null;
                attempt = p.line(start[0], end, breakpoint);
            }

            if (breakpoint == Breakpoint.MANDATORY
                    || !Abs.fits(widthOfLine(p, width, lines.size()), attempt.width())) {
                lines.add(attempt);
                start[0] = end;
                last[0] = null;
            } else {
                last[0] = attempt;
                lastEnd[0] = end;
            }
        });

        if (last[0] != null) {
            lines.add(last[0]);
        }
        return lines;
    }

    private static final class Entry {
        final int pred;
        final double total;
        final Line line;
        final int end;
        final int count;

        Entry(int pred, double total, Line line, int end, int count) {
            this.pred = pred;
            this.total = total;
            this.line = line;
            this.end = end;
            this.count = count;
        }
    }

    private List<Line> breakOptimized(Preparation p, AvailableWidth width) {
        ParConfig config = p.config();
        double hyphCost = DEFAULT_HYPH_COST * config.costs().hyphenation();
        double runtCost = DEFAULT_RUNT_COST * config.costs().runt();
        double minRatio = config.justify() ? MIN_RATIO : 0.0;

        List<Entry> table = new ArrayList<>();
        table.add(new Entry(0, 0.0, null, 0, 0));
        int[] active = {0};
        int[] prevEnd = {0};

        breakpoints(p, (end, breakpoint) -> {
            Entry best = null;
            for (int i = active[0]; i < table.size(); i++) {
                Entry pred = table.get(i);
                int start = pred.end;
                boolean unbreakable = prevEnd[0] == start;
                Line attempt = p.line(start, end, breakpoint);
                double available = widthOfLine(p, width, pred.count);
                double ratio = ratio(p, available, attempt);
                boolean justified = config.justify() && breakpoint != Breakpoint.MANDATORY;

                // Lines from this start only get longer from here on.
                if (ratio < minRatio && active[0] == i) {
                    active[0]++;
                }

                double badness;
                if (ratio < minRatio) {
                    badness = OVERFULL_BADNESS;
                } else if (breakpoint != Breakpoint.MANDATORY || justified || ratio < 0) {
                    badness = 100.0 * Math.pow(Math.abs(ratio), 3);
                } else {
                    badness = 0.0;
                }

                double penalty = 0.0;
                if (unbreakable && breakpoint == Breakpoint.MANDATORY) {
                    penalty += runtCost;
                }
                if (breakpoint == Breakpoint.HYPHEN) {
                    int steps = hyphenEdgeSteps(p.text(), end);
                    penalty += (1.0 + 0.15 * steps) * hyphCost;
                }
                if (pred.line != null && pred.line.breakpoint() == Breakpoint.HYPHEN
                        && breakpoint == Breakpoint.HYPHEN) {
                    penalty += hyphCost;
                }

                double cost = Math.pow(1.0 + badness + penalty, 2);
                double total = pred.total + cost;
                if (best == null || best.total >= total) {
                    best = new Entry(i, total, attempt, end, pred.count + 1);
                }
            }

            // No line can span a mandatory break.
            if (breakpoint == Breakpoint.MANDATORY) {
                active[0] = table.size();
            }
            if (best != null) {
                table.add(best);
            }
            prevEnd[0] = end;
        });

        List<Line> lines = new ArrayList<>();
        int idx = table.size() - 1;
        while (idx != 0) {
            Entry entry = table.get(idx);
            lines.add(entry.line);
            idx = entry.pred;
        }
        Collections.reverse(lines);
        return lines;
    }

    /**
     * How much the spaces of a line must stretch (positive) or shrink (negative)
     * to fill the available width, relative to what they can do naturally.
     */
    private static double ratio(Preparation p, double available, Line attempt) {
        if (Double.isInfinite(available)) {
            return 0.0;
        }
        ParConfig config = p.config();
        int justifiables = p.justifiables(attempt.start(), p.trimEnd(attempt.start(), attempt.end()));
        double stretchability = justifiables * p.spaceWidth() * (config.justificationLimits().maxSpacing() - 1);
        double shrinkability = justifiables * p.spaceWidth() * (1 - config.justificationLimits().minSpacing());

        double delta = available - attempt.width();
        if (Abs.approxEq(delta, 0)) {
            delta = 0;
        }
        double adjustability = delta >= 0 ? stretchability : shrinkability;
        double ratio = delta / Math.max(adjustability, 0);
        if (Double.isNaN(ratio)) {
            ratio = 0.0;
        }
        if (ratio > 1.0) {
            // Beyond the natural stretch, measure in half-ems per space.
            double extraStretch = (delta - adjustability) / Math.max(justifiables, 1);
            ratio = 1.0 + extraStretch / (config.fontSize() / 2.0);
        }
        return Math.max(MIN_RATIO - 1.0, Math.min(ratio, 10.0));
    }

    private static int hyphenEdgeSteps(String text, int end) {
        int left = 0;
        for (int i = end - 2; i >= 0 && Character.isLetter(text.charAt(i)); i--) {
            left++;
        }
        int right = 0;
        for (int i = end; i < text.length() && Character.isLetter(text.charAt(i)); i++) {
            right++;
        }
        return Math.max(HYPHEN_EDGE_LIMIT - left, 0) + Math.max(HYPHEN_EDGE_LIMIT - right, 0);
    }

    /**
     * Calls {@code f} for every break opportunity with the index after it.
     * The end of the text is always a mandatory break.
     */
    private static void breakpoints(Preparation p, BreakpointConsumer f) {
        String text = p.text();
        int n = text.length();
        boolean hyphenate = p.config().hyphenate().orElse(false);
        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            boolean hasNext = i + 1 < n;
            if (c == '\n') {
                f.accept(i + 1, Breakpoint.MANDATORY);
            } else if (c == ' ' && hasNext && text.charAt(i + 1) != ' ' && text.charAt(i + 1) != '\n') {
                f.accept(i + 1, Breakpoint.NORMAL);
            } else if (c == '\u00AD' && hyphenate && hasNext) {
                f.accept(i + 1, Breakpoint.HYPHEN);
            }
        }
        if (n == 0 || text.charAt(n - 1) != '\n') {
            f.accept(n, Breakpoint.MANDATORY);
        }
    }
}
