package com.largomodo.folio.layout.inline;

import com.largomodo.folio.content.Content;
import com.largomodo.folio.content.HElem;
import com.largomodo.folio.content.Pair;
import com.largomodo.folio.content.ParElem;
import com.largomodo.folio.content.TagElem;
import com.largomodo.folio.content.TextElem;
import com.largomodo.folio.geom.Abs;
import com.largomodo.folio.geom.Dir;
import com.largomodo.folio.geom.Fragment;
import com.largomodo.folio.geom.Frame;
import com.largomodo.folio.geom.Point;
import com.largomodo.folio.geom.Size;
import com.largomodo.folio.geom.TextItem;
import com.largomodo.folio.layout.LayoutException;
import com.largomodo.folio.region.ParExclusions;
import com.largomodo.folio.region.Regions;
import com.largomodo.folio.style.JustificationLimits;
import com.largomodo.folio.style.StyleChain;
import com.largomodo.folio.style.TextKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Bidi;
import java.util.ArrayList;
import java.util.List;

/**
 * Lays out paragraphs.
 * <p>
 * Every paragraph passes through the same four stages: collect merges the
 * children into one text buffer, prepare measures it and resolves text
 * direction, the {@link LineBreaker} picks the lines and finalize turns them
 * into frames, one per region.
 */
public class InlineLayouter {

    private static final Logger log = LoggerFactory.getLogger(InlineLayouter.class);

    /** Stands in for horizontal spacing in the text buffer. */
    static final char OBJECT_REPLACEMENT = '\uFFFC';

    private final LineBreaker breaker;
    private final TextMetrics metrics;

    public InlineLayouter(LineBreaker breaker, TextMetrics metrics) {
        this.breaker = breaker;
        this.metrics = metrics;
    }

    public InlineLayouter() {
        this(new DefaultLineBreaker(), FixedPitchMetrics.DEFAULT);
    }

    /**
     * Lays out a paragraph.
     *
     * @param elem       the paragraph
     * @param styles     the styles it is laid out with
     * @param regions    the regions to fill
     * @param situation  where the paragraph sits in its flow, null outside of a flow
     * @param exclusions space taken by wrap floats, null for none
     * @return one frame per region the paragraph occupies
     */
    public Fragment layout(ParElem elem, StyleChain styles, Regions regions,
                           ParSituation situation, ParExclusions exclusions) throws LayoutException {
        ParConfig config = ParConfig.derive(elem, styles, situation);
        Collected collected = collect(elem, styles, exclusions);
        Preparation p = prepare(collected, config);
        List<Line> lines = breaker.breakLines(p, availableWidth(p, regions.width()), config.linebreaks());
        return finalize(p, lines, regions);
    }

    Collected collect(ParElem elem, StyleChain shared, ParExclusions exclusions) throws LayoutException {
        StringBuilder text = new StringBuilder();
        List<Segment> segments = new ArrayList<>();
        for (Pair child : elem.children()) {
            StyleChain styles = shared.chain(child.styles());
            Content content = child.content();
            double fontSize = styles.get(TextKeys.SIZE);
            if (content instanceof TextElem) {
                String value = ((TextElem) content).text().replace("\r\n", "\n").replace('\r', '\n');
                if (value.isEmpty()) {
                    continue;
                }
                int start = text.length();
                text.append(value);
                segments.add(new Segment(start, text.length(), Segment.Kind.TEXT, styles, fontSize, 0));
            } else if (content instanceof HElem) {
                int start = text.length();
                text.append(OBJECT_REPLACEMENT);
                segments.add(new Segment(start, text.length(), Segment.Kind.SPACING, styles, fontSize,
                        ((HElem) content).amount()));
            } else if (!(content instanceof TagElem)) {
                throw new LayoutException(content.span(),
                        content.getClass().getSimpleName() + " is not allowed in a paragraph");
            }
        }
        return new Collected(text.toString(), segments, exclusions == null ? ParExclusions.none() : exclusions);
    }

    Preparation prepare(Collected collected, ParConfig config) {
        String text = collected.text();
        int n = text.length();
        double[] advances = new double[n];
        for (Segment segment : collected.segments()) {
            if (segment.kind() == Segment.Kind.SPACING) {
                advances[segment.start()] = segment.spacing();
                continue;
            }
            for (int i = segment.start(); i < segment.end(); i++) {
                char c = text.charAt(i);
                if (Character.isLowSurrogate(c) && i > segment.start() && Character.isHighSurrogate(text.charAt(i - 1))) {
                    advances[i] = 0;
                } else {
                    advances[i] = metrics.advance(text.codePointAt(i), segment.fontSize());
                }
            }
        }

        byte[] levels = new byte[n];
        if (n > 0) {
            int flags = config.dir() == Dir.RTL ? Bidi.DIRECTION_RIGHT_TO_LEFT : Bidi.DIRECTION_LEFT_TO_RIGHT;
            Bidi bidi = new Bidi(text, flags);
            for (int i = 0; i < n; i++) {
                levels[i] = (byte) bidi.getLevelAt(i);
            }
        }

        double size = config.fontSize();
        return new Preparation(collected, config, advances, levels,
                metrics.ascent(size), metrics.descent(size),
                metrics.advance(' ', size), metrics.advance('-', size));
    }

    /**
     * The width available to a line, narrowed by the wrap floats it overlaps and
     * by the first-line or hanging indent.
     */
    AvailableWidth availableWidth(Preparation p, double base) {
        ParConfig config = p.config();
        ParExclusions exclusions = p.exclusions();
        double lineHeight = p.lineHeight();
        return (y, firstLine) -> exclusions.minWidthOver(base, y, lineHeight)
                - (firstLine ? config.firstLineIndent() : config.hangingIndent());
    }

    Fragment finalize(Preparation p, List<Line> lines, Regions regions) {
        ParConfig config = p.config();
        double width = regions.expand().x() && Double.isFinite(regions.width())
                ? regions.width()
                : naturalWidth(p, lines);

        List<Frame> finished = new ArrayList<>();
        Regions remaining = regions.copy();
        double leading = config.leading();
        List<Frame> pending = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            Frame frame = commit(p, lines.get(i), i, width);
            double height = frame.height();
            while (!Abs.fits(remaining.height(), height) && remaining.mayProgress()) {
                finished.add(stackLines(pending, width, leading));
                pending.clear();
                remaining.next();
            }
            pending.add(frame);
            remaining.setHeight(remaining.height() - height - leading);
        }
        finished.add(stackLines(pending, width, leading));

        log.debug("Laid out paragraph: {} lines in {} regions, width {}", lines.size(), finished.size(), width);
        return new Fragment(finished);
    }

    private static Frame stackLines(List<Frame> lines, double width, double leading) {
        double height = 0;
        for (int i = 0; i < lines.size(); i++) {
            height += lines.get(i).height() + (i > 0 ? leading : 0);
        }
        Frame output = new Frame(new Size(width, height));
        double y = 0;
        for (Frame line : lines) {
            output.pushFrame(Point.withY(y), line);
            y += line.height() + leading;
        }
        return output;
    }

    private static double naturalWidth(Preparation p, List<Line> lines) {
        ParConfig config = p.config();
        double width = 0;
        for (int i = 0; i < lines.size(); i++) {
            double indent = i == 0 ? config.firstLineIndent() : config.hangingIndent();
            double offset = p.exclusions().maxLeftOffsetOver(i * p.linePitch(), p.lineHeight());
            width = Math.max(width, offset + indent + lines.get(i).width());
        }
        return width;
    }

    /**
     * Builds the frame of one line: positions the words in visual order, applies
     * alignment, justification and indents.
     */
    private Frame commit(Preparation p, Line line, int index, double width) {
        ParConfig config = p.config();
        ParExclusions exclusions = p.exclusions();
        double lineHeight = p.lineHeight();
        double y = index * p.linePitch();
        double indent = index == 0 ? config.firstLineIndent() : config.hangingIndent();

        double available = exclusions.minWidthOver(width, y, lineHeight) - indent;
        double leftOffset = exclusions.maxLeftOffsetOver(y, lineHeight);
        int visibleEnd = p.trimEnd(line.start(), line.end());
        int spaces = p.justifiables(line.start(), visibleEnd);

        double remaining = available - line.width();
        double extra = 0;
        boolean justify = config.justify() && line.breakpoint() != Breakpoint.MANDATORY;
        if (spaces > 0 && ((justify && remaining > 0) || remaining < 0)) {
            JustificationLimits limits = config.justificationLimits();
            double maxStretch = p.spaceWidth() * (limits.maxSpacing() - 1);
            double maxShrink = p.spaceWidth() * (1 - limits.minSpacing());
            extra = Math.max(-maxShrink, Math.min(remaining / spaces, maxStretch));
            remaining -= extra * spaces;
        }

        double x = leftOffset + config.align().position(Math.max(remaining, 0));
        if (config.dir() != Dir.RTL) {
            x += indent;
        }

        Frame frame = new Frame(new Size(width, lineHeight));
        List<Piece> pieces = pieces(p, line.start(), visibleEnd);
        if (line.breakpoint() == Breakpoint.HYPHEN && !pieces.isEmpty()) {
            pieces.get(pieces.size() - 1).hyphenated = true;
        }
        reorder(p, pieces);

        for (Piece piece : pieces) {
            double advance = p.width(piece.start, piece.end) + (piece.hyphenated ? p.hyphenWidth() : 0);
            if (piece.space) {
                x += advance + extra * (piece.end - piece.start);
                continue;
            }
            Segment segment = p.segmentAt(piece.start);
            if (segment.kind() == Segment.Kind.TEXT) {
                String text = p.text().substring(piece.start, piece.end).replace("\u00AD", "")
                        + (piece.hyphenated ? "-" : "");
                frame.push(new Point(x, p.ascent()), new TextItem(text, segment.fontSize(), advance));
            }
            x += advance;
        }

        if (config.numberingMarker() != null) {
            frame.push(Point.ZERO, new LineMarkerItem(config.numberingMarker(), index));
        }
        return frame;
    }

    /**
     * A word, a run of spaces or a spacing element, at one bidi level.
     */
    private static final class Piece {
        final int start;
        final int end;
        final boolean space;
        final int level;
        boolean hyphenated;

        Piece(int start, int end, boolean space, int level) {
            this.start = start;
            this.end = end;
            this.space = space;
            this.level = level;
        }
    }

    private static List<Piece> pieces(Preparation p, int start, int end) {
        String text = p.text();
        List<Piece> pieces = new ArrayList<>();
        int i = start;
        while (i < end) {
            int pieceStart = i;
            boolean space = text.charAt(i) == ' ';
            int level = p.level(i);
            Segment segment = p.segmentAt(i);
            i++;
            while (i < end
                    && (text.charAt(i) == ' ') == space
                    && p.level(i) == level
                    && i < segment.end()) {
                i++;
            }
            pieces.add(new Piece(pieceStart, i, space, level));
        }
        return pieces;
    }

    private static void reorder(Preparation p, List<Piece> pieces) {
        boolean mixed = pieces.stream().anyMatch(piece -> (piece.level & 1) == 1);
        if (!mixed) {
            return;
        }
        byte[] levels = new byte[pieces.size()];
        Object[] objects = pieces.toArray();
        for (int i = 0; i < levels.length; i++) {
            levels[i] = (byte) pieces.get(i).level;
        }
        Bidi.reorderVisually(levels, 0, objects, 0, objects.length);
        for (int i = 0; i < objects.length; i++) {
            pieces.set(i, (Piece) objects[i]);
        }
    }
}
