package com.largomodo.folio.layout.page;

import com.largomodo.folio.content.Content;
import com.largomodo.folio.content.CounterDisplayElem;
import com.largomodo.folio.content.Pair;
import com.largomodo.folio.geom.Abs;
import com.largomodo.folio.geom.Align;
import com.largomodo.folio.geom.Axes;
import com.largomodo.folio.geom.Dir;
import com.largomodo.folio.geom.Fragment;
import com.largomodo.folio.geom.Frame;
import com.largomodo.folio.geom.HAlign;
import com.largomodo.folio.geom.Point;
import com.largomodo.folio.geom.Rel;
import com.largomodo.folio.geom.Sides;
import com.largomodo.folio.geom.Size;
import com.largomodo.folio.geom.Span;
import com.largomodo.folio.geom.VAlign;
import com.largomodo.folio.layout.BlockLayouter;
import com.largomodo.folio.layout.ContentLayouter;
import com.largomodo.folio.layout.LayoutException;
import com.largomodo.folio.layout.MarginalOverflowException;
import com.largomodo.folio.layout.flow.FlowLayouter;
import com.largomodo.folio.region.Region;
import com.largomodo.folio.region.Regions;
import com.largomodo.folio.style.LayoutKeys;
import com.largomodo.folio.style.Numbering;
import com.largomodo.folio.style.Smart;
import com.largomodo.folio.style.Style;
import com.largomodo.folio.style.StyleChain;
import com.largomodo.folio.style.TextKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out a run of children that share one page configuration into pages.
 * <p>
 * The page styles are determined once for the whole run. The children flow
 * into as many copies of the page's content area as they need, and every
 * resulting body frame gets its own header, footer, background and foreground.
 */
public class PageRunLayouter {

    private static final Logger log = LoggerFactory.getLogger(PageRunLayouter.class);

    /** Automatic margins as a share of the page's shorter side. */
    public static final double DEFAULT_MARGIN_RATIO = 2.5 / 21.0;

    private final FlowLayouter flow;
    private final BlockLayouter blocks;

    public PageRunLayouter(ContentLayouter layouter) {
        this(layouter.flow(), layouter);
    }

    /**
     * @param flow   lays out the body
     * @param blocks lays out marginals
     */
    public PageRunLayouter(FlowLayouter flow, BlockLayouter blocks) {
        this.flow = flow;
        this.blocks = blocks;
    }

    /**
     * Lays out the children into pages.
     *
     * @param children the run's content with absolute styles
     * @param initial  styles active at the page break that started the run
     * @return at least one page
     * @throws LayoutException if the body or a marginal cannot be laid out
     */
    public List<LayoutedPage> layoutPageRun(List<Pair> children, StyleChain initial) throws LayoutException {
        StyleChain styles = PageStyles.determine(children, initial);
        Span span = children.isEmpty() ? Span.DETACHED : children.get(0).content().span();

        double width = styles.get(PageKeys.WIDTH);
        double height = styles.get(PageKeys.HEIGHT);
        Size size = new Size(width, height);
        if (styles.get(PageKeys.FLIPPED)) {
            size = size.flipped();
        }

        double min = Math.min(size.width(), size.height());
        if (!Double.isFinite(min)) {
            min = Paper.A4.width();
        }
        double fallback = DEFAULT_MARGIN_RATIO * min;
        double fontSize = styles.get(TextKeys.SIZE);

        Margin margin = styles.get(PageKeys.MARGIN);
        boolean twoSided = margin.twoSided() != null && margin.twoSided();
        Sides sides = new Sides(
                resolveSide(margin.left(), fallback, size.width(), fontSize),
                resolveSide(margin.top(), fallback, size.height(), fontSize),
                resolveSide(margin.right(), fallback, size.width(), fontSize),
                resolveSide(margin.bottom(), fallback, size.height(), fontSize));

        Size area = size.minus(sides.sumByAxis());

        int columns = styles.get(PageKeys.COLUMNS);
        if (columns < 1) {
            throw new LayoutException(span, "A page needs at least one column, got " + columns);
        }
        if (!Double.isFinite(area.width())) {
            columns = 1;
        }
        double gutter = styles.get(PageKeys.COLUMN_GUTTER).relativeTo(area.width(), fontSize);

        double headerAscent = styles.get(PageKeys.HEADER_ASCENT).relativeTo(sides.top(), fontSize);
        double footerDescent = styles.get(PageKeys.FOOTER_DESCENT).relativeTo(sides.bottom(), fontSize);

        Dir dir = styles.get(TextKeys.DIR);
        Binding binding = styles.get(PageKeys.BINDING).orAuto(dir == Dir.LTR ? Binding.LEFT : Binding.RIGHT);
        Smart<String> fill = styles.get(PageKeys.FILL);
        Numbering numbering = styles.get(PageKeys.NUMBERING);
        Align numberAlign = styles.get(PageKeys.NUMBER_ALIGN);

        Pair numberingMarginal = null;
        if (numbering != null) {
            CounterDisplayElem counter = new CounterDisplayElem(numbering, numbering.pieces() >= 2, span);
            numberingMarginal = new Pair(counter,
                    styles.chain(Style.direct(LayoutKeys.ALIGN, styles.get(LayoutKeys.ALIGN).withX(numberAlign.x()))));
        }

        Pair header;
        Pair footer;
        if (numberAlign.y() == VAlign.TOP) {
            header = marginal(styles.get(PageKeys.HEADER), numberingMarginal, styles);
            footer = marginal(styles.get(PageKeys.FOOTER), null, styles);
        } else {
            header = marginal(styles.get(PageKeys.HEADER), null, styles);
            footer = marginal(styles.get(PageKeys.FOOTER), numberingMarginal, styles);
        }
        Pair background = content(styles.get(PageKeys.BACKGROUND), styles);
        Pair foreground = content(styles.get(PageKeys.FOREGROUND), styles);

        log.debug("Page run of {} children: size {}, margins {}, area {}, {} columns",
                children.size(), size, sides, area, columns);
        Fragment fragment = layoutBody(children, styles, area, columns, gutter, dir, span);

        List<LayoutedPage> pages = new ArrayList<>(fragment.size());
        for (Frame inner : fragment) {
            Size headerSize = new Size(inner.width(), sides.top() - headerAscent);
            Size footerSize = new Size(inner.width(), sides.bottom() - footerDescent);
            Size fullSize = inner.size().plus(sides.sumByAxis());
            Align mid = new Align(HAlign.CENTER, VAlign.HORIZON);
            pages.add(new LayoutedPage(
                    inner,
                    sides,
                    binding,
                    twoSided,
                    layoutMarginal("header", header, headerSize, VAlign.BOTTOM, null),
                    layoutMarginal("footer", footer, footerSize, VAlign.TOP, null),
                    layoutMarginal("background", background, fullSize, null, mid),
                    layoutMarginal("foreground", foreground, fullSize, null, mid),
                    fill,
                    numbering));
        }
        log.debug("Page run produced {} pages", pages.size());
        return pages;
    }

    /**
     * Lays out a page without content, used to fix up page parity.
     */
    public LayoutedPage layoutBlankPage(StyleChain initial) throws LayoutException {
        return layoutPageRun(List.of(), initial).get(0);
    }

    /**
     * Flows the children into the content area. With several columns, every
     * column is a region of its own and each group of columns becomes one body,
     * with the first column at the start of the text direction.
     */
    private Fragment layoutBody(List<Pair> children, StyleChain styles, Size area, int columns, double gutter,
                                Dir dir, Span span) throws LayoutException {
        if (columns == 1) {
            return flow.layout(children, styles, Regions.repeat(area, area.finite()), span);
        }

        double columnWidth = Math.max((area.width() - gutter * (columns - 1)) / columns, 0);
        boolean bounded = Double.isFinite(area.height());
        Regions regions = Regions.repeat(new Size(columnWidth, area.height()), new Axes<>(true, bounded));
        List<Frame> frames = flow.layout(children, styles, regions, span).frames();

        List<Frame> bodies = new ArrayList<>();
        for (int start = 0; start < frames.size(); start += columns) {
            List<Frame> group = frames.subList(start, Math.min(start + columns, frames.size()));
            double height = bounded ? area.height() : group.stream().mapToDouble(Frame::height).max().orElse(0);
            Frame body = new Frame(new Size(area.width(), height));
            double offset = 0;
            for (Frame column : group) {
                double x = dir == Dir.RTL ? area.width() - offset - column.width() : offset;
                body.pushFrame(Point.withX(x), column);
                offset += column.width() + gutter;
            }
            bodies.add(body);
        }
        log.debug("Stitched {} columns into {} bodies", frames.size(), bodies.size());
        return new Fragment(bodies);
    }

    private static double resolveSide(Rel side, double fallback, double base, double fontSize) {
        return side == null ? fallback : side.relativeTo(base, fontSize);
    }

    private static Pair marginal(Smart<Content> setting, Pair numbering, StyleChain styles) {
        if (setting.isAuto()) {
            return numbering;
        }
        return content(setting.custom().orElse(null), styles);
    }

    private static Pair content(Content content, StyleChain styles) {
        return content == null ? null : new Pair(content, styles);
    }

    /**
     * Lays out one marginal into its fixed area.
     *
     * @param vertical vertical alignment to impose, keeping the horizontal one
     * @param full     alignment to impose on both axes, takes precedence
     */
    private Frame layoutMarginal(String name, Pair marginal, Size area, VAlign vertical, Align full)
            throws LayoutException {
        if (marginal == null) {
            return null;
        }
        Span span = marginal.content().span();
        if (area.width() < 0 || area.height() < 0) {
            throw new MarginalOverflowException(span, name,
                    "The " + name + " has no room, its area is " + area);
        }

        StyleChain styles = marginal.styles();
        Align align = full != null ? full : styles.get(LayoutKeys.ALIGN).withY(vertical);
        StyleChain aligned = styles.chain(Style.direct(LayoutKeys.ALIGN, align));
        Regions regions = Regions.of(new Region(area, Axes.splat(true)));

        Fragment fragment = blocks.layout(new Pair(marginal.content(), aligned), regions);
        if (fragment.size() != 1) {
            throw new MarginalOverflowException(span, name,
                    "The " + name + " does not fit on one page, it needs " + fragment.size() + " regions");
        }
        Frame frame = fragment.get(0);
        if (!Abs.fits(area.width(), frame.width()) || !Abs.fits(area.height(), frame.height())) {
            throw new MarginalOverflowException(span, name,
                    "The " + name + " of size " + frame.size() + " does not fit into " + area);
        }
        frame.resize(area, align.resolve(aligned.get(TextKeys.DIR)));
        return frame;
    }
}
