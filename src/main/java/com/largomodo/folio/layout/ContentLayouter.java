package com.largomodo.folio.layout;

import com.largomodo.folio.content.BlockElem;
import com.largomodo.folio.content.Content;
import com.largomodo.folio.content.CounterDisplayElem;
import com.largomodo.folio.content.Pair;
import com.largomodo.folio.content.PagebreakElem;
import com.largomodo.folio.content.ParElem;
import com.largomodo.folio.content.PlaceElem;
import com.largomodo.folio.content.StackElem;
import com.largomodo.folio.content.TagElem;
import com.largomodo.folio.content.TextElem;
import com.largomodo.folio.content.VElem;
import com.largomodo.folio.geom.Abs;
import com.largomodo.folio.geom.Axes;
import com.largomodo.folio.geom.Fragment;
import com.largomodo.folio.geom.Frame;
import com.largomodo.folio.geom.Point;
import com.largomodo.folio.geom.Size;
import com.largomodo.folio.layout.flow.FlowLayouter;
import com.largomodo.folio.layout.inline.InlineLayouter;
import com.largomodo.folio.layout.inline.TextMetrics;
import com.largomodo.folio.layout.page.CounterItem;
import com.largomodo.folio.layout.stack.StackLayouter;
import com.largomodo.folio.region.Regions;
import com.largomodo.folio.style.LayoutKeys;
import com.largomodo.folio.style.StyleChain;
import com.largomodo.folio.style.TextKeys;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out any block-level content by dispatching on its kind.
 */
public class ContentLayouter implements BlockLayouter {

    private final InlineLayouter inline;
    private final TextMetrics metrics;
    private final FlowLayouter flow;

    public ContentLayouter(InlineLayouter inline, TextMetrics metrics) {
        this.inline = inline;
        this.metrics = metrics;
        this.flow = new FlowLayouter(this, inline);
    }

    public FlowLayouter flow() {
        return flow;
    }

    @Override
    public Fragment layout(Pair child, Regions regions) throws LayoutException {
        Content content = child.content();
        StyleChain styles = child.styles();
        if (content instanceof ParElem) {
            return inline.layout((ParElem) content, styles, regions, null, null);
        } else if (content instanceof TextElem) {
            ParElem par = ParElem.of(List.of(Pair.of(content))).withSpan(content.span());
            return inline.layout(par, styles, regions, null, null);
        } else if (content instanceof StackElem) {
            return StackLayouter.layoutStack((StackElem) content, styles, regions, this);
        } else if (content instanceof BlockElem) {
            return layoutBlock((BlockElem) content, styles, regions);
        } else if (content instanceof CounterDisplayElem) {
            return Fragment.of(layoutCounter((CounterDisplayElem) content, styles, regions));
        } else if (content instanceof PlaceElem) {
            return layout(((PlaceElem) content).body(), regions);
        } else if (content instanceof TagElem || content instanceof VElem) {
            return Fragment.of(new Frame(Size.ZERO));
        } else if (content instanceof PagebreakElem) {
            throw new LayoutException(content.span(), "pagebreaks are not allowed inside of containers");
        }
        throw new LayoutException(content.span(),
                content.getClass().getSimpleName() + " cannot be laid out as a block");
    }

    private Fragment layoutBlock(BlockElem block, StyleChain styles, Regions regions) throws LayoutException {
        boolean fill = regions.expand().x() && Double.isFinite(regions.width());
        if (!block.body().isEmpty()) {
            double width = block.width() != null ? block.width() : regions.width();
            Axes<Boolean> expand = new Axes<>(block.width() != null || regions.expand().x(), block.height() != null);
            Regions inner;
            if (block.height() != null) {
                inner = Regions.one(new Size(width, block.height()), expand);
            } else if (block.breakable()) {
                inner = regions.map(size -> size.withWidth(width)).withExpand(expand);
            } else {
                inner = Regions.one(new Size(width, regions.height()), expand);
            }
            return flow.layout(block.body(), styles, inner, block.span());
        }

        double width = block.width() != null ? block.width() : (fill ? regions.width() : 0);
        double height = block.height() != null ? block.height() : 0;
        if (!block.breakable()) {
            return Fragment.of(new Frame(new Size(width, height)));
        }

        List<Frame> frames = new ArrayList<>();
        Regions remaining = regions.copy();
        double left = height;
        // Every chunk uses up its region, so breaking is enough even when the next region is the same size.
        while (!Abs.fits(remaining.height(), left) && remaining.mayBreak()) {
            double taken = Math.max(remaining.height(), 0);
            if (taken <= 0 && !remaining.mayProgress()) {
                break;
            }
            frames.add(new Frame(new Size(width, taken)));
            left -= taken;
            remaining.next();
        }
        frames.add(new Frame(new Size(width, left)));
        return new Fragment(frames);
    }

    /**
     * A line holding the page counter placeholder, aligned horizontally like
     * text.
     */
    private Frame layoutCounter(CounterDisplayElem elem, StyleChain styles, Regions regions) {
        double fontSize = styles.get(TextKeys.SIZE);
        String pattern = elem.numbering().pattern();
        double textWidth = 0;
        for (int i = 0; i < pattern.length(); i++) {
            textWidth += metrics.advance(pattern.charAt(i), fontSize);
        }
        if (elem.both()) {
            textWidth *= 2;
        }
        double width = regions.expand().x() && Double.isFinite(regions.width()) ? regions.width() : textWidth;
        Frame frame = new Frame(new Size(width, metrics.ascent(fontSize) + metrics.descent(fontSize)));
        double x = styles.get(LayoutKeys.ALIGN).x().fix(styles.get(TextKeys.DIR)).position(width - textWidth);
        frame.push(new Point(x, metrics.ascent(fontSize)), new CounterItem(elem.numbering(), elem.both(), textWidth));
        return frame;
    }
}
