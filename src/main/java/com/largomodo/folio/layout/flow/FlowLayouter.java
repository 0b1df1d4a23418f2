package com.largomodo.folio.layout.flow;

import com.largomodo.folio.content.Content;
import com.largomodo.folio.content.HElem;
import com.largomodo.folio.content.Pair;
import com.largomodo.folio.content.PagebreakElem;
import com.largomodo.folio.content.ParElem;
import com.largomodo.folio.content.PlaceElem;
import com.largomodo.folio.content.TagElem;
import com.largomodo.folio.content.TextElem;
import com.largomodo.folio.content.VElem;
import com.largomodo.folio.geom.Abs;
import com.largomodo.folio.geom.Axes;
import com.largomodo.folio.geom.Dir;
import com.largomodo.folio.geom.FixedAlignment;
import com.largomodo.folio.geom.Fragment;
import com.largomodo.folio.geom.Frame;
import com.largomodo.folio.geom.Length;
import com.largomodo.folio.geom.Point;
import com.largomodo.folio.geom.Rel;
import com.largomodo.folio.geom.Size;
import com.largomodo.folio.geom.Spacing;
import com.largomodo.folio.geom.Span;
import com.largomodo.folio.layout.BlockLayouter;
import com.largomodo.folio.layout.LayoutException;
import com.largomodo.folio.layout.inline.InlineLayouter;
import com.largomodo.folio.layout.inline.ParSituation;
import com.largomodo.folio.layout.stack.StackLayouter;
import com.largomodo.folio.region.ParExclusions;
import com.largomodo.folio.region.Regions;
import com.largomodo.folio.region.WrapFloat;
import com.largomodo.folio.style.LayoutKeys;
import com.largomodo.folio.style.ParKeys;
import com.largomodo.folio.style.StyleChain;
import com.largomodo.folio.style.TextKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out block-level content from top to bottom on top of a {@link StackLayouter}.
 * <p>
 * Adds paragraph and block spacing between children, tracks the situation of
 * each paragraph for its first-line indent and makes paragraphs wrap around
 * floats placed earlier in the same region.
 */
public class FlowLayouter {

    private static final Logger log = LoggerFactory.getLogger(FlowLayouter.class);

    /** Upper bound on layout passes for a paragraph next to floats. */
    static final int MAX_WRAP_PASSES = 3;

    private final BlockLayouter blocks;
    private final InlineLayouter inline;

    public FlowLayouter(BlockLayouter blocks, InlineLayouter inline) {
        this.blocks = blocks;
        this.inline = inline;
    }

    /**
     * @param children the flow's content with absolute styles
     * @param styles   the styles of the container
     * @param regions  the regions to fill
     * @param span     where to report errors of the flow itself
     */
    public Fragment layout(List<Pair> children, StyleChain styles, Regions regions, Span span)
            throws LayoutException {
        StackLayouter stack = new StackLayouter(span, Dir.TTB, styles, regions, blocks);
        ParSituation situation = ParSituation.FIRST;
        Spacing deferred = null;
        List<WrapFloat> floats = new ArrayList<>();
        int floatRegion = 0;

        for (Pair child : children) {
            Content content = child.content();
            StyleChain childStyles = child.styles();

            if (content instanceof TagElem) {
                continue;
            }
            if (content instanceof VElem) {
                stack.layoutSpacing(((VElem) content).amount());
                deferred = null;
                continue;
            }
            if (content instanceof PagebreakElem) {
                throw new LayoutException(content.span(), "pagebreaks are not allowed inside of containers");
            }
            if (content instanceof HElem) {
                log.warn("Horizontal spacing outside of a paragraph was ignored ({})", content.span());
                continue;
            }

            if (content instanceof TextElem) {
                content = ParElem.of(List.of(Pair.of(content))).withSpan(content.span());
            }

            if (deferred != null && !(content instanceof PlaceElem)) {
                stack.layoutSpacing(deferred);
                deferred = null;
            }
            if (!(content instanceof PlaceElem)) {
                stack.advanceIfFull();
            }
            if (stack.regionIndex() != floatRegion) {
                floats.clear();
                floatRegion = stack.regionIndex();
            }

            if (content instanceof PlaceElem) {
                placeFloat((PlaceElem) content, childStyles, stack, floats);
            } else if (content instanceof ParElem) {
                Fragment fragment = layoutParagraph((ParElem) content, childStyles, stack, situation, floats);
                stack.pushFragment(fragment, alignment(childStyles));
                situation = ParSituation.CONSECUTIVE;
                deferred = Spacing.of(new Rel(0, childStyles.get(ParKeys.SPACING)));
            } else {
                stack.layoutBlock(new Pair(content, childStyles));
                situation = ParSituation.OTHER;
                deferred = Spacing.of(new Rel(0, childStyles.get(LayoutKeys.BLOCK_SPACING)));
            }
        }

        return stack.finish();
    }

    private static Axes<FixedAlignment> alignment(StyleChain styles) {
        return styles.get(LayoutKeys.ALIGN).resolve(styles.get(TextKeys.DIR));
    }

    /**
     * Lays out a paragraph. Next to floats, the paragraph is first laid out
     * without them to estimate its height, then again with the exclusions for
     * that height until the height settles.
     */
    private Fragment layoutParagraph(ParElem par, StyleChain styles, StackLayouter stack,
                                     ParSituation situation, List<WrapFloat> floats) throws LayoutException {
        Fragment fragment = inline.layout(par, styles, stack.regions(), situation, null);
        if (floats.isEmpty()) {
            return fragment;
        }

        double parY = stack.usedMain();
        for (int pass = 1; pass <= MAX_WRAP_PASSES; pass++) {
            double height = fragment.get(0).height();
            ParExclusions exclusions = ParExclusions.fromWrapFloats(parY, height, floats);
            if (exclusions.isEmpty()) {
                return fragment;
            }
            Fragment next = inline.layout(par, styles, stack.regions(), situation, exclusions);
            boolean settled = Abs.approxEq(next.get(0).height(), height);
            fragment = next;
            if (settled) {
                log.debug("Paragraph wrapped around {} floats after {} passes", exclusions.zones().size(), pass);
                break;
            }
        }
        return fragment;
    }

    /**
     * Places a float at the current position of the flow and registers the
     * space it takes from following paragraphs.
     */
    private void placeFloat(PlaceElem place, StyleChain styles, StackLayouter stack, List<WrapFloat> floats)
            throws LayoutException {
        Regions regions = stack.regions();
        Size base = regions.base();
        Frame frame = blocks.layout(place.body(),
                Regions.one(new Size(base.width(), regions.height()), Axes.splat(false))).get(0);

        FixedAlignment alignX = place.align().fix(styles.get(TextKeys.DIR));
        double x = Double.isFinite(base.width()) ? alignX.position(base.width() - frame.width()) : 0;
        double y = stack.usedMain();
        stack.pushPlaced(frame, new Point(x, y));

        Length clearance = place.clearance();
        floats.add(WrapFloat.fromPlaced(frame, y, alignX, clearance.at(styles.get(TextKeys.SIZE))));
    }
}
