package com.largomodo.folio.layout.stack;

import com.largomodo.folio.content.Pair;
import com.largomodo.folio.content.StackChild;
import com.largomodo.folio.content.StackElem;
import com.largomodo.folio.content.VElem;
import com.largomodo.folio.geom.Axes;
import com.largomodo.folio.geom.Axis;
import com.largomodo.folio.geom.Dir;
import com.largomodo.folio.geom.FixedAlignment;
import com.largomodo.folio.geom.Fr;
import com.largomodo.folio.geom.Fragment;
import com.largomodo.folio.geom.Frame;
import com.largomodo.folio.geom.Point;
import com.largomodo.folio.geom.Size;
import com.largomodo.folio.geom.Spacing;
import com.largomodo.folio.geom.Span;
import com.largomodo.folio.layout.BlockLayouter;
import com.largomodo.folio.layout.LayoutException;
import com.largomodo.folio.layout.UnsizableAxisException;
import com.largomodo.folio.region.Regions;
import com.largomodo.folio.style.LayoutKeys;
import com.largomodo.folio.style.StyleChain;
import com.largomodo.folio.style.TextKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out spacing and blocks one after another along an axis.
 * <p>
 * Children are collected per region as {@link StackItem}s. Their positions are
 * computed when the region is finished, because fractional spacing can only be
 * resolved once everything in the region is known.
 * <p>
 * A layouter is used for one layout call and is not thread-safe.
 */
public class StackLayouter {

    private static final Logger log = LoggerFactory.getLogger(StackLayouter.class);

    private final Span span;
    private final Dir dir;
    private final Axis axis;
    private final StyleChain styles;
    private final BlockLayouter blocks;
    private final Regions regions;
    /** Whether the stack itself fills its regions. */
    private final Axes<Boolean> expand;
    /** Size of the current region before anything was consumed. */
    private Size initial;
    private GenericSize used = GenericSize.ZERO;
    private Fr fr = Fr.ZERO;
    private final List<StackItem> items = new ArrayList<>();
    private final List<Frame> finished = new ArrayList<>();

    /**
     * @param span    where to report errors
     * @param dir     stacking direction
     * @param styles  styles for resolving spacing
     * @param regions the regions to fill, owned by the layouter from now on
     * @param blocks  lays out block children
     */
    public StackLayouter(Span span, Dir dir, StyleChain styles, Regions regions, BlockLayouter blocks) {
        this.span = span;
        this.dir = dir;
        this.axis = dir.axis();
        this.styles = styles;
        this.blocks = blocks;
        this.expand = regions.expand();
        // Children must not expand along the stacking axis or they would eat all space.
        this.regions = regions.withExpand(regions.expand().with(axis, false));
        this.initial = regions.size();
    }

    /**
     * Lays out a stack element with its between-block spacing.
     */
    public static Fragment layoutStack(StackElem elem, StyleChain styles, Regions regions, BlockLayouter blocks)
            throws LayoutException {
        StackLayouter layouter = new StackLayouter(elem.span(), elem.dir(), styles, regions, blocks);
        Spacing deferred = null;
        for (StackChild child : elem.children()) {
            if (child.isSpacing()) {
                layouter.layoutSpacing(child.spacing());
                deferred = null;
                continue;
            }
            Pair block = child.block();
            if (layouter.axis == Axis.Y && block.content() instanceof VElem) {
                layouter.layoutSpacing(((VElem) block.content()).amount());
                deferred = null;
                continue;
            }
            if (deferred != null) {
                layouter.layoutSpacing(deferred);
            }
            layouter.layoutBlock(block);
            deferred = elem.spacing();
        }
        return layouter.finish();
    }

    /**
     * Adds spacing along the stacking axis. Relative spacing resolves against the
     * full size of the current region and consumes at most what is left of it.
     */
    public void layoutSpacing(Spacing spacing) {
        if (spacing.isFractional()) {
            fr = fr.plus(spacing.fr());
            items.add(new StackItem.Fractional(spacing.fr()));
            return;
        }
        double resolved = spacing.rel().relativeTo(regions.base().get(axis), styles.get(TextKeys.SIZE));
        double remaining = regions.size().get(axis);
        double limited = Math.min(resolved, remaining);
        if (axis == Axis.Y) {
            regions.setHeight(remaining - limited);
        }
        used = used.withMain(used.main() + limited);
        items.add(new StackItem.Absolute(resolved));
    }

    /**
     * Lays out a block child, moving to the next region first when the current
     * one is used up.
     */
    public void layoutBlock(Pair block) throws LayoutException {
        advanceIfFull();
        StyleChain blockStyles = block.styles();
        Axes<FixedAlignment> align = blockStyles.get(LayoutKeys.ALIGN).resolve(blockStyles.get(TextKeys.DIR));
        Fragment fragment = blocks.layout(block, regions.copy());
        pushFragment(fragment, align);
    }

    /**
     * Moves to the next region if the current one is used up and the next one
     * offers more space.
     */
    public void advanceIfFull() throws LayoutException {
        if (regions.isFull()) {
            finishRegion();
        }
    }

    /**
     * Adds frames that were laid out elsewhere into the current and following
     * regions. Every frame but the last finishes its region.
     */
    public void pushFragment(Fragment fragment, Axes<FixedAlignment> align) throws LayoutException {
        int len = fragment.size();
        for (int i = 0; i < len; i++) {
            Frame frame = fragment.get(i);
            Size size = frame.size();
            if (axis == Axis.Y) {
                regions.setHeight(regions.height() - size.height());
            }
            used = used.grow(GenericSize.of(size, axis));
            items.add(new StackItem.Block(frame, align));
            if (i + 1 < len) {
                finishRegion();
            }
        }
    }

    /**
     * Places a frame at a fixed position in the current region without
     * consuming stack space.
     */
    public void pushPlaced(Frame frame, Point position) {
        items.add(new StackItem.Placed(frame, position));
    }

    /**
     * The regions as they are now. Callers must not keep the returned copy
     * across further calls.
     */
    public Regions regions() {
        return regions.copy();
    }

    /**
     * How much of the current region is used along the stacking axis.
     */
    public double usedMain() {
        return used.main();
    }

    /**
     * Index of the current region, counting from zero.
     */
    public int regionIndex() {
        return finished.size();
    }

    /**
     * Positions the collected items in a frame for the current region and moves
     * on to the next region.
     *
     * @throws UnsizableAxisException if the frame would be infinitely large
     */
    public void finishRegion() throws LayoutException {
        Size size = Size.select(expand, initial, used.toSize(axis)).min(initial);

        double full = initial.get(axis);
        double remaining = full - used.main();
        if (!fr.isZero() && Double.isFinite(full)) {
            used = used.withMain(full);
            size = size.with(axis, full);
        }

        if (!size.isFinite()) {
            throw new UnsizableAxisException(span, "stack spacing is infinite");
        }

        Frame output = new Frame(size);
        double cursor = 0;
        FixedAlignment ruler = dir.start();
        Axis other = axis.other();

        for (StackItem item : items) {
            if (item instanceof StackItem.Absolute) {
                cursor += ((StackItem.Absolute) item).amount();
            } else if (item instanceof StackItem.Fractional) {
                cursor += ((StackItem.Fractional) item).fr().share(fr, remaining);
            } else if (item instanceof StackItem.Placed) {
                StackItem.Placed placed = (StackItem.Placed) item;
                output.pushFrame(placed.position(), placed.frame());
            } else {
                StackItem.Block block = (StackItem.Block) item;
                Frame frame = block.frame();
                // Later frames aligned further towards the end push earlier ones along.
                ruler = dir.isPositive()
                        ? FixedAlignment.max(ruler, block.align().get(axis))
                        : FixedAlignment.min(ruler, block.align().get(axis));

                double parent = size.get(axis);
                double child = frame.size().get(axis);
                double main = ruler.position(parent - used.main())
                        + (dir.isPositive() ? cursor : used.main() - child - cursor);
                double cross = block.align().get(other).position(size.get(other) - frame.size().get(other));

                output.pushFrame(new GenericSize(cross, main).toPoint(axis), frame);
                cursor += child;
            }
        }

        log.debug("Finished stack region {} at {}x{} ({} items, fr={})",
                finished.size(), size.width(), size.height(), items.size(), fr.value());

        items.clear();
        regions.next();
        initial = regions.size();
        used = GenericSize.ZERO;
        fr = Fr.ZERO;
        finished.add(output);
    }

    /**
     * Finishes the last region and returns all frames.
     */
    public Fragment finish() throws LayoutException {
        finishRegion();
        return new Fragment(finished);
    }
}
