package com.largomodo.folio.geom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A finished layout area with positioned items.
 * <p>
 * Frames are built incrementally by a single layouter and treated as immutable
 * once they are handed out as part of a {@link Fragment}.
 */
public class Frame {

    private Size size;
    private final List<Positioned> items = new ArrayList<>();

    public Frame(Size size) {
        if (!size.isFinite()) {
            throw new IllegalArgumentException("Frame size must be finite: " + size);
        }
        this.size = size;
    }

    public Size size() {
        return size;
    }

    public double width() {
        return size.width();
    }

    public double height() {
        return size.height();
    }

    public List<Positioned> items() {
        return Collections.unmodifiableList(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public void push(Point position, FrameItem item) {
        items.add(new Positioned(position, item));
    }

    public void pushFrame(Point position, Frame frame) {
        push(position, new GroupItem(frame));
    }

    public void translate(Point offset) {
        if (offset.x() == 0 && offset.y() == 0) {
            return;
        }
        items.replaceAll(p -> new Positioned(p.position().plus(offset), p.item()));
    }

    /**
     * Changes the size and moves the contents so that they keep the given alignment
     * inside the new size.
     */
    public void resize(Size target, Axes<FixedAlignment> align) {
        if (!target.isFinite()) {
            throw new IllegalArgumentException("Frame size must be finite: " + target);
        }
        Point offset = new Point(
                align.x().position(target.width() - size.width()),
                align.y().position(target.height() - size.height()));
        size = target;
        translate(offset);
    }

    /**
     * Collects all items of the given type, descending into nested frames.
     */
    public <T extends FrameItem> List<T> collect(Class<T> type) {
        List<T> found = new ArrayList<>();
        collectInto(type, found);
        return found;
    }

    private <T extends FrameItem> void collectInto(Class<T> type, List<T> found) {
        for (Positioned positioned : items) {
            FrameItem item = positioned.item();
            if (type.isInstance(item)) {
                found.add(type.cast(item));
            }
            if (item instanceof GroupItem) {
                ((GroupItem) item).frame().collectInto(type, found);
            }
        }
    }

    @Override
    public String toString() {
        return "Frame[" + size.width() + "x" + size.height() + ", " + items.size() + " items]";
    }
}
