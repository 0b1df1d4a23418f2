package com.largomodo.folio.layout.stack;

import com.largomodo.folio.geom.Axes;
import com.largomodo.folio.geom.FixedAlignment;
import com.largomodo.folio.geom.Fr;
import com.largomodo.folio.geom.Frame;
import com.largomodo.folio.geom.Point;

/**
 * A laid-out child of a stack whose final position is known only once its
 * region is finished.
 */
public interface StackItem {

    /**
     * Absolute spacing, unclipped.
     */
    record Absolute(double amount) implements StackItem {
    }

    /**
     * Fractional spacing, resolved against the space left in the region.
     */
    record Fractional(Fr fr) implements StackItem {
    }

    /**
     * A block frame with its alignment on both axes.
     */
    record Block(Frame frame, Axes<FixedAlignment> align) implements StackItem {
    }

    /**
     * A frame at a fixed position in the region that takes no space in the stack.
     */
    record Placed(Frame frame, Point position) implements StackItem {
    }
}
