package com.largomodo.folio.region;

import com.largomodo.folio.geom.FixedAlignment;
import com.largomodo.folio.geom.Frame;

/**
 * A placed float that text wraps around, in region coordinates.
 *
 * @param y           top edge, measured from the top of the region
 * @param height      vertical extent
 * @param leftMargin  width taken from the left side of lines it overlaps
 * @param rightMargin width taken from the right side of lines it overlaps
 */
public record WrapFloat(double y, double height, double leftMargin, double rightMargin) {

    public WrapFloat {
        if (height < 0 || leftMargin < 0 || rightMargin < 0) {
            throw new IllegalArgumentException("Wrap float extents must be non-negative");
        }
    }

    /**
     * Builds the obstacle for a float frame placed at {@code y}. Floats at the
     * start take space from the left, floats at the end from the right, and
     * centered floats split their width between both sides.
     *
     * @param clearance gap kept between the float and the text, negative values count as zero
     */
    public static WrapFloat fromPlaced(Frame frame, double y, FixedAlignment alignX, double clearance) {
        double gap = Math.max(clearance, 0);
        double width = frame.width() + gap;
        return switch (alignX) {
            case START -> new WrapFloat(y, frame.height(), width, 0);
            case END -> new WrapFloat(y, frame.height(), 0, width);
            case CENTER -> new WrapFloat(y, frame.height(), width / 2, width / 2);
        };
    }

    public double bottom() {
        return y + height;
    }
}
