package com.largomodo.folio.layout.stack;

import com.largomodo.folio.geom.Axis;
import com.largomodo.folio.geom.Point;
import com.largomodo.folio.geom.Size;

/**
 * A size measured along the stacking axis ({@code main}) and across it ({@code cross}).
 */
record GenericSize(double cross, double main) {

    static final GenericSize ZERO = new GenericSize(0, 0);

    static GenericSize of(Size size, Axis main) {
        return main == Axis.X
                ? new GenericSize(size.height(), size.width())
                : new GenericSize(size.width(), size.height());
    }

    GenericSize withMain(double value) {
        return new GenericSize(cross, value);
    }

    /**
     * Grows along the main axis and to the larger cross extent.
     */
    GenericSize grow(GenericSize other) {
        return new GenericSize(Math.max(cross, other.cross), main + other.main);
    }

    Size toSize(Axis main) {
        return main == Axis.X ? new Size(this.main, cross) : new Size(cross, this.main);
    }

    Point toPoint(Axis main) {
        return main == Axis.X ? new Point(this.main, cross) : new Point(cross, this.main);
    }
}
