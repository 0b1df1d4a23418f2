package com.largomodo.folio.geom;

/**
 * A layout direction along one axis.
 */
public enum Dir {
    LTR(Axis.X, true),
    RTL(Axis.X, false),
    TTB(Axis.Y, true),
    BTT(Axis.Y, false);

    private final Axis axis;
    private final boolean positive;

    Dir(Axis axis, boolean positive) {
        this.axis = axis;
        this.positive = positive;
    }

    public Axis axis() {
        return axis;
    }

    /**
     * Whether the direction points towards increasing coordinates.
     */
    public boolean isPositive() {
        return positive;
    }

    /**
     * The fixed alignment at which content flowing in this direction starts.
     */
    public FixedAlignment start() {
        return positive ? FixedAlignment.START : FixedAlignment.END;
    }

    public FixedAlignment end() {
        return start().inv();
    }
}
