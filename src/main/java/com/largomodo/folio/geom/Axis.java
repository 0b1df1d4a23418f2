package com.largomodo.folio.geom;

/**
 * The two layout axes.
 */
public enum Axis {
    X,
    Y;

    public Axis other() {
        return this == X ? Y : X;
    }
}
