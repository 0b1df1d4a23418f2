package com.largomodo.folio.geom;

/**
 * Vertical alignment.
 */
public enum VAlign {
    TOP,
    HORIZON,
    BOTTOM;

    public FixedAlignment fix() {
        return switch (this) {
            case TOP -> FixedAlignment.START;
            case HORIZON -> FixedAlignment.CENTER;
            case BOTTOM -> FixedAlignment.END;
        };
    }
}
