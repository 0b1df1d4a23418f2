package com.largomodo.folio.layout.page;

import com.largomodo.folio.geom.Size;

/**
 * Common paper sizes in points.
 */
public enum Paper {
    A4(595.28, 841.89),
    A5(419.53, 595.28),
    A3(841.89, 1190.55),
    US_LETTER(612.0, 792.0),
    US_LEGAL(612.0, 1008.0);

    private final double width;
    private final double height;

    Paper(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }

    public Size size() {
        return new Size(width, height);
    }
}
