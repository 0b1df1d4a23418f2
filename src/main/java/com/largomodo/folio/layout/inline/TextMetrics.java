package com.largomodo.folio.layout.inline;

/**
 * Font metrics used to measure text. Shaping is outside this layout engine,
 * so the metrics stand in for a shaped font.
 */
public interface TextMetrics {

    /**
     * Horizontal advance of one code point.
     */
    double advance(int codePoint, double fontSize);

    /**
     * Distance from the top of a line to the baseline.
     */
    double ascent(double fontSize);

    /**
     * Distance from the baseline to the bottom of a line.
     */
    double descent(double fontSize);
}
