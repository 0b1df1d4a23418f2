package com.largomodo.folio.layout.inline;

import com.largomodo.folio.style.StyleChain;

/**
 * A stretch of the paragraph text that came from one child.
 *
 * @param start    first index in the text buffer
 * @param end      index after the last character
 * @param kind     what the child was
 * @param styles   the child's effective styles
 * @param fontSize resolved font size
 * @param spacing  width of a spacing segment, zero for text
 */
public record Segment(int start, int end, Kind kind, StyleChain styles, double fontSize, double spacing) {

    public enum Kind {
        TEXT,
        SPACING
    }

    public int length() {
        return end - start;
    }
}
