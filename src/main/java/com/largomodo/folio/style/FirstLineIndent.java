package com.largomodo.folio.style;

import com.largomodo.folio.geom.Length;

/**
 * Indent of the first line of a paragraph.
 *
 * @param amount the indent
 * @param all    whether to indent every paragraph instead of only those following another paragraph
 */
public record FirstLineIndent(Length amount, boolean all) {

    public static final FirstLineIndent NONE = new FirstLineIndent(Length.ZERO, false);

    public FirstLineIndent {
        if (amount == null) {
            throw new IllegalArgumentException("Indent amount cannot be null");
        }
    }
}
