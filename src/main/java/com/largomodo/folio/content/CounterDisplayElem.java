package com.largomodo.folio.content;

import com.largomodo.folio.geom.Span;
import com.largomodo.folio.style.Numbering;

/**
 * Displays the page counter. Layout emits a placeholder that is filled in once
 * page numbers are known.
 *
 * @param numbering the pattern to format with
 * @param both      whether to show the final page count as well
 * @param span      origin
 */
public record CounterDisplayElem(Numbering numbering, boolean both, Span span) implements Content {

    public CounterDisplayElem {
        if (numbering == null) {
            throw new IllegalArgumentException("Numbering cannot be null");
        }
    }
}
