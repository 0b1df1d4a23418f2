package com.largomodo.folio.content;

import com.largomodo.folio.geom.Span;
import com.largomodo.folio.style.Parity;

/**
 * A page break.
 *
 * @param weak     weak breaks do not produce empty pages
 * @param to       parity the next page should have, null for any
 * @param boundary set on breaks that close the scope of a page set rule; their
 *                 styles are not carried over to the next page
 * @param span     origin
 */
public record PagebreakElem(boolean weak, Parity to, boolean boundary, Span span) implements Content {

    public static PagebreakElem strong() {
        return new PagebreakElem(false, null, false, Span.DETACHED);
    }

    public static PagebreakElem weakBreak() {
        return new PagebreakElem(true, null, false, Span.DETACHED);
    }
}
