package com.largomodo.folio.content;

import com.largomodo.folio.geom.Span;

/**
 * An invisible marker for introspection. Takes no space and never causes a page.
 */
public record TagElem(String label, Span span) implements Content {

    public static TagElem of(String label) {
        return new TagElem(label, Span.DETACHED);
    }
}
