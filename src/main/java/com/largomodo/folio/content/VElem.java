package com.largomodo.folio.content;

import com.largomodo.folio.geom.Span;
import com.largomodo.folio.geom.Spacing;

/**
 * Vertical spacing in a flow.
 */
public record VElem(Spacing amount, Span span) implements Content {

    public static VElem of(Spacing amount) {
        return new VElem(amount, Span.DETACHED);
    }
}
