package com.largomodo.folio.content;

import com.largomodo.folio.geom.HAlign;
import com.largomodo.folio.geom.Length;
import com.largomodo.folio.geom.Span;

/**
 * A float that following paragraphs wrap around. It is placed at the current
 * position of the flow, at the start, center or end of the line.
 *
 * @param body      the float's content
 * @param align     horizontal placement
 * @param clearance gap between the float and wrapping text
 * @param span      origin
 */
public record PlaceElem(Pair body, HAlign align, Length clearance, Span span) implements Content {

    public PlaceElem {
        if (body == null || align == null || clearance == null) {
            throw new IllegalArgumentException("Body, alignment and clearance cannot be null");
        }
    }

    public static PlaceElem of(Pair body, HAlign align) {
        return new PlaceElem(body, align, Length.em(1.5), Span.DETACHED);
    }
}
