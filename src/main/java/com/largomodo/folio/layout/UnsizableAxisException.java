package com.largomodo.folio.layout;

import com.largomodo.folio.geom.Span;

/**
 * Thrown when a container ends up with an infinite size along an axis, for
 * example because fractional spacing was used in an unbounded region.
 */
public class UnsizableAxisException extends LayoutException {

    public UnsizableAxisException(Span span, String message) {
        super(span, message);
    }
}
