package com.largomodo.folio.layout;

import com.largomodo.folio.geom.Span;

/**
 * A layout diagnostic pointing at the content that caused it.
 */
public class LayoutException extends Exception {

    private final Span span;

    public LayoutException(Span span, String message) {
        super(message);
        this.span = span;
    }

    public LayoutException(Span span, String message, Throwable cause) {
        super(message, cause);
        this.span = span;
    }

    public Span span() {
        return span;
    }

    @Override
    public String getMessage() {
        return span.isDetached() ? super.getMessage() : super.getMessage() + " (at " + span + ")";
    }
}
