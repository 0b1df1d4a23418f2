package com.largomodo.folio.layout;

import com.largomodo.folio.geom.Span;

/**
 * Thrown when a header, footer, background or foreground does not fit into the
 * area reserved for it.
 */
public class MarginalOverflowException extends LayoutException {

    private final String marginal;

    public MarginalOverflowException(Span span, String marginal, String message) {
        super(span, message);
        this.marginal = marginal;
    }

    /**
     * Which marginal overflowed: {@code header}, {@code footer}, {@code background} or {@code foreground}.
     */
    public String marginal() {
        return marginal;
    }
}
