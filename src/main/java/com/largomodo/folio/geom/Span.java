package com.largomodo.folio.geom;

/**
 * Identifies the source of a piece of content for diagnostics.
 *
 * @param source human-readable origin, such as a file position or CLI argument
 */
public record Span(String source) {

    public static final Span DETACHED = new Span("<detached>");

    public Span {
        if (source == null) {
            throw new IllegalArgumentException("Span source cannot be null");
        }
    }

    public boolean isDetached() {
        return this.equals(DETACHED);
    }

    @Override
    public String toString() {
        return source;
    }
}
