package com.largomodo.folio.content;

import com.largomodo.folio.geom.Span;

/**
 * A run of text. A newline is a forced line break.
 */
public record TextElem(String text, Span span) implements Content {

    public TextElem {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }
    }

    public static TextElem of(String text) {
        return new TextElem(text, Span.DETACHED);
    }
}
