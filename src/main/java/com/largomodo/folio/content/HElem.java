package com.largomodo.folio.content;

import com.largomodo.folio.geom.Span;

/**
 * Fixed horizontal space inside a paragraph.
 */
public record HElem(double amount, Span span) implements Content {
}
