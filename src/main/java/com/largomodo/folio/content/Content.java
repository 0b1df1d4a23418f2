package com.largomodo.folio.content;

import com.largomodo.folio.geom.Span;

/**
 * A realized piece of document content, as handed to layout.
 */
public interface Content {

    /**
     * Where the content came from, for diagnostics.
     */
    Span span();
}
