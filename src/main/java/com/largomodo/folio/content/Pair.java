package com.largomodo.folio.content;

import com.largomodo.folio.style.StyleChain;

/**
 * Content together with the styles it is laid out with.
 *
 * @param content the content
 * @param styles  the styles active for it
 */
public record Pair(Content content, StyleChain styles) {

    public Pair {
        if (content == null || styles == null) {
            throw new IllegalArgumentException("Content and styles cannot be null");
        }
    }

    public static Pair of(Content content) {
        return new Pair(content, StyleChain.empty());
    }
}
