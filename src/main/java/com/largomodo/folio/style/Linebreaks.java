package com.largomodo.folio.style;

/**
 * How lines of a paragraph are chosen.
 */
public enum Linebreaks {
    /** Take each line as long as it fits. */
    SIMPLE,
    /** Minimize badness over the whole paragraph. */
    OPTIMIZED
}
