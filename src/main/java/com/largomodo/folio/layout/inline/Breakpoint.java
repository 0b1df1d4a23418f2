package com.largomodo.folio.layout.inline;

/**
 * How a line ends.
 */
public enum Breakpoint {
    /** At a break opportunity such as a space. */
    NORMAL,
    /** At a newline or at the end of the paragraph. */
    MANDATORY,
    /** Inside a word, with a hyphen. */
    HYPHEN
}
