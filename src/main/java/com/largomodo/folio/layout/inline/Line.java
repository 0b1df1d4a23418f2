package com.largomodo.folio.layout.inline;

/**
 * A line chosen by a {@link LineBreaker}: a range of the paragraph text.
 *
 * @param start      first character index
 * @param end        index after the last character, including trailing spaces
 * @param breakpoint how the line ends
 * @param width      natural width of the visible content
 */
public record Line(int start, int end, Breakpoint breakpoint, double width) {

    public Line {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid line range " + start + ".." + end);
        }
    }
}
