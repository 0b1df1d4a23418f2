package com.largomodo.folio.layout.inline;

import com.largomodo.folio.region.ParExclusions;

import java.util.List;

/**
 * The paragraph's children merged into one text buffer.
 *
 * @param text       the full paragraph text
 * @param segments   which part of the text came from which child
 * @param exclusions space taken by wrap floats
 */
public record Collected(String text, List<Segment> segments, ParExclusions exclusions) {

    public Collected {
        segments = List.copyOf(segments);
    }
}
