package com.largomodo.folio.layout.inline;

import com.largomodo.folio.style.Linebreaks;

import java.util.List;

/**
 * Chooses where the lines of a prepared paragraph end.
 */
public interface LineBreaker {

    /**
     * @param p         the prepared paragraph
     * @param width     available width per line, see {@link Preparation#linePitch()} for line offsets
     * @param linebreaks the breaking mode
     * @return lines covering the whole text in order
     */
    List<Line> breakLines(Preparation p, AvailableWidth width, Linebreaks linebreaks);
}
