package com.largomodo.folio.layout.inline;

/**
 * The width a line may take, depending on its vertical offset in the paragraph.
 */
@FunctionalInterface
public interface AvailableWidth {

    /**
     * @param y         top of the line, relative to the paragraph top
     * @param firstLine whether this is the paragraph's first line
     */
    double at(double y, boolean firstLine);
}
