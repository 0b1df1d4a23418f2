package com.largomodo.folio.layout.inline;

import com.largomodo.folio.geom.FrameItem;
import com.largomodo.folio.style.Numbering;

/**
 * Marks a line for line numbering. The number is assigned after layout.
 *
 * @param numbering the pattern to number with
 * @param line      index of the line in its paragraph
 */
public record LineMarkerItem(Numbering numbering, int line) implements FrameItem {
}
