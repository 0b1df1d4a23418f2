package com.largomodo.folio.layout.page;

import com.largomodo.folio.geom.FrameItem;
import com.largomodo.folio.style.Numbering;

/**
 * Placeholder for the page counter, replaced once page numbers are known.
 *
 * @param numbering the pattern to format the number with
 * @param both      whether to show the total page count too
 * @param width     the width reserved for the formatted number
 */
public record CounterItem(Numbering numbering, boolean both, double width) implements FrameItem {
}
