package com.largomodo.folio.geom;

/**
 * Something that can be placed into a {@link Frame}.
 */
public interface FrameItem {
}
