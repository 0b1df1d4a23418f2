package com.largomodo.folio.region;

import com.largomodo.folio.geom.Axes;
import com.largomodo.folio.geom.Size;

/**
 * A single area to lay out into.
 *
 * @param size   the available space
 * @param expand per axis, whether content must fill the space instead of shrinking to fit
 */
public record Region(Size size, Axes<Boolean> expand) {

    public Region {
        if (size == null || expand == null) {
            throw new IllegalArgumentException("Region size and expand flags cannot be null");
        }
    }
}
