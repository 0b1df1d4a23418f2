package com.largomodo.folio.layout;

import com.largomodo.folio.content.Pair;
import com.largomodo.folio.geom.Fragment;
import com.largomodo.folio.region.Regions;

/**
 * Lays out one block-level child into a sequence of regions.
 * <p>
 * Implementations honor the expansion flags of the regions and return one frame
 * per region they used. The regions passed in belong to the callee.
 */
public interface BlockLayouter {

    /**
     * @param child   the content and its styles
     * @param regions the regions to lay out into
     * @return one frame per consumed region
     * @throws LayoutException if the content cannot be laid out
     */
    Fragment layout(Pair child, Regions regions) throws LayoutException;
}
