package com.largomodo.folio.style;

import com.largomodo.folio.geom.Align;
import com.largomodo.folio.geom.Length;

/**
 * Style properties shared by block-level layout.
 */
public final class LayoutKeys {

    /** Alignment of content within its container. */
    public static final StyleKey<Align> ALIGN = StyleKey.of("align", "alignment", Align.class, Align.START_TOP);
    /** Gap between a block and its neighbors in a flow. */
    public static final StyleKey<Length> BLOCK_SPACING = StyleKey.of("block", "spacing", Length.class, Length.em(1.2));

    private LayoutKeys() {
    }
}
