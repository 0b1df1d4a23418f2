package com.largomodo.folio.layout.page;

import com.largomodo.folio.geom.Frame;
import com.largomodo.folio.geom.Sides;
import com.largomodo.folio.geom.Size;
import com.largomodo.folio.style.Numbering;
import com.largomodo.folio.style.Smart;

/**
 * A laid-out page that still needs its page number.
 * <p>
 * Marginals are null when the page has none. Page counter placeholders inside
 * them are filled in once the final page numbers are known.
 *
 * @param inner      the body
 * @param margin     resolved margins
 * @param binding    the bound side
 * @param twoSided   whether margins swap on even pages
 * @param header     header frame or null
 * @param footer     footer frame or null
 * @param background background frame or null
 * @param foreground foreground frame or null
 * @param fill       page fill
 * @param numbering  page numbering pattern or null
 */
public record LayoutedPage(Frame inner,
                           Sides margin,
                           Binding binding,
                           boolean twoSided,
                           Frame header,
                           Frame footer,
                           Frame background,
                           Frame foreground,
                           Smart<String> fill,
                           Numbering numbering) {

    public LayoutedPage {
        if (inner == null || margin == null || binding == null || fill == null) {
            throw new IllegalArgumentException("Body, margin, binding and fill are required");
        }
    }

    /**
     * Size of the whole page including margins.
     */
    public Size size() {
        return inner.size().plus(margin.sumByAxis());
    }
}
