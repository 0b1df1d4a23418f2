package com.largomodo.folio.layout.page;

import com.largomodo.folio.geom.Rel;

/**
 * Page margins. Null sides fall back to the automatic margin, which depends on
 * the page size. Sides are relative to the page width (left, right) or height
 * (top, bottom).
 *
 * @param left     left or inside margin
 * @param top      top margin
 * @param right    right or outside margin
 * @param bottom   bottom margin
 * @param twoSided whether left and right swap on even pages, null for automatic
 */
public record Margin(Rel left, Rel top, Rel right, Rel bottom, Boolean twoSided) {

    public static final Margin AUTO = new Margin(null, null, null, null, null);

    public static Margin all(Rel value) {
        return new Margin(value, value, value, value, null);
    }
}
