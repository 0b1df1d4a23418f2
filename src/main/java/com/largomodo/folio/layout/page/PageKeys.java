package com.largomodo.folio.layout.page;

import com.largomodo.folio.content.Content;
import com.largomodo.folio.geom.Align;
import com.largomodo.folio.geom.Rel;
import com.largomodo.folio.style.Numbering;
import com.largomodo.folio.style.Smart;
import com.largomodo.folio.style.StyleKey;

/**
 * Style properties of pages.
 */
public final class PageKeys {

    private static final String ELEMENT = "page";

    /** Page width; infinity makes the page as wide as its content. */
    public static final StyleKey<Double> WIDTH = StyleKey.of(ELEMENT, "width", Double.class, Paper.A4.width());
    /** Page height; infinity makes the page as tall as its content. */
    public static final StyleKey<Double> HEIGHT = StyleKey.of(ELEMENT, "height", Double.class, Paper.A4.height());
    /** Swaps width and height. */
    public static final StyleKey<Boolean> FLIPPED = StyleKey.of(ELEMENT, "flipped", Boolean.class, false);
    public static final StyleKey<Margin> MARGIN = StyleKey.of(ELEMENT, "margin", Margin.class, Margin.AUTO);
    /** Automatic binding follows the text direction. */
    public static final StyleKey<Smart<Binding>> BINDING =
            StyleKey.smart(ELEMENT, "binding", Binding.class, Smart.auto());
    /** Page background color. */
    public static final StyleKey<Smart<String>> FILL = StyleKey.smart(ELEMENT, "fill", String.class, Smart.auto());
    /** Automatic headers show the page number when it is aligned to the top. */
    public static final StyleKey<Smart<Content>> HEADER =
            StyleKey.smart(ELEMENT, "header", Content.class, Smart.auto());
    /** Automatic footers show the page number unless it is aligned to the top. */
    public static final StyleKey<Smart<Content>> FOOTER =
            StyleKey.smart(ELEMENT, "footer", Content.class, Smart.auto());
    /** Gap between the header and the body, relative to the top margin. */
    public static final StyleKey<Rel> HEADER_ASCENT = StyleKey.of(ELEMENT, "header-ascent", Rel.class, Rel.ratio(0.3));
    /** Gap between the body and the footer, relative to the bottom margin. */
    public static final StyleKey<Rel> FOOTER_DESCENT =
            StyleKey.of(ELEMENT, "footer-descent", Rel.class, Rel.ratio(0.3));
    /** Number of columns the body is split into. */
    public static final StyleKey<Integer> COLUMNS = StyleKey.of(ELEMENT, "columns", Integer.class, 1);
    /** Gap between columns, relative to the width of the body. */
    public static final StyleKey<Rel> COLUMN_GUTTER =
            StyleKey.of("columns", "gutter", Rel.class, Rel.ratio(0.04));
    public static final StyleKey<Content> BACKGROUND = StyleKey.of(ELEMENT, "background", Content.class, null);
    public static final StyleKey<Content> FOREGROUND = StyleKey.of(ELEMENT, "foreground", Content.class, null);
    public static final StyleKey<Numbering> NUMBERING = StyleKey.of(ELEMENT, "numbering", Numbering.class, null);
    /** The vertical part picks header or footer, the horizontal part aligns the number. */
    public static final StyleKey<Align> NUMBER_ALIGN =
            StyleKey.of(ELEMENT, "number-align", Align.class, Align.CENTER_BOTTOM);

    private PageKeys() {
    }
}
