package com.largomodo.folio.style;

import com.largomodo.folio.geom.Dir;

/**
 * Style properties of text.
 */
public final class TextKeys {

    private static final String ELEMENT = "text";

    /** Font size in points. */
    public static final StyleKey<Double> SIZE = StyleKey.of(ELEMENT, "size", Double.class, 11.0);
    /** Writing direction of the text. */
    public static final StyleKey<Dir> DIR = StyleKey.of(ELEMENT, "dir", Dir.class, Dir.LTR);
    /** Language code, used for hyphenation and line breaking. */
    public static final StyleKey<String> LANG = StyleKey.of(ELEMENT, "lang", String.class, "en");
    /** Whether to hyphenate; automatic follows justification. */
    public static final StyleKey<Smart<Boolean>> HYPHENATE =
            StyleKey.smart(ELEMENT, "hyphenate", Boolean.class, Smart.auto());
    /** Text color. */
    public static final StyleKey<String> FILL = StyleKey.of(ELEMENT, "fill", String.class, "black");
    /** Whether to fall back to other fonts for missing glyphs. */
    public static final StyleKey<Boolean> FALLBACK = StyleKey.of(ELEMENT, "fallback", Boolean.class, true);
    /** Whether to add space between CJK and Latin characters. */
    public static final StyleKey<Boolean> CJK_LATIN_SPACING =
            StyleKey.of(ELEMENT, "cjk-latin-spacing", Boolean.class, true);
    /** Line-break penalty weights. */
    public static final StyleKey<Costs> COSTS = StyleKey.of(ELEMENT, "costs", Costs.class, Costs.DEFAULT);

    private TextKeys() {
    }
}
