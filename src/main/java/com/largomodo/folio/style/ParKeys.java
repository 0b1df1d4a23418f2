package com.largomodo.folio.style;

import com.largomodo.folio.geom.Length;

/**
 * Style properties of paragraphs.
 */
public final class ParKeys {

    private static final String ELEMENT = "par";

    public static final StyleKey<Boolean> JUSTIFY = StyleKey.of(ELEMENT, "justify", Boolean.class, false);
    public static final StyleKey<Smart<Linebreaks>> LINEBREAKS =
            StyleKey.smart(ELEMENT, "linebreaks", Linebreaks.class, Smart.auto());
    public static final StyleKey<FirstLineIndent> FIRST_LINE_INDENT =
            StyleKey.of(ELEMENT, "first-line-indent", FirstLineIndent.class, FirstLineIndent.NONE);
    public static final StyleKey<Length> HANGING_INDENT =
            StyleKey.of(ELEMENT, "hanging-indent", Length.class, Length.ZERO);
    /** Gap between the lines of a paragraph. */
    public static final StyleKey<Length> LEADING = StyleKey.of(ELEMENT, "leading", Length.class, Length.em(0.65));
    /** Gap between paragraphs. */
    public static final StyleKey<Length> SPACING = StyleKey.of(ELEMENT, "spacing", Length.class, Length.em(1.2));
    public static final StyleKey<JustificationLimits> JUSTIFICATION_LIMITS =
            StyleKey.of(ELEMENT, "justification-limits", JustificationLimits.class, JustificationLimits.DEFAULT);
    /** Pattern for numbering lines, null when lines are not numbered. */
    public static final StyleKey<Numbering> LINE_NUMBERING =
            StyleKey.of(ELEMENT + ".line", "numbering", Numbering.class, null);
    /** Set by tight lists on the bodies of their items. */
    public static final StyleKey<Boolean> IN_TIGHT_LIST = StyleKey.of("list", "tight-body", Boolean.class, false);

    private ParKeys() {
    }
}
