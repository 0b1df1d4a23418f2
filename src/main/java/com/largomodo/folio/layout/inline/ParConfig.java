package com.largomodo.folio.layout.inline;

import com.largomodo.folio.content.Pair;
import com.largomodo.folio.content.ParElem;
import com.largomodo.folio.geom.Dir;
import com.largomodo.folio.geom.FixedAlignment;
import com.largomodo.folio.geom.Length;
import com.largomodo.folio.style.Costs;
import com.largomodo.folio.style.FirstLineIndent;
import com.largomodo.folio.style.JustificationLimits;
import com.largomodo.folio.style.LayoutKeys;
import com.largomodo.folio.style.Linebreaks;
import com.largomodo.folio.style.Numbering;
import com.largomodo.folio.style.ParKeys;
import com.largomodo.folio.style.StyleChain;
import com.largomodo.folio.style.StyleKey;
import com.largomodo.folio.style.TextKeys;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Paragraph-wide settings, resolved once before the text is laid out.
 *
 * @param justify             whether lines are stretched to the full width
 * @param linebreaks          the line-breaking mode
 * @param firstLineIndent     indent of the first line in points
 * @param hangingIndent       indent of all other lines in points
 * @param numberingMarker     line numbering pattern, null when lines are not numbered
 * @param align               horizontal alignment of the lines
 * @param fontSize            paragraph font size
 * @param dir                 base text direction
 * @param hyphenate           whether to hyphenate, empty when children disagree
 * @param lang                text language, empty when children disagree
 * @param fallback            whether font fallback is enabled
 * @param cjkLatinSpacing     whether CJK and Latin text get extra space between them
 * @param costs               line-break penalty weights
 * @param justificationLimits how far spaces may shrink or stretch
 * @param leading             gap between lines in points
 */
public record ParConfig(boolean justify,
                        Linebreaks linebreaks,
                        double firstLineIndent,
                        double hangingIndent,
                        Numbering numberingMarker,
                        FixedAlignment align,
                        double fontSize,
                        Dir dir,
                        Optional<Boolean> hyphenate,
                        Optional<String> lang,
                        boolean fallback,
                        boolean cjkLatinSpacing,
                        Costs costs,
                        JustificationLimits justificationLimits,
                        double leading) {

    /**
     * Resolves the settings of a paragraph. Arguments given to the paragraph win
     * over the shared styles.
     *
     * @param elem      the paragraph
     * @param shared    the styles the paragraph is laid out with
     * @param situation where the paragraph sits in its flow, null outside of a flow
     */
    public static ParConfig derive(ParElem elem, StyleChain shared, ParSituation situation) {
        double fontSize = shared.get(TextKeys.SIZE);
        Dir dir = shared.get(TextKeys.DIR);
        FixedAlignment align = shared.get(LayoutKeys.ALIGN).x().fix(dir);

        boolean justify = elem.justify() != null ? elem.justify() : shared.get(ParKeys.JUSTIFY);

        Linebreaks linebreaks = elem.linebreaks() != null
                ? elem.linebreaks()
                : shared.get(ParKeys.LINEBREAKS).orAuto(justify ? Linebreaks.OPTIMIZED : Linebreaks.SIMPLE);

        FirstLineIndent indent = elem.firstLineIndent() != null
                ? elem.firstLineIndent()
                : shared.get(ParKeys.FIRST_LINE_INDENT);
        double firstLineIndent = 0;
        if (!indent.amount().isZero()
                && indentApplies(indent, situation)
                && align == dir.start()
                && !shared.get(ParKeys.IN_TIGHT_LIST)) {
            firstLineIndent = indent.amount().at(fontSize);
        }

        Length hanging = elem.hangingIndent() != null ? elem.hangingIndent() : shared.get(ParKeys.HANGING_INDENT);
        double hangingIndent = situation != null ? hanging.at(fontSize) : 0;

        Optional<Boolean> hyphenate = uniform(elem, shared, TextKeys.HYPHENATE)
                .map(smart -> smart.orAuto(justify));
        Optional<String> lang = uniform(elem, shared, TextKeys.LANG);

        return new ParConfig(
                justify,
                linebreaks,
                firstLineIndent,
                hangingIndent,
                shared.get(ParKeys.LINE_NUMBERING),
                align,
                fontSize,
                dir,
                hyphenate,
                lang,
                shared.get(TextKeys.FALLBACK),
                shared.get(TextKeys.CJK_LATIN_SPACING),
                shared.get(TextKeys.COSTS),
                shared.get(ParKeys.JUSTIFICATION_LIMITS),
                shared.get(ParKeys.LEADING).at(fontSize));
    }

    private static boolean indentApplies(FirstLineIndent indent, ParSituation situation) {
        if (situation == null) {
            return false;
        }
        return switch (situation) {
            case CONSECUTIVE -> true;
            case FIRST, OTHER -> indent.all();
        };
    }

    /**
     * The value all children agree on, or empty if any two differ. A paragraph
     * without children uses the shared value.
     */
    private static <T> Optional<T> uniform(ParElem elem, StyleChain shared, StyleKey<T> key) {
        Function<Pair, T> lookup = child -> shared.chain(child.styles()).get(key);
        if (elem.children().isEmpty()) {
            return Optional.ofNullable(shared.get(key));
        }
        T first = lookup.apply(elem.children().get(0));
        for (Pair child : elem.children()) {
            if (!Objects.equals(first, lookup.apply(child))) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(first);
    }
}
