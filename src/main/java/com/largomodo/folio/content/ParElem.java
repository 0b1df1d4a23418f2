package com.largomodo.folio.content;

import com.largomodo.folio.geom.Length;
import com.largomodo.folio.geom.Span;
import com.largomodo.folio.style.FirstLineIndent;
import com.largomodo.folio.style.Linebreaks;

import java.util.List;

/**
 * A paragraph of inline content.
 * <p>
 * The styles of each child are local: they apply on top of the styles the
 * paragraph itself is laid out with. The remaining components are arguments
 * given directly to the paragraph and are null when not given, in which case
 * the style chain decides.
 *
 * @param children        text and horizontal spacing
 * @param justify         explicit justification
 * @param linebreaks      explicit line-breaking mode
 * @param firstLineIndent explicit first-line indent
 * @param hangingIndent   explicit hanging indent
 * @param span            origin
 */
public record ParElem(List<Pair> children,
                      Boolean justify,
                      Linebreaks linebreaks,
                      FirstLineIndent firstLineIndent,
                      Length hangingIndent,
                      Span span) implements Content {

    public ParElem {
        children = List.copyOf(children);
    }

    public static ParElem of(List<Pair> children) {
        return new ParElem(children, null, null, null, null, Span.DETACHED);
    }

    public static ParElem of(String text) {
        return of(List.of(Pair.of(TextElem.of(text))));
    }

    public ParElem withJustify(boolean value) {
        return new ParElem(children, value, linebreaks, firstLineIndent, hangingIndent, span);
    }

    public ParElem withLinebreaks(Linebreaks value) {
        return new ParElem(children, justify, value, firstLineIndent, hangingIndent, span);
    }

    public ParElem withSpan(Span value) {
        return new ParElem(children, justify, linebreaks, firstLineIndent, hangingIndent, value);
    }
}
