package com.largomodo.folio.util;

import com.largomodo.folio.content.BlockElem;
import com.largomodo.folio.content.Content;
import com.largomodo.folio.content.Pair;
import com.largomodo.folio.content.PagebreakElem;
import com.largomodo.folio.content.ParElem;
import com.largomodo.folio.content.TagElem;
import com.largomodo.folio.content.VElem;
import com.largomodo.folio.geom.Span;
import com.largomodo.folio.geom.Spacing;
import com.largomodo.folio.style.Parity;
import com.largomodo.folio.style.StyleChain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the compact child notation of the command line into document content.
 * <p>
 * Recognized forms:
 * <ul>
 *   <li>{@code par:TEXT} a paragraph</li>
 *   <li>{@code lines:N} a paragraph of N forced lines</li>
 *   <li>{@code v:AMOUNT} vertical spacing in points</li>
 *   <li>{@code fr:N} fractional vertical spacing</li>
 *   <li>{@code block:HEIGHT} an opaque breakable block</li>
 *   <li>{@code pagebreak}, {@code pagebreak:odd}, {@code pagebreak:even}</li>
 *   <li>{@code weakbreak}</li>
 *   <li>{@code tag:LABEL}</li>
 * </ul>
 */
public class ChildSpecParser {

    private ChildSpecParser() {
        // Static utility class - prevent instantiation
    }

    /**
     * Parses all children, each styled with {@code styles}.
     *
     * @throws IllegalArgumentException on the first malformed child
     */
    public static List<Pair> parseAll(List<String> specs, StyleChain styles) {
        List<Pair> children = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            children.add(new Pair(parse(specs.get(i), new Span("child " + (i + 1))), styles));
        }
        return children;
    }

    /**
     * Parses one child.
     *
     * @param spec the notation
     * @param span where the child came from
     * @throws IllegalArgumentException if the notation is not recognized
     */
    public static Content parse(String spec, Span span) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Child cannot be blank");
        }
        int colon = spec.indexOf(':');
        String kind = (colon < 0 ? spec : spec.substring(0, colon)).toLowerCase(Locale.ROOT);
        String arg = colon < 0 ? null : spec.substring(colon + 1);

        return switch (kind) {
            case "par" -> ParElem.of(require(kind, arg)).withSpan(span);
            case "lines" -> ParElem.of(lines(positiveInt(kind, arg))).withSpan(span);
            case "v" -> new VElem(Spacing.pt(number(kind, arg)), span);
            case "fr" -> new VElem(Spacing.fr(number(kind, arg)), span);
            case "block" -> new BlockElem(null, number(kind, arg), true, List.of(), span);
            case "pagebreak" -> new PagebreakElem(false, parity(arg), false, span);
            case "weakbreak" -> new PagebreakElem(true, null, false, span);
            case "tag" -> new TagElem(require(kind, arg), span);
            default -> throw new IllegalArgumentException("Unknown child kind '" + kind + "' in: " + spec);
        };
    }

    private static String lines(int count) {
        StringBuilder text = new StringBuilder();
        for (int i = 1; i <= count; i++) {
            if (i > 1) {
                text.append('\n');
            }
            text.append("line").append(i);
        }
        return text.toString();
    }

    private static String require(String kind, String arg) {
        if (arg == null || arg.isEmpty()) {
            throw new IllegalArgumentException("'" + kind + "' needs an argument");
        }
        return arg;
    }

    private static double number(String kind, String arg) {
        String value = require(kind, arg);
        double number;
        try {
            number = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + kind + "' needs a number, got: " + value, e);
        }
        if (!Double.isFinite(number) || number < 0) {
            throw new IllegalArgumentException("'" + kind + "' needs a finite non-negative number, got: " + value);
        }
        return number;
    }

    private static int positiveInt(String kind, String arg) {
        String value = require(kind, arg);
        try {
            int number = Integer.parseInt(value);
            if (number < 1) {
                throw new IllegalArgumentException("'" + kind + "' needs a positive count, got: " + value);
            }
            return number;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + kind + "' needs a whole number, got: " + value, e);
        }
    }

    private static Parity parity(String arg) {
        if (arg == null) {
            return null;
        }
        return switch (arg.toLowerCase(Locale.ROOT)) {
            case "odd" -> Parity.ODD;
            case "even" -> Parity.EVEN;
            default -> throw new IllegalArgumentException("Page break parity must be odd or even, got: " + arg);
        };
    }
}
