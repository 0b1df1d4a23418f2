package com.largomodo.folio.style;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StyleChainTest {

    private static final StyleKey<Double> SIZE = StyleKey.of("text", "size", Double.class, 11.0);
    private static final StyleKey<String> FILL = StyleKey.of("text", "fill", String.class, "black");
    private static final StyleKey<Smart<Double>> WIDTH =
            StyleKey.smart("block", "width", Double.class, Smart.auto());

    @Test
    void testInnermostStyleWins() {
        StyleChain chain = StyleChain.of(Style.set(SIZE, 10.0)).chain(Style.set(SIZE, 14.0));

        assertEquals(14.0, chain.get(SIZE), "The innermost style should win");
    }

    @Test
    void testFallbackWhenUnset() {
        StyleChain chain = StyleChain.of(Style.set(SIZE, 10.0));

        assertEquals("black", chain.get(FILL), "Unset keys should resolve to their fallback");
        assertFalse(chain.isSet(FILL), "Fallbacks do not count as set");
    }

    @Test
    void testExplicitNoneOverridesFallback() {
        StyleChain chain = StyleChain.of(Style.set(FILL, null));

        assertNull(chain.get(FILL), "An explicit none should shadow the fallback");
        assertTrue(chain.isSet(FILL), "An explicit none counts as set");
    }

    @Test
    void testChainDoesNotModifyOuter() {
        StyleChain outer = StyleChain.of(Style.set(SIZE, 10.0));
        StyleChain inner = outer.chain(Style.set(FILL, "red"));

        assertEquals(1, outer.size(), "Outer chain should be unchanged");
        assertEquals(2, inner.size(), "Inner chain should hold both styles");
        assertSame(outer, outer.chain(List.of()), "Chaining nothing should return the same chain");
    }

    @Test
    void testTrunkIsLongestCommonPrefix() {
        Style a = Style.set(SIZE, 10.0);
        Style b = Style.set(FILL, "red");
        Style c = Style.set(FILL, "blue");
        StyleChain first = StyleChain.of(a, b);
        StyleChain second = StyleChain.of(a, c);
        StyleChain third = StyleChain.of(a, b, c);

        assertEquals(StyleChain.of(a), StyleChain.trunk(List.of(first, second, third)).orElseThrow(),
                "Trunk should be the shared prefix of all chains");
        assertEquals(first, StyleChain.trunk(List.of(first, third)).orElseThrow(),
                "A chain that prefixes the other is the trunk");
        assertTrue(StyleChain.trunk(List.of()).isEmpty(), "No chains should give no trunk");
    }

    @Test
    void testCommonPrefixLength() {
        Style a = Style.set(SIZE, 10.0);
        Style b = Style.set(FILL, "red");

        assertEquals(1, StyleChain.commonPrefixLength(StyleChain.of(a, b), StyleChain.of(a)),
                "Prefix length should stop at the shorter chain");
        assertEquals(0, StyleChain.commonPrefixLength(StyleChain.of(b), StyleChain.of(a)),
                "Different first styles share nothing");
    }

    @Test
    void testWrongValueTypeIsRejected() {
        StyleChain chain = StyleChain.of(new Style(SIZE, "large", true, true));

        assertThrows(ClassCastException.class, () -> chain.get(SIZE), "A string is not a size");
    }

    @Test
    void testSmartValuesAreChecked() {
        assertEquals(Smart.of(40.0), StyleChain.of(Style.set(WIDTH, Smart.of(40.0))).get(WIDTH),
                "A custom width should come back unchanged");
        assertTrue(StyleChain.of(Style.set(WIDTH, Smart.none())).get(WIDTH).isNone(),
                "A disabled width should stay disabled");

        StyleChain wrongInner = StyleChain.of(new Style(WIDTH, Smart.of("wide"), true, true));
        assertThrows(ClassCastException.class, () -> wrongInner.get(WIDTH), "A custom string is not a width");
        StyleChain notSmart = StyleChain.of(new Style(WIDTH, 40.0, true, true));
        assertThrows(ClassCastException.class, () -> notSmart.get(WIDTH), "A bare number is not a smart value");
    }

    @Test
    void testKeysAreIdentifiedByName() {
        assertEquals(SIZE, StyleKey.of("text", "size", Double.class, 12.0), "Same element and name");
        assertNotEquals(SIZE, StyleKey.of("par", "size", Double.class, 11.0), "Different element");
        assertEquals("text.size", SIZE.toString());
    }

    @Test
    void testSmartResolution() {
        assertEquals("x", Smart.<String>auto().orAuto("x"), "Auto should take the fallback");
        assertNull(Smart.<String>none().orAuto("x"), "None should resolve to null");
        assertTrue(Smart.none().isNone() && !Smart.auto().isNone(), "Only none is none");
        assertEquals("y", Smart.of("y").orAuto("x"), "Custom should keep its value");
        assertThrows(IllegalArgumentException.class, () -> Smart.of(null), "Custom null should be rejected");
    }

    @Test
    void testNumberingPieces() {
        assertEquals(1, new Numbering("1").pieces(), "A single counter symbol");
        assertEquals(2, new Numbering("1 / 1").pieces(), "Two counter symbols show both numbers");
        assertEquals(2, new Numbering("(i) of I").pieces(), "Roman counters count too");
    }

    @Test
    void testParityMatches() {
        assertTrue(Parity.ODD.matches(3), "Three is odd");
        assertFalse(Parity.ODD.matches(0), "Zero is not odd");
        assertTrue(Parity.EVEN.matches(0), "Zero is even");
    }
}
