package com.largomodo.folio.style;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * An immutable list of style overrides, ordered from the outermost scope to the
 * innermost one. Lookups prefer inner styles.
 */
public final class StyleChain {

    private static final StyleChain EMPTY = new StyleChain(List.of());

    private final List<Style> styles;

    private StyleChain(List<Style> styles) {
        this.styles = styles;
    }

    public static StyleChain empty() {
        return EMPTY;
    }

    public static StyleChain of(Style... styles) {
        return of(Arrays.asList(styles));
    }

    public static StyleChain of(List<Style> styles) {
        return styles.isEmpty() ? EMPTY : new StyleChain(List.copyOf(styles));
    }

    /**
     * A new chain with the given styles nested inside this one.
     */
    public StyleChain chain(List<Style> inner) {
        if (inner.isEmpty()) {
            return this;
        }
        List<Style> combined = new ArrayList<>(styles.size() + inner.size());
        combined.addAll(styles);
        combined.addAll(inner);
        return new StyleChain(List.copyOf(combined));
    }

    public StyleChain chain(Style... inner) {
        return chain(Arrays.asList(inner));
    }

    public StyleChain chain(StyleChain inner) {
        return chain(inner.styles);
    }

    /**
     * The value of the innermost style setting {@code key}, or the key's fallback.
     *
     * @throws ClassCastException if the style holds a value of the wrong type
     */
    public <T> T get(StyleKey<T> key) {
        for (int i = styles.size() - 1; i >= 0; i--) {
            Style style = styles.get(i);
            if (style.key().equals(key)) {
                return key.cast(style.value());
            }
        }
        return key.fallback();
    }

    public boolean isSet(StyleKey<?> key) {
        return styles.stream().anyMatch(style -> style.key().equals(key));
    }

    public List<Style> styles() {
        return styles;
    }

    public int size() {
        return styles.size();
    }

    /**
     * The longest common prefix of the given chains, or empty when there are none.
     */
    public static Optional<StyleChain> trunk(Iterable<StyleChain> chains) {
        Iterator<StyleChain> it = chains.iterator();
        if (!it.hasNext()) {
            return Optional.empty();
        }
        List<Style> prefix = it.next().styles;
        int len = prefix.size();
        while (it.hasNext()) {
            len = Math.min(len, commonPrefixLength(prefix.subList(0, len), it.next().styles));
        }
        return Optional.of(of(prefix.subList(0, len)));
    }

    /**
     * How many leading styles the two chains share.
     */
    public static int commonPrefixLength(StyleChain a, StyleChain b) {
        return commonPrefixLength(a.styles, b.styles);
    }

    private static int commonPrefixLength(List<Style> a, List<Style> b) {
        int n = Math.min(a.size(), b.size());
        int i = 0;
        while (i < n && a.get(i).equals(b.get(i))) {
            i++;
        }
        return i;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return styles.equals(((StyleChain) o).styles);
    }

    @Override
    public int hashCode() {
        return styles.hashCode();
    }

    @Override
    public String toString() {
        return "StyleChain" + styles;
    }
}
