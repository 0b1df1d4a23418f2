package com.largomodo.folio.style;

import java.util.Objects;
import java.util.function.Function;

/**
 * A named, typed style property with its default value.
 * <p>
 * Keys are identified by element and name. Values read from a style chain are
 * checked against the key's type, a mismatch fails with a {@link ClassCastException}.
 *
 * @param <T> value type
 */
public final class StyleKey<T> {

    private final String element;
    private final String name;
    private final T fallback;
    private final Function<Object, T> cast;

    private StyleKey(String element, String name, T fallback, Function<Object, T> cast) {
        if (element == null || name == null) {
            throw new IllegalArgumentException("Style key needs an element and a name");
        }
        this.element = element;
        this.name = name;
        this.fallback = fallback;
        this.cast = cast;
    }

    /**
     * @param element  the element the property belongs to, such as {@code "page"}
     * @param name     the property name
     * @param type     the value type
     * @param fallback the value used when no style in a chain sets the property, may be null
     */
    public static <T> StyleKey<T> of(String element, String name, Class<T> type, T fallback) {
        return new StyleKey<>(element, name, fallback, type::cast);
    }

    /**
     * A key whose value may be automatic, disabled or a custom value of {@code type}.
     */
    public static <T> StyleKey<Smart<T>> smart(String element, String name, Class<T> type, Smart<T> fallback) {
        return new StyleKey<>(element, name, fallback, value -> Smart.cast(value, type));
    }

    public String element() {
        return element;
    }

    public String name() {
        return name;
    }

    public T fallback() {
        return fallback;
    }

    /**
     * Checks that a style value belongs to this key.
     *
     * @throws ClassCastException if the value has the wrong type
     */
    public T cast(Object value) {
        return value == null ? null : cast.apply(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StyleKey<?> other = (StyleKey<?>) o;
        return element.equals(other.element) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(element, name);
    }

    @Override
    public String toString() {
        return element + "." + name;
    }
}
