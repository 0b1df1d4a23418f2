package com.largomodo.folio.style;

import java.util.Objects;
import java.util.Optional;

/**
 * A property value that can be left automatic, explicitly disabled, or set.
 *
 * @param <T> type of a custom value
 */
public final class Smart<T> {

    private enum Kind { AUTO, NONE, CUSTOM }

    private final Kind kind;
    private final T value;

    private Smart(Kind kind, T value) {
        this.kind = kind;
        this.value = value;
    }

    public static <T> Smart<T> auto() {
        return new Smart<>(Kind.AUTO, null);
    }

    public static <T> Smart<T> none() {
        return new Smart<>(Kind.NONE, null);
    }

    public static <T> Smart<T> of(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Custom value cannot be null, use none()");
        }
        return new Smart<>(Kind.CUSTOM, value);
    }

    /**
     * Checks that {@code value} is a smart value whose custom part, if any, has the given type.
     *
     * @throws ClassCastException otherwise
     */
    static <T> Smart<T> cast(Object value, Class<T> type) {
        Smart<?> smart = (Smart<?>) value;
        return new Smart<>(smart.kind, type.cast(smart.value));
    }

    public boolean isAuto() {
        return kind == Kind.AUTO;
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    /**
     * The custom value, empty when automatic or disabled.
     */
    public Optional<T> custom() {
        return Optional.ofNullable(value);
    }

    /**
     * The custom value, or {@code fallback} when automatic. Disabled yields null.
     */
    public T orAuto(T fallback) {
        return switch (kind) {
            case AUTO -> fallback;
            case NONE -> null;
            case CUSTOM -> value;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Smart<?> other = (Smart<?>) o;
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.CUSTOM ? "Smart(" + value + ")" : kind.name().toLowerCase();
    }
}
