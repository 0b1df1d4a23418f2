package com.largomodo.folio.geom;

import java.util.function.Function;

/**
 * A pair of values, one per axis.
 *
 * @param x value for the horizontal axis
 * @param y value for the vertical axis
 * @param <T> component type
 */
public record Axes<T>(T x, T y) {

    public static <T> Axes<T> splat(T value) {
        return new Axes<>(value, value);
    }

    public T get(Axis axis) {
        return axis == Axis.X ? x : y;
    }

    public Axes<T> with(Axis axis, T value) {
        return axis == Axis.X ? new Axes<>(value, y) : new Axes<>(x, value);
    }

    public <R> Axes<R> map(Function<T, R> f) {
        return new Axes<>(f.apply(x), f.apply(y));
    }
}
