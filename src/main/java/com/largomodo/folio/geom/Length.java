package com.largomodo.folio.geom;

/**
 * A length made of an absolute part and a font-relative part.
 *
 * @param abs absolute part in points
 * @param em  part relative to the font size
 */
public record Length(double abs, double em) {

    public static final Length ZERO = new Length(0, 0);

    public static Length pt(double value) {
        return new Length(value, 0);
    }

    public static Length em(double value) {
        return new Length(0, value);
    }

    public double at(double fontSize) {
        return em == 0 ? abs : abs + em * fontSize;
    }

    public boolean isZero() {
        return abs == 0 && em == 0;
    }
}
