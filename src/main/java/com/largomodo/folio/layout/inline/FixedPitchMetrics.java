package com.largomodo.folio.layout.inline;

/**
 * Metrics of a monospaced font, given as fractions of the font size.
 */
public class FixedPitchMetrics implements TextMetrics {

    public static final FixedPitchMetrics DEFAULT = new FixedPitchMetrics(0.5, 0.8, 0.2);

    private final double advanceEm;
    private final double ascentEm;
    private final double descentEm;

    public FixedPitchMetrics(double advanceEm, double ascentEm, double descentEm) {
        if (advanceEm < 0 || ascentEm < 0 || descentEm < 0) {
            throw new IllegalArgumentException("Font metrics must be non-negative");
        }
        this.advanceEm = advanceEm;
        this.ascentEm = ascentEm;
        this.descentEm = descentEm;
    }

    @Override
    public double advance(int codePoint, double fontSize) {
        // Soft hyphens and zero-width characters take no space.
        if (codePoint == 0x00AD || codePoint == 0x200B || codePoint == '\n') {
            return 0;
        }
        return advanceEm * fontSize;
    }

    @Override
    public double ascent(double fontSize) {
        return ascentEm * fontSize;
    }

    @Override
    public double descent(double fontSize) {
        return descentEm * fontSize;
    }
}
