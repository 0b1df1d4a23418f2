package com.largomodo.folio.style;

/**
 * How far justification may shrink or stretch the spaces of a line, as ratios
 * of the normal space width.
 *
 * @param minSpacing smallest allowed space
 * @param maxSpacing largest allowed space
 */
public record JustificationLimits(double minSpacing, double maxSpacing) {

    public static final JustificationLimits DEFAULT = new JustificationLimits(2.0 / 3.0, 1.5);

    public JustificationLimits {
        if (minSpacing < 0 || maxSpacing < minSpacing) {
            throw new IllegalArgumentException(
                    "Invalid justification limits: " + minSpacing + ".." + maxSpacing);
        }
    }
}
