package com.largomodo.folio.style;

/**
 * Weights for line-break penalties, as ratios of the default cost.
 *
 * @param hyphenation cost of breaking a word with a hyphen
 * @param runt        cost of a last line holding a single word
 */
public record Costs(double hyphenation, double runt) {

    public static final Costs DEFAULT = new Costs(1.0, 1.0);

    public Costs {
        if (hyphenation < 0 || runt < 0) {
            throw new IllegalArgumentException("Costs must be non-negative");
        }
    }
}
