package com.largomodo.folio.style;

/**
 * A numbering pattern such as {@code "1"}, {@code "i"} or {@code "1 / 1"}.
 * <p>
 * Each counting symbol in the pattern consumes one number when the pattern is
 * applied. Formatting itself happens after layout, once page numbers are known.
 *
 * @param pattern the pattern text
 */
public record Numbering(String pattern) {

    private static final String COUNTING_SYMBOLS = "1aAiI*";

    public Numbering {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Numbering pattern cannot be empty");
        }
    }

    /**
     * Number of counting symbols in the pattern.
     */
    public int pieces() {
        int count = 0;
        for (int i = 0; i < pattern.length(); i++) {
            if (COUNTING_SYMBOLS.indexOf(pattern.charAt(i)) >= 0) {
                count++;
            }
        }
        return count;
    }
}
