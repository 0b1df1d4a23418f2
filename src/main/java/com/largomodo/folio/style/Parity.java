package com.largomodo.folio.style;

/**
 * Which page number parity the next page should have.
 */
public enum Parity {
    EVEN,
    ODD;

    /**
     * Whether {@code number} has this parity.
     */
    public boolean matches(int number) {
        return switch (this) {
            case EVEN -> number % 2 == 0;
            case ODD -> number % 2 == 1;
        };
    }
}
