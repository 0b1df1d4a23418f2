package com.largomodo.folio.geom;

/**
 * Horizontal alignment as written by the user. {@code START} and {@code END}
 * depend on the text direction.
 */
public enum HAlign {
    START,
    LEFT,
    CENTER,
    RIGHT,
    END;

    public FixedAlignment fix(Dir textDir) {
        return switch (this) {
            case START -> textDir.start();
            case END -> textDir.end();
            case LEFT -> FixedAlignment.START;
            case CENTER -> FixedAlignment.CENTER;
            case RIGHT -> FixedAlignment.END;
        };
    }
}
