package com.largomodo.folio.content;

import com.largomodo.folio.geom.Spacing;

/**
 * A child of a stack: spacing or a block. Exactly one component is set.
 */
public record StackChild(Spacing spacing, Pair block) {

    public StackChild {
        if ((spacing == null) == (block == null)) {
            throw new IllegalArgumentException("Stack child needs exactly one of spacing or block");
        }
    }

    public static StackChild spacing(Spacing spacing) {
        return new StackChild(spacing, null);
    }

    public static StackChild block(Pair block) {
        return new StackChild(null, block);
    }

    public boolean isSpacing() {
        return spacing != null;
    }
}
