package com.largomodo.folio.content;

import com.largomodo.folio.geom.Dir;
import com.largomodo.folio.geom.Span;
import com.largomodo.folio.geom.Spacing;

import java.util.List;

/**
 * Arranges children along one direction.
 *
 * @param dir      the stacking direction
 * @param spacing  spacing inserted between blocks, null for none
 * @param children spacing and blocks in order
 * @param span     origin
 */
public record StackElem(Dir dir, Spacing spacing, List<StackChild> children, Span span) implements Content {

    public StackElem {
        if (dir == null) {
            throw new IllegalArgumentException("Stack direction cannot be null");
        }
        children = List.copyOf(children);
    }

    public static StackElem of(Dir dir, List<StackChild> children) {
        return new StackElem(dir, null, children, Span.DETACHED);
    }
}
