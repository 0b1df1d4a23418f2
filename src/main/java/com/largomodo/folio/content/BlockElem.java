package com.largomodo.folio.content;

import com.largomodo.folio.geom.Span;

import java.util.List;

/**
 * A block-level container.
 * <p>
 * A block with a body lays the body out as a flow. A block without a body is
 * an opaque box of the given size that may be split across regions when
 * breakable.
 *
 * @param width     fixed width, null to fill or shrink as the region says
 * @param height    fixed height, null to fit the body
 * @param breakable whether the block may be split across regions
 * @param body      flow content, empty for an opaque box
 * @param span      origin
 */
public record BlockElem(Double width, Double height, boolean breakable, List<Pair> body, Span span)
        implements Content {

    public BlockElem {
        body = List.copyOf(body);
        if (height != null && height < 0) {
            throw new IllegalArgumentException("Block height cannot be negative: " + height);
        }
    }

    public static BlockElem sized(double width, double height) {
        return new BlockElem(width, height, false, List.of(), Span.DETACHED);
    }

    public static BlockElem wrapping(List<Pair> body) {
        return new BlockElem(null, null, true, body, Span.DETACHED);
    }
}
