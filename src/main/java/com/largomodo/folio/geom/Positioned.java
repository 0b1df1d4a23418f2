package com.largomodo.folio.geom;

/**
 * An item together with its position in the parent frame.
 */
public record Positioned(Point position, FrameItem item) {
}
