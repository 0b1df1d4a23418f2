package com.largomodo.folio.geom;

/**
 * A nested frame.
 */
public record GroupItem(Frame frame) implements FrameItem {

    public GroupItem {
        if (frame == null) {
            throw new IllegalArgumentException("Frame cannot be null");
        }
    }
}
