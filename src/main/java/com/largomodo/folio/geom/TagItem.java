package com.largomodo.folio.geom;

/**
 * An introspection marker placed between pages.
 */
public record TagItem(String label) implements FrameItem {
}
