package com.largomodo.folio.geom;

/**
 * A run of shaped text with its font size and measured advance.
 */
public record TextItem(String text, double fontSize, double width) implements FrameItem {
}
