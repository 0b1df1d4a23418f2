package com.largomodo.folio.layout.page;

/**
 * The side of a page at which it is bound.
 */
public enum Binding {
    LEFT,
    RIGHT
}
