package com.largomodo.folio.layout.inline;

/**
 * Where a paragraph sits in its flow, relevant for the first-line indent.
 */
public enum ParSituation {
    /** The first paragraph of its container. */
    FIRST,
    /** Directly preceded by another paragraph. */
    CONSECUTIVE,
    /** Preceded by something other than a paragraph. */
    OTHER
}
