package com.largomodo.folio.layout.page;

import com.largomodo.folio.content.Pair;
import com.largomodo.folio.content.TagElem;
import com.largomodo.folio.style.Style;
import com.largomodo.folio.style.StyleChain;

import java.util.ArrayList;
import java.util.List;

/**
 * Determines the styles of a page run.
 * <p>
 * The base are the styles shared by all children of the run, or the styles at
 * the page break when there are no children. Of those, a style is kept when it
 * was not produced inside a show rule and it either was already active at the
 * page break or comes from a set rule. Styles given directly to one element
 * never reach page level unless they were active at the break.
 */
public final class PageStyles {

    private PageStyles() {
    }

    public static StyleChain determine(List<Pair> children, StyleChain initial) {
        List<StyleChain> chains = new ArrayList<>();
        for (Pair child : children) {
            if (!(child.content() instanceof TagElem)) {
                chains.add(child.styles());
            }
        }
        StyleChain base = StyleChain.trunk(chains).orElse(initial);
        int trunkLen = StyleChain.commonPrefixLength(initial, base);

        List<Style> kept = new ArrayList<>();
        List<Style> styles = base.styles();
        for (int i = 0; i < styles.size(); i++) {
            Style style = styles.get(i);
            boolean atBreak = i < trunkLen;
            if (style.outside() && (atBreak || style.liftable())) {
                kept.add(style);
            }
        }
        return StyleChain.of(kept);
    }
}
