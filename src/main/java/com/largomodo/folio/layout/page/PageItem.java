package com.largomodo.folio.layout.page;

import com.largomodo.folio.content.Pair;
import com.largomodo.folio.style.Parity;
import com.largomodo.folio.style.StyleChain;

import java.util.List;

/**
 * One piece of a document after splitting it at page breaks.
 */
public interface PageItem {

    /**
     * Children sharing one page configuration. Runs are independent of each
     * other and may be laid out in parallel.
     *
     * @param children the run's content, empty for a blank page
     * @param initial  the styles at the page break before the run
     */
    record Run(List<Pair> children, StyleChain initial) implements PageItem {

        public Run {
            children = List.copyOf(children);
        }
    }

    /**
     * Adds a blank page when the number of pages so far matches the parity.
     * Needs the concrete page count, so it is resolved sequentially.
     */
    record ParityFix(Parity parity, StyleChain initial) implements PageItem {
    }

    /**
     * Tags between pages, attached to the next page or to the end of the last.
     */
    record Tags(List<String> labels) implements PageItem {

        public Tags {
            labels = List.copyOf(labels);
        }
    }
}
