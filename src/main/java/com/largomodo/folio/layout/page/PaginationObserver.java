package com.largomodo.folio.layout.page;

/**
 * Observer interface for pagination progress.
 * <p>
 * All methods have default no-op implementations. Run callbacks may arrive from
 * worker threads when page runs are laid out in parallel; page callbacks arrive
 * in document order on the calling thread.
 */
public interface PaginationObserver {

    /**
     * Called before a page run is laid out.
     *
     * @param run        index of the run in the document
     * @param childCount number of children in the run
     */
    default void onRunStart(int run, int childCount) {}

    /**
     * Called for every finished page, in document order.
     *
     * @param pageIndex zero-based index of the page in the document
     * @param page      the page
     */
    default void onPage(int pageIndex, LayoutedPage page) {}

    /**
     * Called when a page run fails.
     *
     * @param run index of the run in the document
     * @param e   the failure
     */
    default void onRunFailure(int run, Exception e) {}
}
