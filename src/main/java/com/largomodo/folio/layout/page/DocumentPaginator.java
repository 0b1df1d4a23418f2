package com.largomodo.folio.layout.page;

import com.largomodo.folio.content.Pair;
import com.largomodo.folio.content.PagebreakElem;
import com.largomodo.folio.content.TagElem;
import com.largomodo.folio.geom.Point;
import com.largomodo.folio.geom.TagItem;
import com.largomodo.folio.layout.LayoutException;
import com.largomodo.folio.style.StyleChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Turns a whole document into pages.
 * <p>
 * The document's children are split at page breaks into independent page runs,
 * which are laid out sequentially or on an executor. Parity fixes and tags
 * between pages are resolved afterwards in document order, since they depend
 * on the final page count.
 */
public class DocumentPaginator {

    private static final Logger log = LoggerFactory.getLogger(DocumentPaginator.class);

    private final PageRunLayouter runs;
    private final ExecutorService executor;
    private final PaginationObserver observer;

    public DocumentPaginator(PageRunLayouter runs) {
        this(runs, null, new PaginationObserver() {});
    }

    /**
     * @param runs     lays out single page runs
     * @param executor where to lay out runs in parallel, null to stay on the caller's thread
     * @param observer progress callbacks
     */
    public DocumentPaginator(PageRunLayouter runs, ExecutorService executor, PaginationObserver observer) {
        this.runs = runs;
        this.executor = executor;
        this.observer = observer;
    }

    /**
     * Lays out the document.
     *
     * @param children flow-level content and page breaks with absolute styles
     * @param styles   the document's styles
     * @return all pages in order, never empty
     * @throws LayoutException the first failure of any page run
     */
    public List<LayoutedPage> paginate(List<Pair> children, StyleChain styles) throws LayoutException {
        List<PageItem> items = collectPageItems(children, styles);
        List<List<LayoutedPage>> laidOut = layoutRuns(items);

        List<LayoutedPage> pages = new ArrayList<>();
        List<String> tags = new ArrayList<>();
        int run = 0;
        for (PageItem item : items) {
            if (item instanceof PageItem.Run) {
                for (LayoutedPage page : laidOut.get(run)) {
                    finish(page, pages, tags);
                }
                run++;
            } else if (item instanceof PageItem.ParityFix) {
                PageItem.ParityFix fix = (PageItem.ParityFix) item;
                if (!fix.parity().matches(pages.size())) {
                    continue;
                }
                log.debug("Adding a blank page after page {} for {} parity", pages.size(), fix.parity());
                finish(runs.layoutBlankPage(fix.initial()), pages, tags);
            } else if (item instanceof PageItem.Tags) {
                tags.addAll(((PageItem.Tags) item).labels());
            }
        }

        if (!tags.isEmpty() && !pages.isEmpty()) {
            LayoutedPage last = pages.get(pages.size() - 1);
            Point end = new Point(0, last.inner().height());
            for (String label : tags) {
                last.inner().push(end, new TagItem(label));
            }
        }

        log.info("Laid out {} pages from {} page runs", pages.size(), laidOut.size());
        return pages;
    }

    private void finish(LayoutedPage page, List<LayoutedPage> pages, List<String> tags) {
        for (String label : tags) {
            page.inner().push(Point.ZERO, new TagItem(label));
        }
        tags.clear();
        observer.onPage(pages.size(), page);
        pages.add(page);
    }

    /**
     * Splits the children at page breaks.
     * <p>
     * A strong page break while an empty page is staged produces a blank run,
     * weak ones never do. Every strong break stages an empty page, and real
     * content consumes it. Groups of nothing but tags do not make a page of
     * their own unless a staged page could not otherwise be dropped.
     */
    public static List<PageItem> collectPageItems(List<Pair> children, StyleChain styles) {
        List<PageItem> items = new ArrayList<>();
        StyleChain initial = styles;
        boolean staged = true;

        int i = 0;
        while (i < children.size()) {
            Pair child = children.get(i);
            if (child.content() instanceof PagebreakElem) {
                PagebreakElem pagebreak = (PagebreakElem) child.content();
                boolean strong = !pagebreak.weak();
                if (strong && staged) {
                    items.add(new PageItem.Run(List.of(), initial));
                }
                if (pagebreak.to() != null) {
                    items.add(new PageItem.ParityFix(pagebreak.to(), child.styles()));
                }
                // Boundary breaks carry the styles from before a page set rule.
                if (!pagebreak.boundary()) {
                    initial = child.styles();
                }
                staged |= strong;
                i++;
                continue;
            }

            int end = i;
            while (end < children.size() && !(children.get(end).content() instanceof PagebreakElem)) {
                end++;
            }
            List<Pair> group = children.subList(i, end);
            i = end;

            if (allTags(group) && !(staged && onlyBoundaryBreaks(children.subList(end, children.size())))) {
                List<String> labels = new ArrayList<>();
                for (Pair tag : group) {
                    labels.add(((TagElem) tag.content()).label());
                }
                items.add(new PageItem.Tags(labels));
                continue;
            }

            items.add(new PageItem.Run(group, initial));
            staged = false;
        }

        if (staged) {
            items.add(new PageItem.Run(List.of(), initial));
        }
        return items;
    }

    private static boolean allTags(List<Pair> group) {
        return group.stream().allMatch(pair -> pair.content() instanceof TagElem);
    }

    private static boolean onlyBoundaryBreaks(List<Pair> rest) {
        return rest.stream().allMatch(pair -> pair.content() instanceof PagebreakElem
                && ((PagebreakElem) pair.content()).boundary());
    }

    private List<List<LayoutedPage>> layoutRuns(List<PageItem> items) throws LayoutException {
        List<PageItem.Run> pending = new ArrayList<>();
        for (PageItem item : items) {
            if (item instanceof PageItem.Run) {
                pending.add((PageItem.Run) item);
            }
        }

        List<List<LayoutedPage>> results = new ArrayList<>(pending.size());
        if (executor == null) {
            for (int index = 0; index < pending.size(); index++) {
                results.add(layoutRun(index, pending.get(index)));
            }
            return results;
        }

        List<Future<List<LayoutedPage>>> futures = new ArrayList<>(pending.size());
        for (int index = 0; index < pending.size(); index++) {
            final int run = index;
            final PageItem.Run item = pending.get(index);
            futures.add(executor.submit(() -> layoutRun(run, item)));
        }

        try {
            for (Future<List<LayoutedPage>> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for page runs", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LayoutException) {
                throw (LayoutException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Page run failed", cause);
        } finally {
            for (Future<List<LayoutedPage>> future : futures) {
                future.cancel(true);
            }
        }
        return results;
    }

    private List<LayoutedPage> layoutRun(int index, PageItem.Run run) throws LayoutException {
        try {
            MDC.put("run", Integer.toString(index));
            observer.onRunStart(index, run.children().size());
            List<LayoutedPage> pages = runs.layoutPageRun(run.children(), run.initial());
            log.debug("Page run {} produced {} pages", index, pages.size());
            return pages;
        } catch (LayoutException | RuntimeException e) {
            observer.onRunFailure(index, e);
            throw e;
        } finally {
            MDC.remove("run");
        }
    }
}
