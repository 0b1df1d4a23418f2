package com.largomodo.folio.layout.page;

import com.largomodo.folio.content.Content;
import com.largomodo.folio.content.Pair;
import com.largomodo.folio.content.PagebreakElem;
import com.largomodo.folio.content.ParElem;
import com.largomodo.folio.content.TagElem;
import com.largomodo.folio.geom.Length;
import com.largomodo.folio.geom.Point;
import com.largomodo.folio.geom.Positioned;
import com.largomodo.folio.geom.Rel;
import com.largomodo.folio.geom.Span;
import com.largomodo.folio.geom.TagItem;
import com.largomodo.folio.layout.ContentLayouter;
import com.largomodo.folio.layout.MarginalOverflowException;
import com.largomodo.folio.layout.inline.FixedPitchMetrics;
import com.largomodo.folio.layout.inline.InlineLayouter;
import com.largomodo.folio.style.ParKeys;
import com.largomodo.folio.style.Parity;
import com.largomodo.folio.style.Smart;
import com.largomodo.folio.style.Style;
import com.largomodo.folio.style.StyleChain;
import com.largomodo.folio.style.TextKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DocumentPaginatorTest {

    private PageRunLayouter runs;
    private StyleChain page;

    @BeforeEach
    void setUp() {
        runs = new PageRunLayouter(new ContentLayouter(new InlineLayouter(), FixedPitchMetrics.DEFAULT));
        page = StyleChain.of(
                Style.set(PageKeys.WIDTH, 200.0),
                Style.set(PageKeys.HEIGHT, 300.0),
                Style.set(PageKeys.MARGIN, Margin.all(Rel.pt(20))),
                Style.set(TextKeys.SIZE, 10.0),
                Style.set(ParKeys.LEADING, Length.pt(5)));
    }

    private Pair par(String text) {
        return new Pair(ParElem.of(text), page);
    }

    private Pair strong() {
        return new Pair(PagebreakElem.strong(), page);
    }

    private Pair weak() {
        return new Pair(PagebreakElem.weakBreak(), page);
    }

    private Pair to(Parity parity) {
        return new Pair(new PagebreakElem(false, parity, false, Span.DETACHED), page);
    }

    private Pair tag(String label) {
        return new Pair(TagElem.of(label), page);
    }

    private static long count(List<PageItem> items, Class<? extends PageItem> type) {
        return items.stream().filter(type::isInstance).count();
    }

    @Test
    void testEmptyDocumentHasOnePage() throws Exception {
        List<PageItem> items = DocumentPaginator.collectPageItems(List.of(), page);
        assertEquals(List.of(new PageItem.Run(List.of(), page)), items, "A single empty run");

        assertEquals(1, new DocumentPaginator(runs).paginate(List.of(), page).size(), "One blank page");
    }

    @Test
    void testStrongBreakStartsNewRun() {
        List<PageItem> items = DocumentPaginator.collectPageItems(List.of(par("a"), strong(), par("b")), page);

        assertEquals(2, items.size(), "Two runs");
        assertEquals(List.of(par("a")), ((PageItem.Run) items.get(0)).children(), "First run holds the first paragraph");
        assertEquals(List.of(par("b")), ((PageItem.Run) items.get(1)).children(), "Second run holds the second paragraph");
    }

    @Test
    void testStrongBreaksProduceEmptyPages() throws Exception {
        DocumentPaginator paginator = new DocumentPaginator(runs);

        assertEquals(2, paginator.paginate(List.of(strong()), page).size(), "A lone break separates two empty pages");
        assertEquals(2, paginator.paginate(List.of(par("a"), strong()), page).size(),
                "A trailing break leaves an empty last page");
        assertEquals(3, paginator.paginate(List.of(par("a"), strong(), strong(), par("b")), page).size(),
                "Consecutive breaks produce a blank page between them");
    }

    @Test
    void testWeakBreaksNeverProduceEmptyPages() throws Exception {
        DocumentPaginator paginator = new DocumentPaginator(runs);

        assertEquals(1, paginator.paginate(List.of(weak()), page).size(), "A lone weak break gives one page");
        assertEquals(1, paginator.paginate(List.of(par("a"), weak()), page).size(), "Trailing weak break is dropped");
        assertEquals(2, paginator.paginate(List.of(par("a"), weak(), weak(), par("b")), page).size(),
                "Repeated weak breaks collapse");
    }

    @Test
    void testOddParityAddsBlankPage() throws Exception {
        List<Pair> children = List.of(par("a"), to(Parity.ODD), par("b"));

        assertEquals(1, count(DocumentPaginator.collectPageItems(children, page), PageItem.ParityFix.class),
                "The break records its parity");

        List<LayoutedPage> pages = new DocumentPaginator(runs).paginate(children, page);
        assertEquals(3, pages.size(), "Page 3 is odd, so a blank page 2 is inserted");
        assertTrue(pages.get(1).inner().isEmpty(), "The inserted page is blank");
        assertFalse(pages.get(2).inner().isEmpty(), "Content continues on the odd page");
    }

    @Test
    void testEvenParityAfterFirstPageNeedsNoFix() throws Exception {
        List<LayoutedPage> pages = new DocumentPaginator(runs)
                .paginate(List.of(par("a"), to(Parity.EVEN), par("b")), page);

        assertEquals(2, pages.size(), "Page 2 is already even");
    }

    @Test
    void testBreakStylesApplyToFollowingEmptyPage() throws Exception {
        StyleChain narrow = page.chain(Style.set(PageKeys.WIDTH, 100.0));
        List<Pair> plain = List.of(par("a"), new Pair(PagebreakElem.strong(), narrow));
        List<Pair> boundary = List.of(par("a"), new Pair(new PagebreakElem(false, null, true, Span.DETACHED), narrow));

        DocumentPaginator paginator = new DocumentPaginator(runs);
        assertEquals(100, paginator.paginate(plain, page).get(1).size().width(), 1e-9,
                "The empty page after a break uses the break's styles");
        assertEquals(200, paginator.paginate(boundary, page).get(1).size().width(), 1e-9,
                "A boundary break keeps the previous styles");
    }

    @Test
    void testTagsBetweenPagesMoveToNextPage() throws Exception {
        List<Pair> children = List.of(par("a"), weak(), tag("t"), weak(), par("b"));

        List<PageItem> items = DocumentPaginator.collectPageItems(children, page);
        assertEquals(List.of("t"), ((PageItem.Tags) items.get(1)).labels(), "The tag group is kept apart");

        List<LayoutedPage> pages = new DocumentPaginator(runs).paginate(children, page);
        assertEquals(2, pages.size(), "Tags do not make a page of their own");
        assertTrue(pages.get(0).inner().collect(TagItem.class).isEmpty(), "First page has no tag");
        assertTrue(pages.get(1).inner().items().contains(new Positioned(Point.ZERO, new TagItem("t"))),
                "Tag sits at the start of the next page");
    }

    @Test
    void testTrailingTagsGoToEndOfLastPage() throws Exception {
        List<LayoutedPage> pages = new DocumentPaginator(runs)
                .paginate(List.of(par("a"), weak(), tag("end")), page);

        assertEquals(1, pages.size(), "No page is added for trailing tags");
        LayoutedPage last = pages.get(0);
        assertTrue(last.inner().items().contains(
                        new Positioned(new Point(0, last.inner().height()), new TagItem("end"))),
                "Tag sits at the bottom of the last page");
    }

    @Test
    void testObserverSeesRunsAndPages() throws Exception {
        PaginationObserver observer = mock(PaginationObserver.class);

        List<LayoutedPage> pages = new DocumentPaginator(runs, null, observer)
                .paginate(List.of(par("a"), strong(), par("b")), page);

        verify(observer).onRunStart(0, 1);
        verify(observer).onRunStart(1, 1);
        verify(observer).onPage(0, pages.get(0));
        verify(observer).onPage(1, pages.get(1));
        verify(observer, never()).onRunFailure(anyInt(), any(Exception.class));
    }

    @Test
    void testFailingRunIsReported() {
        PaginationObserver observer = mock(PaginationObserver.class);
        StyleChain tall = page.chain(Style.set(PageKeys.HEADER, Smart.<Content>of(ParElem.of("a\nb\nc"))));
        List<Pair> children = List.of(new Pair(ParElem.of("x"), tall));

        assertThrows(MarginalOverflowException.class,
                () -> new DocumentPaginator(runs, null, observer).paginate(children, tall));
        verify(observer).onRunFailure(eq(0), any(MarginalOverflowException.class));
    }

    @ParameterizedTest
    @EnumSource(Parity.class)
    void testExecutorMatchesSequentialLayout(Parity parity) throws Exception {
        List<Pair> children = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            children.add(par(String.join("\n", java.util.Collections.nCopies(5 + 7 * i, "line"))));
            children.add(to(parity));
        }

        List<LayoutedPage> sequential = new DocumentPaginator(runs).paginate(children, page);
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            List<LayoutedPage> parallel = new DocumentPaginator(runs, executor, new PaginationObserver() {})
                    .paginate(children, page);

            assertEquals(sequential.size(), parallel.size(), "Same page count on an executor");
            for (int i = 0; i < sequential.size(); i++) {
                assertEquals(sequential.get(i).inner().size(), parallel.get(i).inner().size(),
                        "Page " + i + " has the same body");
                assertEquals(sequential.get(i).inner().items().size(), parallel.get(i).inner().items().size(),
                        "Page " + i + " has the same content");
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testExecutorFailureKeepsItsType() {
        StyleChain tall = page.chain(Style.set(PageKeys.FOOTER, Smart.<Content>of(ParElem.of("a\nb\nc"))));
        List<Pair> children = List.of(par("a"), strong(), new Pair(ParElem.of("x"), tall));
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            MarginalOverflowException e = assertThrows(MarginalOverflowException.class,
                    () -> new DocumentPaginator(runs, executor, new PaginationObserver() {}).paginate(children, page));
            assertEquals("footer", e.marginal(), "The failing marginal is named");
        } finally {
            executor.shutdownNow();
        }
    }
}
