package com.largomodo.folio;

import com.largomodo.folio.content.Pair;
import com.largomodo.folio.geom.Align;
import com.largomodo.folio.geom.HAlign;
import com.largomodo.folio.geom.Rel;
import com.largomodo.folio.geom.TextItem;
import com.largomodo.folio.geom.VAlign;
import com.largomodo.folio.layout.ContentLayouter;
import com.largomodo.folio.layout.LayoutException;
import com.largomodo.folio.layout.inline.FixedPitchMetrics;
import com.largomodo.folio.layout.inline.InlineLayouter;
import com.largomodo.folio.layout.page.DocumentPaginator;
import com.largomodo.folio.layout.page.LayoutedPage;
import com.largomodo.folio.layout.page.Margin;
import com.largomodo.folio.layout.page.PageKeys;
import com.largomodo.folio.layout.page.PageRunLayouter;
import com.largomodo.folio.layout.page.PaginationObserver;
import com.largomodo.folio.layout.page.Paper;
import com.largomodo.folio.style.Numbering;
import com.largomodo.folio.style.ParKeys;
import com.largomodo.folio.style.Style;
import com.largomodo.folio.style.StyleChain;
import com.largomodo.folio.style.TextKeys;
import com.largomodo.folio.util.ChildSpecParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.*;

/**
 * Dry-run paginator for trying out page layout from the command line.
 * <p>
 * Builds a document from compact child notations, applies page options as
 * document-level set rules and prints a summary of every resulting page.
 */
@Command(
        name = "folio",
        mixinStandardHelpOptions = true,
        resourceBundle = "folio.folio",
        version = "${bundle:application.version}",
        header = "Paginates a document built from child notations.",
        description = {
                "Lays out paragraphs, spacing, blocks and page breaks into pages and prints",
                "the size and word count of each page.",
                "",
                "Children: par:TEXT, lines:N, v:AMOUNT, fr:N, block:HEIGHT,",
                "pagebreak[:odd|even], weakbreak, tag:LABEL"
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:Layout error",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class Folio implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(Folio.class);

    @Parameters(paramLabel = "CHILD", arity = "1..*",
            description = "Document children in order.")
    List<String> children;

    @Option(names = "--paper", defaultValue = "A4",
            description = {
                    "Paper size.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    Paper paper;

    @Option(names = "--width", description = "Page width in points, or 'auto' to fit the content. Overrides --paper.")
    String width;

    @Option(names = "--height", description = "Page height in points, or 'auto' to fit the content. Overrides --paper.")
    String height;

    @Option(names = "--flipped", description = "Swap page width and height")
    boolean flipped;

    @Option(names = "--margin", description = "Margin on all sides in points (default: relative to the page size)")
    Double margin;

    @Option(names = "--numbering", description = "Page numbering pattern, e.g. '1' or '1 / 1'")
    String numbering;

    @Option(names = "--number-align", defaultValue = "center-bottom",
            description = {
                    "Page number alignment as HORIZONTAL-VERTICAL.",
                    "Vertical 'top' puts the number into the header.",
                    "Default: ${DEFAULT-VALUE}"
            })
    String numberAlign;

    @Option(names = "--columns", defaultValue = "1", description = "Columns per page (default: ${DEFAULT-VALUE})")
    int columns;

    @Option(names = "--justify", description = "Justify paragraphs")
    boolean justify;

    @Option(names = "--font-size", defaultValue = "11", description = "Font size in points (default: ${DEFAULT-VALUE})")
    double fontSize;

    @Option(names = "--threads", defaultValue = "1", description = "Page runs laid out in parallel (default: ${DEFAULT-VALUE})")
    int threads;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new Folio());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (threads < 1) {
            throw new ParameterException(spec.commandLine(), "Thread count must be at least 1: " + threads);
        }
        if (!(fontSize > 0) || !Double.isFinite(fontSize)) {
            throw new ParameterException(spec.commandLine(), "Font size must be positive: " + fontSize);
        }

        StyleChain styles = StyleChain.of(pageStyles());
        List<Pair> document;
        try {
            document = ChildSpecParser.parseAll(children, styles);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }

        PageRunLayouter runs = new PageRunLayouter(
                new ContentLayouter(new InlineLayouter(), FixedPitchMetrics.DEFAULT));
        PrintWriter out = spec.commandLine().getOut();

        ExecutorService executor = threads > 1 ? new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        ) : null;

        PaginationObserver observer = new PaginationObserver() {
            @Override
            public void onRunFailure(int run, Exception e) {
                log.error("FAILED: page run {} - {}", run, e.getMessage());
            }
        };

        try {
            List<LayoutedPage> pages = new DocumentPaginator(runs, executor, observer).paginate(document, styles);
            for (int i = 0; i < pages.size(); i++) {
                out.println(describe(i + 1, pages.get(i)));
            }
            out.flush();
            log.info("Pagination complete: {} pages", pages.size());
            return 0;
        } catch (LayoutException e) {
            log.error("ERROR: {}", e.getMessage());
            return 1;
        } finally {
            if (executor != null) {
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    executor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * Maps the options to document-level set rules.
     */
    List<Style> pageStyles() {
        List<Style> styles = new ArrayList<>();
        styles.add(Style.set(PageKeys.WIDTH, dimension("--width", width, paper.width())));
        styles.add(Style.set(PageKeys.HEIGHT, dimension("--height", height, paper.height())));
        styles.add(Style.set(PageKeys.FLIPPED, flipped));
        if (margin != null) {
            if (margin < 0 || !Double.isFinite(margin)) {
                throw new ParameterException(spec.commandLine(), "Margin must be a non-negative number: " + margin);
            }
            styles.add(Style.set(PageKeys.MARGIN, Margin.all(Rel.pt(margin))));
        }
        if (numbering != null) {
            try {
                styles.add(Style.set(PageKeys.NUMBERING, new Numbering(numbering)));
            } catch (IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(), e.getMessage());
            }
        }
        styles.add(Style.set(PageKeys.NUMBER_ALIGN, align(numberAlign)));
        if (columns < 1) {
            throw new ParameterException(spec.commandLine(), "--columns must be at least 1: " + columns);
        }
        styles.add(Style.set(PageKeys.COLUMNS, columns));
        styles.add(Style.set(ParKeys.JUSTIFY, justify));
        styles.add(Style.set(TextKeys.SIZE, fontSize));
        return styles;
    }

    private double dimension(String option, String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        if ("auto".equalsIgnoreCase(value)) {
            return Double.POSITIVE_INFINITY;
        }
        try {
            double parsed = Double.parseDouble(value);
            if (!(parsed > 0) || !Double.isFinite(parsed)) {
                throw new ParameterException(spec.commandLine(), option + " must be positive or 'auto': " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ParameterException(spec.commandLine(), option + " must be a number or 'auto': " + value);
        }
    }

    private Align align(String value) {
        String[] parts = value.toUpperCase(Locale.ROOT).split("-");
        if (parts.length != 2) {
            throw new ParameterException(spec.commandLine(),
                    "--number-align must look like HORIZONTAL-VERTICAL, e.g. center-bottom: " + value);
        }
        try {
            return new Align(HAlign.valueOf(parts[0]), VAlign.valueOf(parts[1]));
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Unknown alignment in --number-align: " + value);
        }
    }

    private static String describe(int number, LayoutedPage page) {
        int words = page.inner().collect(TextItem.class).size();
        return String.format(Locale.ROOT, "Page %d: %.2f x %.2f pt, body %.2f x %.2f pt, %d words%s%s",
                number,
                page.size().width(), page.size().height(),
                page.inner().width(), page.inner().height(),
                words,
                page.header() != null ? ", header" : "",
                page.footer() != null ? ", footer" : "");
    }
}
