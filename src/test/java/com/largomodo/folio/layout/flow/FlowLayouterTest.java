package com.largomodo.folio.layout.flow;

import com.largomodo.folio.content.BlockElem;
import com.largomodo.folio.content.Content;
import com.largomodo.folio.content.HElem;
import com.largomodo.folio.content.Pair;
import com.largomodo.folio.content.PagebreakElem;
import com.largomodo.folio.content.ParElem;
import com.largomodo.folio.content.PlaceElem;
import com.largomodo.folio.content.TagElem;
import com.largomodo.folio.content.VElem;
import com.largomodo.folio.geom.Axes;
import com.largomodo.folio.geom.Fragment;
import com.largomodo.folio.geom.Frame;
import com.largomodo.folio.geom.GroupItem;
import com.largomodo.folio.geom.HAlign;
import com.largomodo.folio.geom.Length;
import com.largomodo.folio.geom.Positioned;
import com.largomodo.folio.geom.Size;
import com.largomodo.folio.geom.Spacing;
import com.largomodo.folio.geom.Span;
import com.largomodo.folio.geom.TextItem;
import com.largomodo.folio.layout.ContentLayouter;
import com.largomodo.folio.layout.LayoutException;
import com.largomodo.folio.layout.inline.FixedPitchMetrics;
import com.largomodo.folio.layout.inline.InlineLayouter;
import com.largomodo.folio.region.Regions;
import com.largomodo.folio.style.FirstLineIndent;
import com.largomodo.folio.style.LayoutKeys;
import com.largomodo.folio.style.ParKeys;
import com.largomodo.folio.style.Style;
import com.largomodo.folio.style.StyleChain;
import com.largomodo.folio.style.TextKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Flow layout at 10pt: lines are 10pt tall with 5pt leading, paragraphs are
 * 7pt apart and blocks 4pt.
 */
class FlowLayouterTest {

    private static final StyleChain STYLES = StyleChain.of(
            Style.set(TextKeys.SIZE, 10.0),
            Style.set(ParKeys.LEADING, Length.pt(5)),
            Style.set(ParKeys.SPACING, Length.pt(7)),
            Style.set(LayoutKeys.BLOCK_SPACING, Length.pt(4)));
    private static final Axes<Boolean> EXPAND_X = new Axes<>(true, false);

    private FlowLayouter flow;

    @BeforeEach
    void setUp() {
        flow = new ContentLayouter(new InlineLayouter(), FixedPitchMetrics.DEFAULT).flow();
    }

    private static List<Pair> children(StyleChain styles, Content... contents) {
        List<Pair> pairs = new ArrayList<>();
        for (Content content : contents) {
            pairs.add(new Pair(content, styles));
        }
        return pairs;
    }

    private Frame layout(List<Pair> children) throws LayoutException {
        return flow.layout(children, STYLES, Regions.one(new Size(100, 500), EXPAND_X), Span.DETACHED).intoFrame();
    }

    private static List<Positioned> groups(Frame frame) {
        List<Positioned> groups = new ArrayList<>();
        for (Positioned positioned : frame.items()) {
            if (positioned.item() instanceof GroupItem) {
                groups.add(positioned);
            }
        }
        return groups;
    }

    private static Frame frameOf(Positioned positioned) {
        return ((GroupItem) positioned.item()).frame();
    }

    /** X offset of the first word in each line of a paragraph frame. */
    private static List<Double> lineStarts(Frame paragraph) {
        List<Double> starts = new ArrayList<>();
        for (Positioned line : paragraph.items()) {
            for (Positioned item : frameOf(line).items()) {
                if (item.item() instanceof TextItem) {
                    starts.add(item.position().x());
                    break;
                }
            }
        }
        return starts;
    }

    @Test
    void testParagraphSpacingGoesBetweenParagraphs() throws Exception {
        Frame frame = layout(children(STYLES, ParElem.of("ab"), ParElem.of("cd")));

        assertEquals(27.0, frame.height(), 1e-9, "Two lines with paragraph spacing between, none around");
        assertEquals(17.0, groups(frame).get(1).position().y(), 1e-9, "Second paragraph follows the spacing");
    }

    @Test
    void testExplicitSpacingReplacesParagraphSpacing() throws Exception {
        Frame frame = layout(children(STYLES,
                ParElem.of("ab"), VElem.of(Spacing.pt(3)), ParElem.of("cd")));

        assertEquals(23.0, frame.height(), 1e-9, "Explicit spacing should replace the paragraph spacing");
    }

    @Test
    void testBlockSpacingAfterBlocks() throws Exception {
        Frame frame = layout(children(STYLES,
                ParElem.of("ab"), BlockElem.sized(50, 20), ParElem.of("cd")));

        assertEquals(51.0, frame.height(), 1e-9, "Paragraph spacing before the block, block spacing after it");
    }

    @Test
    void testTagsDoNotInterruptSpacing() throws Exception {
        Frame frame = layout(children(STYLES, ParElem.of("ab"), TagElem.of("t"), ParElem.of("cd")));

        assertEquals(27.0, frame.height(), 1e-9, "A tag should not affect layout");
    }

    @Test
    void testHorizontalSpacingIsSkipped() throws Exception {
        Frame frame = layout(children(STYLES, new HElem(10, Span.DETACHED), ParElem.of("ab")));

        assertEquals(10.0, frame.height(), 1e-9, "Horizontal spacing outside a paragraph takes no room");
    }

    @Test
    void testPagebreakInFlowFails() {
        LayoutException e = assertThrows(LayoutException.class,
                () -> layout(children(STYLES, ParElem.of("ab"), PagebreakElem.strong())),
                "Pagebreaks cannot appear inside a flow");
        assertTrue(e.getMessage().contains("pagebreaks are not allowed inside of containers"),
                "Message should explain the problem: " + e.getMessage());
    }

    @Test
    void testFirstLineIndentFollowsSituation() throws Exception {
        StyleChain indented = STYLES.chain(
                Style.set(ParKeys.FIRST_LINE_INDENT, new FirstLineIndent(Length.pt(10), false)));

        Frame frame = layout(children(indented,
                ParElem.of("ab"), ParElem.of("cd"), BlockElem.sized(50, 20), ParElem.of("ef")));

        List<Positioned> groups = groups(frame);
        assertEquals(List.of(0.0), lineStarts(frameOf(groups.get(0))), "First paragraph is not indented");
        assertEquals(List.of(10.0), lineStarts(frameOf(groups.get(1))), "Consecutive paragraph is indented");
        assertEquals(List.of(0.0), lineStarts(frameOf(groups.get(3))), "Paragraph after a block is not indented");
    }

    @Test
    void testParagraphWrapsAroundFloat() throws Exception {
        PlaceElem place = new PlaceElem(new Pair(BlockElem.sized(30, 25), STYLES), HAlign.START,
                Length.pt(5), Span.DETACHED);

        Frame frame = layout(children(STYLES, place, ParElem.of("ab\ncd\nef")));

        List<Positioned> groups = groups(frame);
        assertEquals(2, groups.size(), "Float and paragraph should both be placed");
        assertEquals(0.0, groups.get(0).position().y(), 1e-9, "Float sits at the top");
        assertEquals(List.of(35.0, 35.0, 0.0), lineStarts(frameOf(groups.get(1))),
                "Lines next to the float start after it and its clearance");
        assertEquals(40.0, frame.height(), 1e-9, "The float takes no room in the flow");
    }

    @Test
    void testFlowSpansRegions() throws Exception {
        Fragment fragment = flow.layout(children(STYLES, ParElem.of("a\nb\nc\nd\ne")), STYLES,
                Regions.repeat(new Size(100, 30), EXPAND_X), Span.DETACHED);

        assertEquals(3, fragment.size(), "Five lines at two per region need three regions");
    }
}
