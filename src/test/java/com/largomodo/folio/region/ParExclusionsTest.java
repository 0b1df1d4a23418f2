package com.largomodo.folio.region;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class ParExclusionsTest {

    private ParExclusions exclusions;

    @BeforeEach
    void setUp() {
        // A float 20 tall at offset 10 taking 5 from the left.
        exclusions = ParExclusions.fromWrapFloats(0, 100, List.of(new WrapFloat(10, 20, 5, 0)));
    }

    @Test
    void testAvailableWidthInsideAndOutsideZone() {
        assertEquals(95.0, exclusions.availableWidth(100, 15), 1e-9, "Lines next to the float lose its width");
        assertEquals(100.0, exclusions.availableWidth(100, 5), 1e-9, "Lines above the float keep the full width");
        assertEquals(100.0, exclusions.availableWidth(100, 30), 1e-9, "The zone end is exclusive");
    }

    @Test
    void testHasExclusionAt() {
        assertTrue(exclusions.hasExclusionAt(25), "Offset 25 lies inside the zone from 10 to 30");
        assertTrue(exclusions.hasExclusionAt(10), "The zone start is inclusive");
        assertFalse(exclusions.hasExclusionAt(30), "The zone end is exclusive");
        assertFalse(exclusions.hasExclusionAt(35), "Offset 35 lies below the zone");
    }

    @Test
    void testNextBoundary() {
        assertEquals(OptionalDouble.of(10), exclusions.nextBoundary(0), "The zone start is the first boundary");
        assertEquals(OptionalDouble.of(30), exclusions.nextBoundary(10), "The zone end follows the start");
        assertTrue(exclusions.nextBoundary(30).isEmpty(), "Nothing changes after the last zone");
    }

    @Test
    void testLeftOffset() {
        assertEquals(5.0, exclusions.leftOffset(15), 1e-9, "Lines next to a left float start after it");
        assertEquals(0.0, exclusions.leftOffset(40), 1e-9, "Lines below the float start at the edge");
    }

    @Test
    void testMinWidthOverBand() {
        assertEquals(95.0, exclusions.minWidthOver(100, 0, 12), 1e-9,
                "A line reaching into the zone gets the narrower width");
        assertEquals(100.0, exclusions.minWidthOver(100, 0, 10), 1e-9,
                "A line ending exactly at the zone start is not affected");
        assertEquals(5.0, exclusions.maxLeftOffsetOver(0, 12), 1e-9,
                "The left offset follows the widest overlap in the band");
    }

    @Test
    void testOverlappingZonesTakeWidestPerSide() {
        ParExclusions both = ParExclusions.fromWrapFloats(0, 100, List.of(
                new WrapFloat(0, 50, 10, 0),
                new WrapFloat(20, 10, 30, 0),
                new WrapFloat(20, 40, 0, 15)));

        assertEquals(55.0, both.availableWidth(100, 25), 1e-9, "Widest left plus widest right are removed");
        assertEquals(75.0, both.availableWidth(100, 40), 1e-9, "Only overlapping zones count");
    }

    @Test
    void testWidthNeverNegative() {
        ParExclusions wide = ParExclusions.fromWrapFloats(0, 100, List.of(new WrapFloat(0, 10, 80, 80)));

        assertEquals(0.0, wide.availableWidth(100, 5), 1e-9, "Available width is floored at zero");
    }

    @Test
    void testFloatsAreClampedToParagraph() {
        ParExclusions clamped = ParExclusions.fromWrapFloats(20, 100, List.of(new WrapFloat(10, 20, 5, 0)));

        assertEquals(1, clamped.zones().size(), "The overlapping float should produce a zone");
        assertEquals(95.0, clamped.availableWidth(100, 5), 1e-9, "Zone starts at the paragraph top");
        assertEquals(100.0, clamped.availableWidth(100, 10), 1e-9, "Zone ends where the float ends");
    }

    @Test
    void testNonOverlappingFloatsAreDropped() {
        ParExclusions dropped = ParExclusions.fromWrapFloats(50, 20, List.of(
                new WrapFloat(0, 50, 5, 0),
                new WrapFloat(70, 10, 5, 0)));

        assertTrue(dropped.isEmpty(), "Floats above or below the paragraph should not create zones");
        assertSame(ParExclusions.none(), dropped, "No zones should give the shared empty instance");
    }
}
