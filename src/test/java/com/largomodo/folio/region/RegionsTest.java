package com.largomodo.folio.region;

import com.largomodo.folio.geom.Axes;
import com.largomodo.folio.geom.Size;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RegionsTest {

    private static final Axes<Boolean> NO_EXPAND = Axes.splat(false);

    @Test
    void testSizesYieldsBacklogThenRepeatsLast() {
        Regions regions = new Regions(new Size(100, 50), NO_EXPAND, List.of(30.0), 80.0);

        List<Double> heights = regions.sizes().limit(5)
                .map(Size::height)
                .collect(Collectors.toList());

        assertEquals(List.of(50.0, 30.0, 80.0, 80.0, 80.0), heights,
                "Sizes should be the current region, the backlog, then the last height forever");
    }

    @Test
    void testSizesIsFiniteWithoutLast() {
        Regions regions = new Regions(new Size(100, 50), NO_EXPAND, List.of(30.0, 20.0), null);

        assertEquals(3, regions.sizes().count(), "Without a last height only current and backlog remain");
    }

    @Test
    void testNextConsumesBacklogThenLast() {
        Regions regions = new Regions(new Size(100, 50), NO_EXPAND, List.of(30.0), 80.0);

        regions.next();
        assertEquals(30.0, regions.height(), 1e-9, "First advance should take the backlog");
        assertEquals(30.0, regions.full(), 1e-9, "Full height follows the new region");

        regions.next();
        assertEquals(80.0, regions.height(), 1e-9, "Second advance should take the last height");
        assertTrue(regions.backlog().isEmpty(), "Backlog should be drained");
    }

    @Test
    void testNextWithoutFurtherRegionsKeepsState() {
        Regions regions = Regions.one(new Size(100, 50), NO_EXPAND);
        regions.setHeight(10);

        regions.next();

        assertEquals(10.0, regions.height(), 1e-9, "Advancing past the end should leave the region untouched");
        assertFalse(regions.mayBreak(), "A single region cannot break");
    }

    @Test
    void testRepeatMayProgressOnlyAfterConsumption() {
        Regions regions = Regions.repeat(new Size(100, 50), NO_EXPAND);

        assertTrue(regions.mayBreak(), "Repeated regions can always break");
        assertFalse(regions.mayProgress(), "A fresh repeated region gains nothing by advancing");

        regions.setHeight(20);
        assertTrue(regions.mayProgress(), "A partly used region gains space by advancing");
        assertFalse(regions.isFull(), "A region with space left is not full");

        regions.setHeight(0);
        assertTrue(regions.isFull(), "A used-up region with progress possible is full");
    }

    @Test
    void testIsFullRequiresProgress() {
        Regions regions = Regions.one(new Size(100, 0), NO_EXPAND);

        assertFalse(regions.isFull(), "An empty region that cannot progress is not full");
    }

    @Test
    void testBaseUsesFullHeight() {
        Regions regions = Regions.repeat(new Size(100, 50), NO_EXPAND);
        regions.setHeight(12);

        assertEquals(new Size(100, 50), regions.base(),
                "Base should combine current width with the full height");
    }

    @Test
    void testCopyIsIndependent() {
        Regions regions = new Regions(new Size(100, 50), NO_EXPAND, List.of(30.0), null);
        Regions copy = regions.copy();

        copy.setHeight(5);
        copy.next();

        assertEquals(50.0, regions.height(), 1e-9, "Original height must not change");
        assertEquals(List.of(30.0), regions.backlog(), "Original backlog must not change");
    }

    @Test
    void testMapTransformsAllRegions() {
        Regions regions = new Regions(new Size(100, 50), NO_EXPAND, List.of(30.0), 80.0);

        Regions mapped = regions.map(s -> new Size(s.width() - 10, s.height() - 5));

        assertEquals(90.0, mapped.width(), 1e-9, "Width should be mapped");
        assertEquals(45.0, mapped.height(), 1e-9, "Current height should be mapped");
        assertEquals(List.of(25.0), mapped.backlog(), "Backlog heights should be mapped");
        assertEquals(75.0, mapped.last().getAsDouble(), 1e-9, "Last height should be mapped");
    }

    @Property
    void backlogIsVisitedInOrder(@ForAll @net.jqwik.api.constraints.Size(max = 8) List<@DoubleRange(min = 0, max = 1000) Double> backlog) {
        Regions regions = new Regions(new Size(10, 1), NO_EXPAND, backlog, null);

        for (Double expected : backlog) {
            regions.next();
            assertEquals(expected, regions.height(), 1e-9, "Regions should follow the backlog in order");
        }
        assertEquals(1, regions.sizes().count(), "Draining the backlog should leave only the current region");
    }
}
