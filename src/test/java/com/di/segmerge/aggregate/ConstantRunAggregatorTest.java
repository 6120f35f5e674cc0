package com.di.segmerge.aggregate;

import com.di.segmerge.SegmentFixtures;
import com.di.segmerge.table.SegmentTable;
import com.di.segmerge.util.CellValues;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.di.segmerge.SegmentFixtures.LAYOUT;
import static com.di.segmerge.SegmentFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConstantRunAggregator Tests")
class ConstantRunAggregatorTest {

    private final SegmentFixtures fixtures = new SegmentFixtures();
    private final ConstantRunAggregator aggregator = fixtures.constantRuns;

    private final SegmentTable table = SegmentTable.builder("id", "t1", "t2", "v")
            .addRow("a", 10, 20, 1)
            .addRow("a", 0, 5, 1)
            .addRow("a", 5, 10, 1.0)
            .addRow("a", 20, 25, 2)
            .addRow("a", 30, 40, 2)
            .addRow("b", 0, 5, 1)
            .addRow("b", 5, 6, null)
            .addRow("b", 6, 7, null)
            .build();

    @Test
    @DisplayName("Should collapse contiguous runs with equal payload")
    void testAggregate() {
        SegmentTable out = aggregator.aggregate(table, LAYOUT);
        assertEquals(List.of("id", "t1", "t2", "v"), out.columns());
        assertEquals(List.of(
                Arrays.asList("a", 0, 20, 1),
                Arrays.asList("a", 20, 25, 2),
                Arrays.asList("a", 30, 40, 2),
                Arrays.asList("b", 0, 5, 1),
                Arrays.asList("b", 5, 7, null)), rows(out));
    }

    @Test
    @DisplayName("Should never leave two contiguous rows with the same payload")
    void testAggregate_NoAdjacentDuplicates() {
        SegmentTable out = aggregator.aggregate(table, LAYOUT);
        for (int i = 1; i < out.size(); i++) {
            boolean sameTrack = out.get(i, "id").equals(out.get(i - 1, "id"));
            boolean contiguous = CellValues.same(out.get(i, "t1"), out.get(i - 1, "t2"));
            boolean samePayload = CellValues.same(out.get(i, "v"), out.get(i - 1, "v"));
            assertFalse(sameTrack && contiguous && samePayload, "rows " + (i - 1) + " and " + i);
        }
    }

    @Test
    @DisplayName("Should return the input itself when nothing collapses")
    void testAggregate_Nothing() {
        SegmentTable distinct = SegmentTable.builder("id", "t1", "t2", "v")
                .addRow("a", 0, 5, 1)
                .addRow("a", 5, 10, 2)
                .addRow("a", 12, 15, 2)
                .build();
        assertSame(distinct, aggregator.aggregate(distinct, LAYOUT));
    }

    @Test
    @DisplayName("Should keep every payload column when comparing rows")
    void testAggregate_SeveralPayloadColumns() {
        SegmentTable t = SegmentTable.builder("v", "id", "t1", "t2", "w")
                .addRow("x", "a", 0, 1, 1)
                .addRow("x", "a", 1, 2, 2)
                .addRow("x", "a", 2, 3, 2)
                .build();
        SegmentTable out = aggregator.aggregate(t, LAYOUT);
        assertEquals(List.of("v", "id", "t1", "t2", "w"), out.columns());
        assertEquals(List.of(
                Arrays.asList("x", "a", 0, 1, 1),
                Arrays.asList("x", "a", 1, 3, 2)), rows(out));
    }
}
