package com.di.segmerge.aggregate;

import com.di.segmerge.SegmentFixtures;
import com.di.segmerge.exception.SchemaException;
import com.di.segmerge.table.SegmentTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;

import static com.di.segmerge.SegmentFixtures.LAYOUT;
import static com.di.segmerge.SegmentFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RegularSegmentation Tests")
class RegularSegmentationTest {

    private final SegmentFixtures fixtures = new SegmentFixtures();
    private final RegularSegmentation segmentation = fixtures.regular;

    private final SegmentTable table = SegmentTable.builder("id", "t1", "t2", "v")
            .addRow("a", 0, 10, 1)
            .addRow("a", 10, 20, 2)
            .addRow("a", 40, 50, 3)
            .addRow("b", 100, 130, 4)
            .build();

    @Test
    @DisplayName("Should cut each track into bins and drop bins without coverage")
    void testSegment() {
        SegmentTable out = segmentation.segment(table, 10, LAYOUT);
        assertEquals(List.of("id", "t1", "t2"), out.columns());
        assertEquals(List.of(
                Arrays.asList("a", 0L, 10L),
                Arrays.asList("a", 10L, 20L),
                Arrays.asList("a", 40L, 50L),
                Arrays.asList("b", 100L, 110L),
                Arrays.asList("b", 110L, 120L),
                Arrays.asList("b", 120L, 130L)), rows(out));
    }

    @Test
    @DisplayName("Should keep bins that only partially touch the coverage")
    void testSegment_PartialCoverage() {
        SegmentTable out = segmentation.segment(table, 15, LAYOUT);
        // a: 50 / 15 rounds to 3 bins, b: 30 / 15 gives 2 bins
        assertEquals(List.of(0L, 16L, 33L, 100L, 115L), out.column("t1"));
        assertEquals(List.of(16L, 33L, 50L, 115L, 130L), out.column("t2"));
    }

    @Test
    @DisplayName("Should return the input unchanged for a zero length")
    void testSegment_ZeroLength() {
        assertSame(table, segmentation.segment(table, 0, LAYOUT));
    }

    @Test
    @DisplayName("Should reject a negative length")
    void testSegment_NegativeLength() {
        assertThrows(SchemaException.class, () -> segmentation.segment(table, -1, LAYOUT));
    }

    @Test
    @DisplayName("Should drop bins that collapse to zero width in an integral domain")
    void testSegment_ZeroWidthBins() {
        SegmentTable small = SegmentTable.builder("id", "t1", "t2").addRow("a", 0, 2).build();
        SegmentTable out = segmentation.segment(small, 0.5, LAYOUT);
        assertEquals(List.of(
                Arrays.asList("a", 0L, 1L),
                Arrays.asList("a", 1L, 2L)), rows(out));
    }

    @ParameterizedTest
    @CsvSource({
            "0, 25, 10, '0,12,25'",
            "0, 35, 10, '0,8,17,26,35'",
            "0, 4, 10, ''",
            "-10, 10, 5, '-10,-5,0,5,10'"})
    @DisplayName("Should round the bin count half to even and truncate integral edges")
    void testEdges_Integral(long from, long to, double length, String expected) {
        List<Object> edges = RegularSegmentation.edges(from, to, length);
        String joined = String.join(",", edges.stream().map(String::valueOf).toList());
        assertEquals(expected == null ? "" : expected, joined);
    }

    @Test
    @DisplayName("Should keep decimal edges for decimal domains")
    void testEdges_Decimal() {
        assertEquals(List.of(0.0, 0.25, 0.5, 0.75, 1.0), RegularSegmentation.edges(0.0, 1.0, 0.25));
    }

    @Test
    @DisplayName("Should resample a table without discrete columns")
    void testSegment_NoDiscrete() {
        SegmentTable plain = SegmentTable.builder("t1", "t2").addRow(0.0, 3.0).build();
        SegmentTable out = segmentation.segment(plain, 1.0, LAYOUT.withDiscrete(List.of()));
        assertEquals(List.of(0.0, 1.0, 2.0), out.column("t1"));
    }
}
