package com.di.segmerge.merge;

import com.di.segmerge.SegmentFixtures;
import com.di.segmerge.exception.SchemaException;
import com.di.segmerge.table.SegmentTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import static com.di.segmerge.SegmentFixtures.LAYOUT;
import static com.di.segmerge.SegmentFixtures.coveredLength;
import static com.di.segmerge.SegmentFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OverlayMergeEngine Tests")
class OverlayMergeEngineTest {

    private final SegmentFixtures fixtures = new SegmentFixtures();
    private final OverlayMergeEngine engine = fixtures.overlay;

    private final SegmentTable base = SegmentTable.builder("id", "t1", "t2", "v", "c")
            .addRow("a", 0, 10, 1, "b0")
            .addRow("a", 10, 20, 2, "b1")
            .addRow("a", 30, 40, 3, "b2")
            .addRow("b", 0, 4, 5, "bb")
            .build();

    /** Two overlapping windows on track a, one window past the base, one covering all of b. */
    private final SegmentTable override = SegmentTable.builder("id", "t1", "t2", "v", "o")
            .addRow("a", 5, 15, 9, "x")
            .addRow("a", 12, 18, 8, "y")
            .addRow("a", 50, 60, 7, "z")
            .addRow("b", 0, 10, 6, "w")
            .build();

    @Test
    @DisplayName("Should let override rows win and split base rows at their bounds")
    void testOverlay() {
        SegmentTable out = engine.overlay(base, override, LAYOUT);
        assertEquals(List.of("id", "t1", "t2", "v", "c", "o"), out.columns());
        assertEquals(List.of(
                Arrays.asList("a", 0, 5, 1, "b0", null),
                Arrays.asList("a", 5, 10, 9, "b0", "x"),
                Arrays.asList("a", 10, 12, 9, "b1", "x"),
                Arrays.asList("a", 12, 15, 9, "b1", "x"),
                Arrays.asList("a", 12, 15, 8, "b1", "y"),
                Arrays.asList("a", 15, 18, 8, "b1", "y"),
                Arrays.asList("a", 18, 20, 2, "b1", null),
                Arrays.asList("a", 30, 40, 3, "b2", null),
                Arrays.asList("a", 50, 60, 7, null, "z"),
                Arrays.asList("b", 0, 4, 6, "bb", "w"),
                Arrays.asList("b", 4, 10, 6, null, "w")), rows(out));
    }

    @Test
    @DisplayName("Should conserve the covered length of base and override")
    void testOverlay_CoverageConservation() {
        SegmentTable out = engine.overlay(base, override, LAYOUT);
        // a: [0,20) + [30,40) + [50,60); b: [0,10)
        assertEquals(40.0, coveredLength(out, "a"));
        assertEquals(10.0, coveredLength(out, "b"));
    }

    @Test
    @DisplayName("Should classify every base row against the override")
    void testClassifyBase() {
        assertEquals(List.of(BaseSegmentFate.TO_RESOLVE, BaseSegmentFate.TO_RESOLVE,
                        BaseSegmentFate.OUT, BaseSegmentFate.ENCOMPASSED),
                engine.classifyBase(base, override, LAYOUT));
    }

    @Test
    @DisplayName("Should resolve triple-overlapping override windows")
    void testOverlay_TripleOverlap() {
        SegmentTable flat = SegmentTable.builder("id", "t1", "t2", "v")
                .addRow("a", 0, 100, 0)
                .build();
        SegmentTable windows = SegmentTable.builder("id", "t1", "t2", "v")
                .addRow("a", 10, 50, 1)
                .addRow("a", 20, 40, 2)
                .addRow("a", 30, 60, 3)
                .build();
        SegmentTable out = engine.overlay(flat, windows, LAYOUT);
        // pieces 0,10,20,30,40,50,60,100 covered by 0,1,2,3,2,1,0 windows
        assertEquals(1 + 1 + 2 + 3 + 2 + 1 + 1, out.size());
        assertEquals(100.0, coveredLength(out, "a"));
        assertEquals(List.of(1, 2, 3), fixtures.store.sort(
                startingAt(out, 30), List.of("v")).column("v"));
        assertEquals(List.of(BaseSegmentFate.TO_RESOLVE), engine.classifyBase(flat, windows, LAYOUT));
    }

    @Test
    @DisplayName("Should return the base split nowhere when the override is empty")
    void testOverlay_EmptyOverride() {
        SegmentTable out = engine.overlay(base, SegmentTable.empty(List.of("id", "t1", "t2", "v", "o")), LAYOUT);
        assertEquals(4, out.size());
        assertEquals(List.of(1, 2, 3, 5), out.column("v"));
        assertTrue(out.column("o").stream().allMatch(o -> o == null));
    }

    @Test
    @DisplayName("Should reject an override table without the layout columns")
    void testOverlay_InvalidOverride() {
        SegmentTable bad = SegmentTable.builder("id", "t1", "v").build();
        assertThrows(SchemaException.class, () -> engine.overlay(base, bad, LAYOUT));
    }

    private static SegmentTable startingAt(SegmentTable table, int start) {
        BitSet keep = new BitSet();
        for (int i = 0; i < table.size(); i++) {
            keep.set(i, Integer.valueOf(start).equals(table.get(i, "t1")));
        }
        return table.filter(keep);
    }
}
