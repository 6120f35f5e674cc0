package com.di.segmerge.aggregate;

import com.di.segmerge.SegmentFixtures;
import com.di.segmerge.exception.SchemaException;
import com.di.segmerge.table.SegmentTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.di.segmerge.SegmentFixtures.LAYOUT;
import static com.di.segmerge.SegmentFixtures.rows;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EventMergeEngine Tests")
class EventMergeEngineTest {

    private final SegmentFixtures fixtures = new SegmentFixtures();
    private final EventMergeEngine engine = fixtures.events;

    private final SegmentTable intervals = SegmentTable.builder("id", "t1", "t2", "x")
            .addRow("a", 10, 20, 2)
            .addRow("a", 0, 10, 1)
            .addRow("a", 20, 30, 3)
            .addRow("b", 0, 10, 4)
            .build();

    @Test
    @DisplayName("Should stamp each interval with the latest event of its track")
    void testMergeEvent() {
        SegmentTable events = SegmentTable.builder("id", "t1", "state")
                .addRow("a", 15, "off")
                .addRow("a", 0, "on")
                .addRow("b", 5, "late")
                .build();
        SegmentTable out = engine.mergeEvent(intervals, events, LAYOUT);
        assertEquals(List.of("id", "t1", "t2", "x", "state"), out.columns());
        assertEquals(List.of(
                Arrays.asList("a", 0, 10, 1, "on"),
                Arrays.asList("a", 10, 20, 2, "on"),
                Arrays.asList("a", 20, 30, 3, "off"),
                Arrays.asList("b", 0, 10, 4, null)), rows(out));
    }

    @Test
    @DisplayName("Should apply an event to the interval starting at the same time")
    void testMergeEvent_Tie() {
        SegmentTable events = SegmentTable.builder("id", "t1", "state")
                .addRow("a", 0, "on")
                .addRow("a", 20, "mid")
                .build();
        SegmentTable out = engine.mergeEvent(intervals, events, LAYOUT);
        assertEquals(Arrays.asList("on", "on", "mid", null), out.column("state"));
    }

    @Test
    @DisplayName("Should use the end column as event time when the start column is absent")
    void testMergeEvent_EndTime() {
        SegmentTable events = SegmentTable.builder("id", "t2", "state").addRow("b", 0, "early").build();
        SegmentTable out = engine.mergeEvent(intervals, events, LAYOUT);
        assertEquals("early", out.get(3, "state"));
    }

    @Test
    @DisplayName("Should suffix event columns that clash with interval columns")
    void testMergeEvent_Collision() {
        SegmentTable events = SegmentTable.builder("id", "t1", "x").addRow("a", 0, 99).build();
        SegmentTable out = engine.mergeEvent(intervals, events, LAYOUT);
        assertEquals(List.of("id", "t1", "t2", "x", "x_event"), out.columns());
        assertEquals(List.of(1, 2, 3), out.column("x").subList(0, 3));
        assertEquals(Arrays.asList(99, 99, 99, null), out.column("x_event"));
    }

    @Test
    @DisplayName("Should reject event tables without a time or discrete column")
    void testMergeEvent_Invalid() {
        SegmentTable noTime = SegmentTable.builder("id", "state").addRow("a", "on").build();
        assertThrows(SchemaException.class, () -> engine.mergeEvent(intervals, noTime, LAYOUT));
        SegmentTable noKey = SegmentTable.builder("t1", "state").addRow(0, "on").build();
        assertThrows(SchemaException.class, () -> engine.mergeEvent(intervals, noKey, LAYOUT));
    }
}
