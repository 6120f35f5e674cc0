package com.di.segmerge.service;

import com.di.segmerge.SegmentFixtures;
import com.di.segmerge.config.SegMergeProperties;
import com.di.segmerge.exception.SchemaException;
import com.di.segmerge.merge.BaseSegmentFate;
import com.di.segmerge.table.SegmentTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.di.segmerge.SegmentFixtures.CONTINUOUS;
import static com.di.segmerge.SegmentFixtures.DISCRETE;
import static com.di.segmerge.SegmentFixtures.leftTable;
import static com.di.segmerge.SegmentFixtures.rightTable;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for the operations exposed by SegmentMergeService.
 */
@DisplayName("SegmentMergeService Tests")
class SegmentMergeServiceTest {

    private final SegmentMergeService service = new SegmentFixtures().service;

    private final SegmentTable gapped = SegmentTable.builder("id", "t1", "t2", "v")
            .addRow("a", 0, 5, 1)
            .addRow("a", 7, 10, 1)
            .addRow("a", 30, 40, 2)
            .build();

    @Test
    @DisplayName("Should bridge gaps up to the configured limit")
    void testCreateContinuity_ConfiguredLimit() {
        SegMergeProperties properties = new SegMergeProperties();
        properties.setContinuityLimit(5.0);
        SegmentMergeService limited = new SegmentFixtures(properties).service;
        assertEquals(4, limited.createContinuity(gapped, DISCRETE, CONTINUOUS).size());
        assertEquals(5, service.createContinuity(gapped, DISCRETE, CONTINUOUS).size());
    }

    @Test
    @DisplayName("Should expose discontinuity and zone operations by column names")
    void testZoneOperations() {
        assertArrayEquals(new boolean[]{false, true, true},
                service.computeDiscontinuity(gapped, DISCRETE, CONTINUOUS));
        assertTrue(service.isAdmissible(gapped, DISCRETE, CONTINUOUS));
        assertEquals(List.of(1, 2, 3), service.createZones(gapped, DISCRETE, CONTINUOUS).column("__zone__"));
        assertArrayEquals(new boolean[]{false, false, false}, service.getOverlapping(gapped, DISCRETE, CONTINUOUS));
        assertEquals(0, service.sampleNonAdmissible(gapped, DISCRETE, CONTINUOUS).size());
        assertEquals(3, service.buildAdmissible(gapped, DISCRETE, CONTINUOUS).size());
    }

    @Test
    @DisplayName("Should merge and suppress duplicates through the facade")
    void testMerge() {
        assertEquals(7, service.merge(leftTable(), rightTable(), DISCRETE, CONTINUOUS, "outer").size());
        SegmentTable suppressed = service.merge(leftTable(), rightTable(), DISCRETE, CONTINUOUS, "outer", true, false);
        assertEquals(6, suppressed.size());
        assertEquals(suppressed, service.suppressDuplicates(
                service.merge(leftTable(), rightTable(), DISCRETE, CONTINUOUS, "outer"), DISCRETE, CONTINUOUS));
    }

    @Test
    @DisplayName("Should run the overlay merge and classify base rows")
    void testUnbalancedMerge() {
        SegmentTable out = service.unbalancedMerge(leftTable(), rightTable(), DISCRETE, CONTINUOUS);
        assertEquals(List.of("id", "t1", "t2", "data1", "data2"), out.columns());
        assertEquals(List.of(BaseSegmentFate.OUT, BaseSegmentFate.ENCOMPASSED, BaseSegmentFate.OUT,
                        BaseSegmentFate.ENCOMPASSED, BaseSegmentFate.ENCOMPASSED, BaseSegmentFate.ENCOMPASSED),
                service.classifyBase(leftTable(), rightTable(), DISCRETE, CONTINUOUS));
    }

    @Test
    @DisplayName("Should aggregate and resample through the facade")
    void testAggregation() {
        assertEquals(4, service.aggregateConstant(leftTable(), DISCRETE, CONTINUOUS).size());
        assertEquals(2, service.createRegularSegmentSegmentation(gapped, 20, DISCRETE, CONTINUOUS).size());
        SegmentTable events = SegmentTable.builder("id", "t1", "flag").addRow("a", 0, "x").build();
        assertEquals(List.of("x", "x", "x"), service.mergeEvent(gapped, events, DISCRETE, CONTINUOUS).column("flag"));
    }

    @Test
    @DisplayName("Should reject null arguments and invalid layouts")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> service.aggregateConstant(null, DISCRETE, CONTINUOUS));
        assertThrows(IllegalArgumentException.class, () -> service.unbalancedMerge(gapped, null, DISCRETE, CONTINUOUS));
        assertThrows(SchemaException.class, () -> service.buildAdmissible(gapped, DISCRETE, List.of("t1")));
        assertThrows(SchemaException.class,
                () -> service.createContinuity(gapped, DISCRETE, CONTINUOUS, 0.0, false));
    }
}
