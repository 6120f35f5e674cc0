package com.di.segmerge;

import com.di.segmerge.aggregate.ConstantRunAggregator;
import com.di.segmerge.aggregate.EventMergeEngine;
import com.di.segmerge.aggregate.RegularSegmentation;
import com.di.segmerge.config.SegMergeProperties;
import com.di.segmerge.merge.IntervalMergeEngine;
import com.di.segmerge.merge.OverlayMergeEngine;
import com.di.segmerge.segment.ContinuityEngine;
import com.di.segmerge.service.SegmentMergeService;
import com.di.segmerge.table.InMemoryTabularStore;
import com.di.segmerge.table.SegmentLayout;
import com.di.segmerge.table.SegmentTable;
import com.di.segmerge.table.TabularStore;
import com.di.segmerge.zone.AdmissiblePartitionBuilder;
import com.di.segmerge.zone.ZoneDetector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Engines wired by hand on an in-memory store, plus the sample tables shared by the tests.
 */
public final class SegmentFixtures {

    public static final List<String> DISCRETE = List.of("id");
    public static final List<String> CONTINUOUS = List.of("t1", "t2");
    public static final SegmentLayout LAYOUT = SegmentLayout.of(DISCRETE, CONTINUOUS);

    public final SegMergeProperties properties;
    public final TabularStore store = new InMemoryTabularStore();
    public final ContinuityEngine continuity;
    public final ZoneDetector zones;
    public final AdmissiblePartitionBuilder admissible;
    public final IntervalMergeEngine merge;
    public final OverlayMergeEngine overlay;
    public final ConstantRunAggregator constantRuns;
    public final RegularSegmentation regular;
    public final EventMergeEngine events;
    public final SegmentMergeService service;

    public SegmentFixtures() {
        this(new SegMergeProperties());
    }

    public SegmentFixtures(SegMergeProperties properties) {
        this.properties = properties;
        this.continuity = new ContinuityEngine(store);
        this.zones = new ZoneDetector(store);
        this.admissible = new AdmissiblePartitionBuilder(store, zones);
        this.merge = new IntervalMergeEngine(store, continuity, properties);
        this.overlay = new OverlayMergeEngine(store, zones, admissible, merge);
        this.constantRuns = new ConstantRunAggregator(store, continuity);
        this.regular = new RegularSegmentation(store, merge);
        this.events = new EventMergeEngine(store, merge, properties);
        this.service = new SegmentMergeService(continuity, zones, admissible, merge, overlay,
                constantRuns, regular, events, properties);
    }

    /** Left side of the merge examples: one payload column {@code data1}. */
    public static SegmentTable leftTable() {
        return SegmentTable.builder("id", "t1", "t2", "data1")
                .addRow("id1", 0, 5, 0.2)
                .addRow("id1", 5, 80, 0.2)
                .addRow("id1", 80, 100, 0.2)
                .addRow("id2", 0, 90, 0.1)
                .addRow("id2", 100, 110, 0.3)
                .addRow("id2", 120, 130, 0.2)
                .build();
    }

    /** Right side of the merge examples: one payload column {@code data2}. */
    public static SegmentTable rightTable() {
        return SegmentTable.builder("id", "t1", "t2", "data2")
                .addRow("id1", 5, 10, 0.2)
                .addRow("id1", 10, 80, 0.2)
                .addRow("id2", 0, 90, 0.1)
                .addRow("id2", 100, 110, 0.3)
                .addRow("id2", 120, 130, 0.2)
                .build();
    }

    /** {@code "key|start|end"} of every row, for order-insensitive comparisons. */
    public static Set<String> bounds(SegmentTable table) {
        Set<String> out = new HashSet<>();
        for (int i = 0; i < table.size(); i++) {
            out.add(table.get(i, "id") + "|" + table.get(i, "t1") + "|" + table.get(i, "t2"));
        }
        return out;
    }

    /** Rows as lists of cells, in table order. */
    public static List<List<Object>> rows(SegmentTable table) {
        List<List<Object>> out = new ArrayList<>();
        for (int i = 0; i < table.size(); i++) {
            out.add(Arrays.asList(table.rowValues(i)));
        }
        return out;
    }

    /** Total covered length per track, summing {@code t2 - t1} over distinct bounds. */
    public static double coveredLength(SegmentTable table, Object key) {
        Set<String> seen = new HashSet<>();
        double total = 0;
        for (int i = 0; i < table.size(); i++) {
            if (!key.equals(table.get(i, "id"))) {
                continue;
            }
            String b = table.get(i, "t1") + "|" + table.get(i, "t2");
            if (seen.add(b)) {
                total += ((Number) table.get(i, "t2")).doubleValue() - ((Number) table.get(i, "t1")).doubleValue();
            }
        }
        return total;
    }
}
