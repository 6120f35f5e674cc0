package com.di.segmerge.zone;

import com.di.segmerge.table.SegmentLayout;
import com.di.segmerge.table.SegmentTable;
import com.di.segmerge.table.TabularStore;
import com.di.segmerge.util.ArgumentValidator;
import com.di.segmerge.util.CellValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the rows of every track into zones: maximal clusters of segments connected
 * through overlap. A table is admissible when every zone holds a single row.
 *
 * <p>Zones are found with a sweep over each track sorted by start, keeping the running
 * maximum end seen so far. A segment opens a new zone when it starts at or after that
 * maximum, so segments that only touch ({@code end == start}) stay in separate zones.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ZoneDetector {

    /** Name of the column added by {@link #createZones}. */
    public static final String ZONE_COLUMN = "__zone__";

    private static final String ROW_COLUMN = "__row__";

    private final TabularStore store;

    /**
     * Zone id of every row, aligned with the input row order. Ids start at 1 and are unique
     * across tracks.
     */
    public int[] zoneIds(SegmentTable table, SegmentLayout layout) {
        ArgumentValidator.validateTable(table, layout, "Table");
        int n = table.size();
        List<Object> rowNumbers = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            rowNumbers.add(i);
        }
        SegmentTable sorted = store.sort(table.withColumn(ROW_COLUMN, rowNumbers), layout.indexColumns());

        int rowIdx = sorted.indexOf(ROW_COLUMN);
        int startIdx = sorted.indexOf(layout.start());
        int endIdx = sorted.indexOf(layout.end());
        int[] keyIdx = layout.discrete().stream().mapToInt(sorted::indexOf).toArray();

        int[] zones = new int[n];
        int zone = 0;
        Object runningEnd = null;
        for (int i = 0; i < n; i++) {
            boolean newTrack = i == 0;
            for (int k = 0; !newTrack && k < keyIdx.length; k++) {
                newTrack = !CellValues.same(sorted.get(i, keyIdx[k]), sorted.get(i - 1, keyIdx[k]));
            }
            Object start = sorted.get(i, startIdx);
            Object end = sorted.get(i, endIdx);
            if (newTrack || CellValues.compare(start, runningEnd) >= 0) {
                zone++;
                runningEnd = end;
            } else {
                runningEnd = CellValues.max(runningEnd, end);
            }
            zones[(Integer) sorted.get(i, rowIdx)] = zone;
        }
        return zones;
    }

    /** The input table with a {@value #ZONE_COLUMN} column holding each row's zone id. */
    public SegmentTable createZones(SegmentTable table, SegmentLayout layout) {
        int[] zones = zoneIds(table, layout);
        List<Object> values = new ArrayList<>(zones.length);
        for (int z : zones) {
            values.add(z);
        }
        return table.withColumn(ZONE_COLUMN, values);
    }

    /** Flags, in input order, every row that shares its zone with at least one other row. */
    public boolean[] getOverlapping(SegmentTable table, SegmentLayout layout) {
        int[] zones = zoneIds(table, layout);
        Map<Integer, Integer> counts = new HashMap<>();
        for (int z : zones) {
            counts.merge(z, 1, Integer::sum);
        }
        boolean[] overlapping = new boolean[zones.length];
        for (int i = 0; i < zones.length; i++) {
            overlapping[i] = counts.get(zones[i]) > 1;
        }
        return overlapping;
    }

    /** True when no two segments of the same track overlap. */
    public boolean isAdmissible(SegmentTable table, SegmentLayout layout) {
        for (boolean b : getOverlapping(table, layout)) {
            if (b) {
                return false;
            }
        }
        return true;
    }

    /** Only the overlapping rows, in input order. */
    public SegmentTable sampleNonAdmissible(SegmentTable table, SegmentLayout layout) {
        boolean[] overlapping = getOverlapping(table, layout);
        BitSet keep = new BitSet(overlapping.length);
        for (int i = 0; i < overlapping.length; i++) {
            keep.set(i, overlapping[i]);
        }
        log.debug("[ZONES] {} of {} rows overlap", keep.cardinality(), table.size());
        return table.filter(keep);
    }
}
