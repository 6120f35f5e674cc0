package com.di.segmerge.zone;

import com.di.segmerge.table.JoinType;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Rewrites overlapping segments as the finest partition of their zone.
 *
 * <p>Inside each overlapping zone every start and end becomes a cut point. Each piece between
 * two consecutive cut points is emitted once per original segment covering it, carrying that
 * segment's payload. Rows outside overlapping zones pass through unchanged. The distinct
 * {@code (key, start, end)} triples of the result never overlap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdmissiblePartitionBuilder {

    private static final String SOURCE_SUFFIX = "__src";

    private final TabularStore store;
    private final ZoneDetector zoneDetector;

    /**
     * Builds the admissible version of the table, sorted by discrete key and start.
     * A zone whose cut points collapse to a single value contributes no rows.
     */
    public SegmentTable build(SegmentTable table, SegmentLayout layout) {
        ArgumentValidator.validateTable(table, layout, "Table");
        SegmentTable zoned = zoneDetector.createZones(table, layout);
        boolean[] overlapping = zoneDetector.getOverlapping(table, layout);

        BitSet overlapRows = new BitSet(table.size());
        for (int i = 0; i < overlapping.length; i++) {
            overlapRows.set(i, overlapping[i]);
        }
        if (overlapRows.isEmpty()) {
            return store.sort(table, layout.trackOrder());
        }
        BitSet passRows = (BitSet) overlapRows.clone();
        passRows.flip(0, table.size());

        SegmentTable members = zoned.filter(overlapRows);
        SegmentTable pieces = finestPieces(members, layout);

        String startSrc = layout.start() + SOURCE_SUFFIX;
        String endSrc = layout.end() + SOURCE_SUFFIX;
        SegmentTable joined = store.equiJoin(pieces, members,
                List.of(ZoneDetector.ZONE_COLUMN), List.of(ZoneDetector.ZONE_COLUMN),
                JoinType.INNER, "", SOURCE_SUFFIX);

        int start = joined.indexOf(layout.start());
        int end = joined.indexOf(layout.end());
        int srcStart = joined.indexOf(startSrc);
        int srcEnd = joined.indexOf(endSrc);
        BitSet covering = new BitSet(joined.size());
        for (int i = 0; i < joined.size(); i++) {
            boolean covers = CellValues.compare(joined.get(i, start), joined.get(i, srcEnd)) < 0
                    && CellValues.compare(joined.get(i, end), joined.get(i, srcStart)) > 0;
            covering.set(i, covers);
        }
        SegmentTable resolved = store.selectColumns(joined.filter(covering), table.columns());

        log.debug("[ADMISSIBLE] rows={} overlapping={} pieces={} emitted={}",
                table.size(), members.size(), pieces.size(), resolved.size());

        SegmentTable all = store.concat(List.of(table.filter(passRows), resolved));
        return store.sort(all, layout.trackOrder());
    }

    /**
     * Consecutive distinct cut points of every zone, as rows of
     * {@code (zone, start, end)}.
     */
    private SegmentTable finestPieces(SegmentTable members, SegmentLayout layout) {
        int zoneIdx = members.indexOf(ZoneDetector.ZONE_COLUMN);
        int startIdx = members.indexOf(layout.start());
        int endIdx = members.indexOf(layout.end());

        Map<Object, TreeSet<Object>> cutsByZone = new LinkedHashMap<>();
        for (int i = 0; i < members.size(); i++) {
            TreeSet<Object> cuts = cutsByZone.computeIfAbsent(members.get(i, zoneIdx),
                    z -> new TreeSet<>(CellValues::compare));
            addCut(cuts, members.get(i, startIdx));
            addCut(cuts, members.get(i, endIdx));
        }

        SegmentTable.Builder pieces = SegmentTable.builder(ZoneDetector.ZONE_COLUMN, layout.start(), layout.end());
        for (Map.Entry<Object, TreeSet<Object>> e : cutsByZone.entrySet()) {
            List<Object> cuts = new ArrayList<>(e.getValue());
            if (cuts.size() < 2) {
                log.warn("[ADMISSIBLE] zone {} has a single cut point {}, no positive-width piece", e.getKey(), cuts);
                continue;
            }
            for (int k = 0; k + 1 < cuts.size(); k++) {
                pieces.addRow(e.getKey(), cuts.get(k), cuts.get(k + 1));
            }
        }
        return pieces.build();
    }

    private static void addCut(TreeSet<Object> cuts, Object value) {
        if (!CellValues.isMissing(value)) {
            cuts.add(value);
        }
    }
}
