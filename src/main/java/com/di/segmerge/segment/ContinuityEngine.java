package com.di.segmerge.segment;

import com.di.segmerge.table.SegmentLayout;
import com.di.segmerge.table.SegmentTable;
import com.di.segmerge.table.TabularStore;
import com.di.segmerge.util.ArgumentValidator;
import com.di.segmerge.util.CellValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Finds breaks in the ordered segments of each track and fills gaps with payload-less
 * segments so that every track becomes gapless.
 *
 * <p>Both operations read the table in its current row order; callers sort by
 * {@code (discrete key, start)} first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContinuityEngine {

    private final TabularStore store;

    /**
     * Flags row {@code i} when its discrete key differs from row {@code i-1}, or when
     * {@code start[i] != end[i-1]}. Row 0 is never flagged.
     *
     * <p>Discrete columns the table lacks are ignored; the bound check is skipped when the
     * table lacks either continuous column.
     */
    public boolean[] computeDiscontinuity(SegmentTable table, SegmentLayout layout) {
        boolean[] flags = trackStarts(table, layout);
        if (layout.isEventIndexed(table)) {
            return flags;
        }
        int start = table.indexOf(layout.start());
        int end = table.indexOf(layout.end());
        for (int i = 1; i < table.size(); i++) {
            if (!CellValues.same(table.get(i, start), table.get(i - 1, end))) {
                flags[i] = true;
            }
        }
        return flags;
    }

    /** True at every row whose discrete key differs from the previous row's. Row 0 is false. */
    public boolean[] trackStarts(SegmentTable table, SegmentLayout layout) {
        List<String> discrete = layout.discretePresentIn(table);
        boolean[] flags = new boolean[table.size()];
        for (int i = 1; i < table.size(); i++) {
            flags[i] = !sameKey(table, i, i - 1, discrete);
        }
        return flags;
    }

    /** Gapless version of the table, without width limit and without re-sorting. */
    public SegmentTable createContinuity(SegmentTable table, SegmentLayout layout) {
        return createContinuity(table, layout, null, false);
    }

    /**
     * Inserts one filler segment {@code [end[i-1], start[i])} before every row {@code i} that
     * follows a gap inside its track. Fillers carry the track's key and missing payload.
     *
     * <p>Track starts never get a filler, and neither do overlap breaks ({@code end[i-1] > start[i]}).
     * When no filler is created the input table itself is returned.
     *
     * @param limit optional width bound: gaps at least this wide are left open
     * @param sort  whether to sort the result by discrete key, start and end
     */
    public SegmentTable createContinuity(SegmentTable table, SegmentLayout layout, Double limit, boolean sort) {
        ArgumentValidator.validateTable(table, layout, "Table");
        ArgumentValidator.validateLimit(limit);

        boolean[] discontinuity = computeDiscontinuity(table, layout);
        boolean[] newTrack = trackStarts(table, layout);

        int startIdx = table.indexOf(layout.start());
        int endIdx = table.indexOf(layout.end());
        int[] keyIdx = layout.discrete().stream().mapToInt(table::indexOf).toArray();

        SegmentTable.Builder builder = SegmentTable.builder(table.columns());
        int added = 0;
        int overLimit = 0;
        for (int i = 0; i < table.size(); i++) {
            if (discontinuity[i] && !newTrack[i]) {
                Object gapStart = table.get(i - 1, endIdx);
                Object gapEnd = table.get(i, startIdx);
                if (CellValues.compare(gapStart, gapEnd) < 0) {
                    if (limit == null || width(gapStart, gapEnd, layout) < limit) {
                        Object[] filler = new Object[table.columns().size()];
                        for (int k : keyIdx) {
                            filler[k] = table.get(i, k);
                        }
                        filler[startIdx] = gapStart;
                        filler[endIdx] = gapEnd;
                        builder.addRow(filler);
                        added++;
                    } else {
                        overLimit++;
                    }
                }
            }
            builder.addRow(table.rowValues(i));
        }
        log.debug("[CONTINUITY] rows={} fillers={} left-open-by-limit={}", table.size(), added, overLimit);
        if (added == 0) {
            return sort ? store.sort(table, layout.indexColumns()) : table;
        }
        SegmentTable out = builder.build();
        return sort ? store.sort(out, layout.indexColumns()) : out;
    }

    private static double width(Object from, Object to, SegmentLayout layout) {
        return CellValues.toDouble(to, layout.end()) - CellValues.toDouble(from, layout.start());
    }

    private static boolean sameKey(SegmentTable table, int a, int b, List<String> discrete) {
        for (String c : discrete) {
            int idx = table.indexOf(c);
            if (!CellValues.same(table.get(a, idx), table.get(b, idx))) {
                return false;
            }
        }
        return true;
    }
}
