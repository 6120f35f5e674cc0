package com.di.segmerge.aggregate;

import com.di.segmerge.merge.IntervalMergeEngine;
import com.di.segmerge.table.AggregateOp;
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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resamples every track onto bins of roughly equal length.
 *
 * <p>Per discrete key the domain {@code [min(start), max(end)]} is cut into
 * {@code round(span / length)} bins of equal width. Bins that no input segment touches are
 * dropped, so gaps wider than a bin stay gaps.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegularSegmentation {

    private static final String BIN_ID = "__bin__";
    private static final String DOMAIN_START = "__domain_start__";
    private static final String DOMAIN_END = "__domain_end__";

    private final TabularStore store;
    private final IntervalMergeEngine mergeEngine;

    /**
     * @param length target bin length; {@code 0} returns the table unchanged
     * @return the discrete and interval columns of the kept bins, sorted by key and start
     */
    public SegmentTable segment(SegmentTable table, double length, SegmentLayout layout) {
        ArgumentValidator.validateTable(table, layout, "Table");
        ArgumentValidator.validateLength(length);
        if (length == 0 || table.isEmpty()) {
            return table;
        }

        SegmentTable mins = store.renameColumns(
                store.groupAggregate(table, layout.discrete(), layout.start(), AggregateOp.MIN),
                List.of(layout.start()), List.of(DOMAIN_START));
        SegmentTable maxs = store.renameColumns(
                store.groupAggregate(table, layout.discrete(), layout.end(), AggregateOp.MAX),
                List.of(layout.end()), List.of(DOMAIN_END));
        SegmentTable domains = layout.discrete().isEmpty()
                ? SegmentTable.builder(DOMAIN_START, DOMAIN_END)
                        .addRow(mins.get(0, DOMAIN_START), maxs.get(0, DOMAIN_END)).build()
                : store.equiJoin(mins, maxs, layout.discrete(), JoinType.INNER);

        List<String> binColumns = new ArrayList<>(layout.indexColumns());
        binColumns.add(BIN_ID);
        SegmentTable.Builder bins = SegmentTable.builder(binColumns);
        long binId = 0;
        for (int d = 0; d < domains.size(); d++) {
            Object lo = domains.get(d, DOMAIN_START);
            Object hi = domains.get(d, DOMAIN_END);
            if (CellValues.isMissing(lo) || CellValues.isMissing(hi)) {
                continue;
            }
            List<Object> key = domains.values(d, layout.discrete());
            List<Object> edges = edges(lo, hi, length);
            for (int k = 0; k + 1 < edges.size(); k++) {
                if (CellValues.compare(edges.get(k), edges.get(k + 1)) >= 0) {
                    continue;
                }
                Object[] row = new Object[binColumns.size()];
                for (int c = 0; c < key.size(); c++) {
                    row[c] = key.get(c);
                }
                row[key.size()] = edges.get(k);
                row[key.size() + 1] = edges.get(k + 1);
                row[key.size() + 2] = binId++;
                bins.addRow(row);
            }
        }
        SegmentTable binTable = bins.build();

        SegmentTable touched = mergeEngine.merge(binTable, store.selectColumns(table, layout.indexColumns()),
                layout.discrete(), layout.continuous(), "inner", false, false);
        Set<Object> kept = new HashSet<>();
        for (Object id : touched.column(BIN_ID)) {
            kept.add(CellValues.normalize(id));
        }
        BitSet keep = new BitSet(binTable.size());
        for (int i = 0; i < binTable.size(); i++) {
            keep.set(i, kept.contains(CellValues.normalize(binTable.get(i, BIN_ID))));
        }

        SegmentTable out = store.sort(
                store.selectColumns(binTable.filter(keep), layout.indexColumns()), layout.trackOrder());
        log.debug("[REGULAR] tracks={} bins={} kept={}", domains.size(), binTable.size(), out.size());
        return out;
    }

    /**
     * {@code n + 1} evenly spaced edges from {@code lo} to {@code hi}, the last one exactly
     * {@code hi}. Integral domains get edges truncated toward zero.
     */
    static List<Object> edges(Object lo, Object hi, double length) {
        double from = CellValues.toDouble(lo, "start");
        double to = CellValues.toDouble(hi, "end");
        long count = (long) Math.rint((to - from) / length);
        List<Object> out = new ArrayList<>();
        if (count <= 0) {
            return out;
        }
        boolean integral = CellValues.isIntegral(lo) && CellValues.isIntegral(hi);
        double step = (to - from) / count;
        for (long k = 0; k <= count; k++) {
            if (k == count) {
                out.add(integral ? (Object) ((Number) hi).longValue() : (Object) to);
            } else {
                double v = from + k * step;
                out.add(integral ? (Object) (long) v : (Object) v);
            }
        }
        return out;
    }
}
