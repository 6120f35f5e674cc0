package com.di.segmerge.aggregate;

import com.di.segmerge.segment.ContinuityEngine;
import com.di.segmerge.table.SegmentLayout;
import com.di.segmerge.table.SegmentTable;
import com.di.segmerge.table.TabularStore;
import com.di.segmerge.util.ArgumentValidator;
import com.di.segmerge.util.CellValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses runs of contiguous segments that carry the same payload into one segment.
 *
 * <p>Row {@code i} joins the run of row {@code i-1} when every payload column holds the same
 * value and the two rows are contiguous within one track. Each run keeps a single row spanning
 * from its first start to its last end.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConstantRunAggregator {

    private static final String RUN_START = "__run_start__";
    private static final String RUN_END = "__run_end__";

    private final TabularStore store;
    private final ContinuityEngine continuityEngine;

    /**
     * Returns the collapsed table sorted by key and bounds, or the input table itself when
     * no two rows can be collapsed.
     */
    public SegmentTable aggregate(SegmentTable table, SegmentLayout layout) {
        ArgumentValidator.validateTable(table, layout, "Table");
        SegmentTable sorted = store.sort(table, layout.indexColumns());
        boolean[] discontinuity = continuityEngine.computeDiscontinuity(sorted, layout);
        List<String> payload = layout.payloadColumns(sorted);
        int[] payloadIdx = payload.stream().mapToInt(sorted::indexOf).toArray();

        int n = sorted.size();
        boolean[] identical = new boolean[n];
        int collapsible = 0;
        for (int i = 0; i + 1 < n; i++) {
            boolean same = !discontinuity[i + 1];
            for (int c = 0; same && c < payloadIdx.length; c++) {
                same = CellValues.same(sorted.get(i, payloadIdx[c]), sorted.get(i + 1, payloadIdx[c]));
            }
            identical[i] = same;
            if (same) {
                collapsible++;
            }
        }
        if (collapsible == 0) {
            return table;
        }

        int start = sorted.indexOf(layout.start());
        int end = sorted.indexOf(layout.end());
        List<Object> runStarts = new ArrayList<>(n);
        List<Object> runEnds = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            boolean opensRun = i == 0 || !identical[i - 1];
            runStarts.add(opensRun ? sorted.get(i, start) : null);
            runEnds.add(identical[i] ? null : sorted.get(i, end));
        }
        SegmentTable marked = sorted.withColumn(RUN_START, runStarts).withColumn(RUN_END, runEnds);
        marked = store.forwardFill(marked, List.of(RUN_START));
        marked = store.backwardFill(marked, List.of(RUN_END));

        SegmentTable stretched = marked
                .withColumn(layout.start(), marked.column(RUN_START))
                .withColumn(layout.end(), marked.column(RUN_END));
        SegmentTable out = store.dropDuplicates(store.selectColumns(stretched, table.columns()));
        log.debug("[AGGREGATE] rows={} collapsed-into-predecessor={} out={}", n, collapsible, out.size());
        return out;
    }
}
