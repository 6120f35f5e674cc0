package com.di.segmerge.merge;

import com.di.segmerge.table.SegmentLayout;
import com.di.segmerge.table.SegmentTable;
import com.di.segmerge.table.TabularStore;
import com.di.segmerge.util.ArgumentValidator;
import com.di.segmerge.util.CellValues;
import com.di.segmerge.zone.AdmissiblePartitionBuilder;
import com.di.segmerge.zone.ZoneDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Priority overlay of an override table onto an admissible base table.
 *
 * <p>The override table is first rewritten as its finest partition, then laid over the base on
 * a shared breakpoint partition. Wherever an override segment exists it wins: one row per
 * covering override row, with the base values kept for columns only the base carries. Base
 * segments are split at override boundaries and their uncovered pieces pass through. The
 * union of the output intervals equals the union of both inputs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OverlayMergeEngine {

    private final TabularStore store;
    private final ZoneDetector zoneDetector;
    private final AdmissiblePartitionBuilder admissibleBuilder;
    private final IntervalMergeEngine mergeEngine;

    /**
     * Overlays {@code override} onto {@code base}.
     *
     * <p>Output columns: the layout's index columns, the base payload columns, then override
     * payload columns the base lacks. Rows are sorted by key and start.
     */
    public SegmentTable overlay(SegmentTable base, SegmentTable override, SegmentLayout layout) {
        ArgumentValidator.validateTable(base, layout, "Base table");
        ArgumentValidator.validateTable(override, layout, "Override table");
        if (!zoneDetector.isAdmissible(base, layout)) {
            log.warn("[OVERLAY] base table has overlapping segments; results follow the first segment per breakpoint");
        }
        Plan plan = plan(base, override, layout);

        List<String> basePayload = layout.payloadColumns(base);
        List<String> overridePayload = layout.payloadColumns(plan.overrideFine);
        List<String> columns = new ArrayList<>(layout.indexColumns());
        columns.addAll(basePayload);
        for (String c : overridePayload) {
            if (!basePayload.contains(c)) {
                columns.add(c);
            }
        }
        int width = columns.size();
        int payloadFrom = layout.indexColumns().size();

        SegmentTable.Builder out = SegmentTable.builder(columns);
        for (SweepSegment piece : plan.pieces) {
            Object[] template = new Object[width];
            for (int k = 0; k < piece.key().size(); k++) {
                template[k] = piece.key().get(k);
            }
            template[payloadFrom - 2] = piece.start();
            template[payloadFrom - 1] = piece.end();
            if (piece.left().isPresent()) {
                int b = piece.left().getAsInt();
                for (int c = 0; c < basePayload.size(); c++) {
                    template[payloadFrom + c] = base.get(b, basePayload.get(c));
                }
            }
            if (piece.right().isEmpty()) {
                out.addRow(template);
                continue;
            }
            for (int o : plan.overrideRows(piece.right().getAsInt())) {
                Object[] row = Arrays.copyOf(template, width);
                for (String c : overridePayload) {
                    row[columns.indexOf(c)] = plan.overrideFine.get(o, c);
                }
                out.addRow(row);
            }
        }
        SegmentTable result = store.sort(out.build(), layout.trackOrder());

        Map<BaseSegmentFate, Integer> fates = new EnumMap<>(BaseSegmentFate.class);
        for (BaseSegmentFate f : plan.fates(base.size())) {
            fates.merge(f, 1, Integer::sum);
        }
        log.debug("[OVERLAY] base={} override={} fine-override={} fates={} out={}",
                base.size(), override.size(), plan.overrideFine.size(), fates, result.size());
        return result;
    }

    /** Fate of every base row under the overlay, aligned with the base row order. */
    public List<BaseSegmentFate> classifyBase(SegmentTable base, SegmentTable override, SegmentLayout layout) {
        ArgumentValidator.validateTable(base, layout, "Base table");
        ArgumentValidator.validateTable(override, layout, "Override table");
        return plan(base, override, layout).fates(base.size());
    }

    /* ------------------------------------------------------------------ */

    private Plan plan(SegmentTable base, SegmentTable override, SegmentLayout layout) {
        SegmentTable overrideFine = admissibleBuilder.build(override, layout);
        SegmentTable overrideBounds = store.dropDuplicates(
                store.selectColumns(overrideFine, layout.indexColumns()));

        Map<List<Object>, List<Integer>> rowsByBounds = new HashMap<>();
        for (int i = 0; i < overrideFine.size(); i++) {
            rowsByBounds.computeIfAbsent(CellValues.key(overrideFine.values(i, layout.indexColumns())),
                    k -> new ArrayList<>()).add(i);
        }
        List<List<Integer>> rowsPerBound = new ArrayList<>(overrideBounds.size());
        for (int j = 0; j < overrideBounds.size(); j++) {
            rowsPerBound.add(rowsByBounds.get(CellValues.key(overrideBounds.values(j, layout.indexColumns()))));
        }
        List<SweepSegment> pieces = mergeEngine.mergeIndex(base, overrideBounds, layout);
        return new Plan(overrideFine, rowsPerBound, pieces);
    }

    private record Plan(SegmentTable overrideFine, List<List<Integer>> rowsPerBound, List<SweepSegment> pieces) {

        List<Integer> overrideRows(int boundsPosition) {
            return rowsPerBound.get(boundsPosition);
        }

        List<BaseSegmentFate> fates(int baseRows) {
            int[] total = new int[baseRows];
            int[] covered = new int[baseRows];
            for (SweepSegment piece : pieces) {
                if (piece.left().isPresent()) {
                    int b = piece.left().getAsInt();
                    total[b]++;
                    if (piece.right().isPresent()) {
                        covered[b]++;
                    }
                }
            }
            List<BaseSegmentFate> out = new ArrayList<>(baseRows);
            for (int b = 0; b < baseRows; b++) {
                if (covered[b] == 0) {
                    out.add(BaseSegmentFate.OUT);
                } else if (covered[b] == total[b]) {
                    out.add(BaseSegmentFate.ENCOMPASSED);
                } else {
                    out.add(BaseSegmentFate.TO_RESOLVE);
                }
            }
            return out;
        }
    }
}
