package com.di.segmerge.merge;

import com.di.segmerge.config.SegMergeProperties;
import com.di.segmerge.exception.UnsupportedConfigurationException;
import com.di.segmerge.segment.ContinuityEngine;
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
import java.util.Collections;
import java.util.List;

/**
 * Interval join of two segment tables.
 *
 * <p>Both sides are reduced to their distinct {@code (key, start, end)} triples, made gapless
 * per track, and laid over a shared breakpoint partition. Each piece of the partition is
 * resolved to the row covering it on each side, filtered by the join kind, and finally
 * re-attached to both sides' payload columns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntervalMergeEngine {

    static final String LEFT_SOURCE = "__left_idx__";
    static final String RIGHT_SOURCE = "__right_idx__";
    private static final String BROADCAST_KEY = "__broadcast__";

    private final TabularStore store;
    private final ContinuityEngine continuityEngine;
    private final SegMergeProperties properties;

    /** Merge with the configured duplicate suppression and verbosity. */
    public SegmentTable merge(SegmentTable left, SegmentTable right,
                              List<String> discrete, List<String> continuous, String how) {
        return merge(left, right, discrete, continuous, how,
                properties.isSuppressDuplicates(), properties.isVerbose());
    }

    /**
     * Interval join.
     *
     * <p>Output columns: the discrete columns, start, end, the left payload columns and the
     * right payload columns; payload names present on both sides get the configured suffixes.
     * Rows are sorted by key and start.
     *
     * @param how                 {@code left}, {@code right}, {@code inner} or {@code outer}
     * @param suppressDuplicates  coalesce adjacent rows with identical payload
     * @param verbose             log row counts at INFO
     * @throws com.di.segmerge.exception.SchemaException        on invalid columns or join kind
     * @throws UnsupportedConfigurationException if either side is event-indexed
     */
    public SegmentTable merge(SegmentTable left, SegmentTable right,
                              List<String> discrete, List<String> continuous, String how,
                              boolean suppressDuplicates, boolean verbose) {
        MergeHow mergeHow = MergeHow.of(
                ArgumentValidator.validateMergeArguments(left, right, discrete, continuous, how));
        SegmentLayout layout = SegmentLayout.of(discrete, continuous);
        rejectEvents(left, right, layout);

        SegmentTable[] aligned = alignDiscreteKeys(left, right, layout);
        SegmentTable l = aligned[0];
        SegmentTable r = aligned[1];

        List<SweepSegment> pieces = mergeIndex(l, r, layout);
        List<SweepSegment> kept = new ArrayList<>(pieces.size());
        for (SweepSegment piece : pieces) {
            if (piece.keptBy(mergeHow)) {
                kept.add(piece);
            }
        }

        SegmentTable out = attachPayload(toIndexTable(kept, layout), l, r, layout);
        if (suppressDuplicates) {
            out = suppressDuplicates(out, layout);
        }
        if (verbose) {
            log.info("[MERGE] nb rows left table {} | right table {} | {} table {}",
                    l.size(), r.size(), mergeHow, out.size());
        } else {
            log.debug("[MERGE] nb rows left table {} | right table {} | {} table {}",
                    l.size(), r.size(), mergeHow, out.size());
        }
        return out;
    }

    /**
     * Breakpoint partition of two tables sharing the layout's discrete columns, every piece
     * tagged with the row position covering it on each side. Pieces covered by neither side
     * are left out.
     */
    public List<SweepSegment> mergeIndex(SegmentTable left, SegmentTable right, SegmentLayout layout) {
        SegmentTable leftIndex = gaplessIndex(left, layout, LEFT_SOURCE);
        SegmentTable rightIndex = gaplessIndex(right, layout, RIGHT_SOURCE);
        return BreakpointSweep.sweep(leftIndex, LEFT_SOURCE, rightIndex, RIGHT_SOURCE, layout);
    }

    /**
     * Coalesces runs of rows that share key and payload and follow each other without gap,
     * extending the first row of each run to the end of its last row.
     */
    public SegmentTable suppressDuplicates(SegmentTable table, SegmentLayout layout) {
        SegmentTable sorted = store.sort(table, layout.indexColumns());
        List<String> payload = layout.payloadColumns(sorted);
        int start = sorted.indexOf(layout.start());
        int end = sorted.indexOf(layout.end());

        SegmentTable.Builder out = SegmentTable.builder(sorted.columns());
        Object[] current = null;
        int currentRow = -1;
        int coalesced = 0;
        for (int i = 0; i < sorted.size(); i++) {
            if (current != null
                    && sameValues(sorted, currentRow, i, layout.discrete())
                    && sameValues(sorted, currentRow, i, payload)
                    && CellValues.same(current[end], sorted.get(i, start))) {
                current[end] = sorted.get(i, end);
                coalesced++;
                continue;
            }
            if (current != null) {
                out.addRow(current);
            }
            current = sorted.rowValues(i);
            currentRow = i;
        }
        if (current != null) {
            out.addRow(current);
        }
        log.debug("[MERGE] suppressed {} duplicate row(s)", coalesced);
        return out.build();
    }

    /* ------------------------------------------------------------------ */

    private static void rejectEvents(SegmentTable left, SegmentTable right, SegmentLayout layout) {
        boolean leftEvent = layout.isEventIndexed(left);
        boolean rightEvent = layout.isEventIndexed(right);
        if (leftEvent && rightEvent) {
            throw new UnsupportedConfigurationException(
                    "[merge] Merging two event-indexed tables is not supported");
        }
        if (leftEvent || rightEvent) {
            throw new UnsupportedConfigurationException(String.format(
                    "[merge] The %s table lacks %s; merge an event table with mergeEvent instead",
                    leftEvent ? "left" : "right", layout.continuous()));
        }
    }

    /**
     * Gives both tables every discrete column of the layout that either one carries. The side
     * with fewer discrete columns is joined against the distinct key combinations of the other.
     */
    SegmentTable[] alignDiscreteKeys(SegmentTable left, SegmentTable right, SegmentLayout layout) {
        List<String> leftKeys = layout.discretePresentIn(left);
        List<String> rightKeys = layout.discretePresentIn(right);
        if (leftKeys.containsAll(rightKeys) && rightKeys.containsAll(leftKeys)) {
            return new SegmentTable[]{left, right};
        }
        boolean leftRicher = leftKeys.size() >= rightKeys.size();
        SegmentTable rich = leftRicher ? left : right;
        SegmentTable poor = leftRicher ? right : left;

        poor = broadcast(rich, poor, layout);
        if (!layout.discretePresentIn(rich).containsAll(layout.discretePresentIn(poor))) {
            rich = broadcast(poor, rich, layout);
        }
        log.debug("[MERGE] broadcast discrete keys {} / {} -> {}", leftKeys, rightKeys, layout.discrete());
        return leftRicher ? new SegmentTable[]{rich, poor} : new SegmentTable[]{poor, rich};
    }

    private SegmentTable broadcast(SegmentTable rich, SegmentTable poor, SegmentLayout layout) {
        List<String> richKeys = layout.discretePresentIn(rich);
        List<String> poorKeys = layout.discretePresentIn(poor);
        List<String> shared = new ArrayList<>();
        for (String k : poorKeys) {
            if (richKeys.contains(k)) {
                shared.add(k);
            }
        }
        SegmentTable richCombos = store.dropDuplicates(store.selectColumns(rich, richKeys));
        if (poorKeys.isEmpty()) {
            return crossJoin(richCombos, poor);
        }
        SegmentTable poorCombos = store.dropDuplicates(store.selectColumns(poor, poorKeys));
        SegmentTable combos = shared.isEmpty()
                ? crossJoin(richCombos, poorCombos)
                : store.equiJoin(richCombos, poorCombos, shared, JoinType.INNER);
        return store.equiJoin(combos, poor, poorKeys, JoinType.LEFT);
    }

    private SegmentTable crossJoin(SegmentTable a, SegmentTable b) {
        SegmentTable keyedA = a.withColumn(BROADCAST_KEY, Collections.nCopies(a.size(), 1));
        SegmentTable keyedB = b.withColumn(BROADCAST_KEY, Collections.nCopies(b.size(), 1));
        return store.dropColumns(
                store.equiJoin(keyedA, keyedB, List.of(BROADCAST_KEY), JoinType.INNER), List.of(BROADCAST_KEY));
    }

    /**
     * Distinct, gapless {@code (key, start, end)} rows of one side plus a source column holding
     * the position of the first input row with those bounds. Rows with a missing key or bound
     * are left out; reversed bounds are swapped.
     */
    private SegmentTable gaplessIndex(SegmentTable table, SegmentLayout layout, String sourceColumn) {
        List<String> index = layout.indexColumns();
        List<Object> positions = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            positions.add(i);
        }
        SegmentTable withSource = normalizeBounds(
                store.selectColumns(table, index).withColumn(sourceColumn, positions), layout);

        BitSet complete = new BitSet(withSource.size());
        for (int i = 0; i < withSource.size(); i++) {
            boolean ok = true;
            for (Object v : withSource.values(i, index)) {
                ok &= !CellValues.isMissing(v);
            }
            complete.set(i, ok);
        }
        if (complete.cardinality() < withSource.size()) {
            log.warn("[MERGE] dropped {} row(s) with a missing key or bound", withSource.size() - complete.cardinality());
        }
        SegmentTable distinct = store.dropDuplicates(withSource.filter(complete), index);
        SegmentTable sorted = store.sort(distinct, index);
        return continuityEngine.createContinuity(sorted, layout);
    }

    /** Swaps start and end on rows where start is greater than end. */
    public SegmentTable normalizeBounds(SegmentTable table, SegmentLayout layout) {
        int start = table.indexOf(layout.start());
        int end = table.indexOf(layout.end());
        List<Object> starts = new ArrayList<>(table.size());
        List<Object> ends = new ArrayList<>(table.size());
        int swapped = 0;
        for (int i = 0; i < table.size(); i++) {
            Object s = table.get(i, start);
            Object e = table.get(i, end);
            if (!CellValues.isMissing(s) && !CellValues.isMissing(e) && CellValues.compare(s, e) > 0) {
                starts.add(e);
                ends.add(s);
                swapped++;
            } else {
                starts.add(s);
                ends.add(e);
            }
        }
        if (swapped == 0) {
            return table;
        }
        log.warn("[MERGE] swapped reversed bounds on {} row(s)", swapped);
        return table.withColumn(layout.start(), starts).withColumn(layout.end(), ends);
    }

    private static SegmentTable toIndexTable(List<SweepSegment> pieces, SegmentLayout layout) {
        List<String> columns = new ArrayList<>(layout.indexColumns());
        columns.add(LEFT_SOURCE);
        columns.add(RIGHT_SOURCE);
        SegmentTable.Builder builder = SegmentTable.builder(columns);
        for (SweepSegment piece : pieces) {
            List<Object> row = new ArrayList<>(piece.key());
            row.add(piece.start());
            row.add(piece.end());
            row.add(piece.left().isPresent() ? (Object) piece.left().getAsInt() : null);
            row.add(piece.right().isPresent() ? (Object) piece.right().getAsInt() : null);
            builder.addRow(row.toArray());
        }
        return builder.build();
    }

    private SegmentTable attachPayload(SegmentTable indexTable, SegmentTable left, SegmentTable right,
                                       SegmentLayout layout) {
        SegmentTable withLeft = joinPayload(indexTable, left, layout, LEFT_SOURCE);
        SegmentTable withBoth = joinPayloadSuffixed(withLeft, right, layout);
        return store.dropColumns(withBoth, List.of(LEFT_SOURCE, RIGHT_SOURCE));
    }

    private SegmentTable joinPayload(SegmentTable indexTable, SegmentTable side, SegmentLayout layout, String source) {
        SegmentTable payload = payloadWithSource(side, layout, source);
        return store.equiJoin(indexTable, payload, List.of(source), List.of(source), JoinType.LEFT, "", "");
    }

    private SegmentTable joinPayloadSuffixed(SegmentTable withLeft, SegmentTable right, SegmentLayout layout) {
        SegmentTable payload = payloadWithSource(right, layout, RIGHT_SOURCE);
        return store.equiJoin(withLeft, payload, List.of(RIGHT_SOURCE), List.of(RIGHT_SOURCE), JoinType.LEFT,
                properties.getLeftSuffix(), properties.getRightSuffix());
    }

    private SegmentTable payloadWithSource(SegmentTable side, SegmentLayout layout, String source) {
        List<Object> positions = new ArrayList<>(side.size());
        for (int i = 0; i < side.size(); i++) {
            positions.add(i);
        }
        List<String> columns = new ArrayList<>(layout.payloadColumns(side));
        columns.add(source);
        return store.selectColumns(side.withColumn(source, positions), columns);
    }

    private static boolean sameValues(SegmentTable table, int a, int b, List<String> columns) {
        for (String c : columns) {
            int idx = table.indexOf(c);
            if (!CellValues.same(table.get(a, idx), table.get(b, idx))) {
                return false;
            }
        }
        return true;
    }
}
