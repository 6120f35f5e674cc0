package com.di.segmerge.table;

import com.di.segmerge.util.CellValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Heap-backed {@link TabularStore} working directly on row arrays.
 *
 * <p>Joins are hash joins on normalised key tuples, so {@code 1}, {@code 1L} and {@code 1.0}
 * join with each other and missing keys join with missing keys.
 */
@Slf4j
@Component
public class InMemoryTabularStore implements TabularStore {

    @Override
    public SegmentTable sort(SegmentTable table, List<String> columns, List<Boolean> ascending) {
        if (columns.size() != ascending.size()) {
            throw new IllegalArgumentException("One sort direction per column is required: "
                    + columns + " vs " + ascending);
        }
        int[] positions = positions(table, columns);
        List<Object[]> rows = new ArrayList<>(table.rawRows());
        Comparator<Object[]> comparator = (a, b) -> {
            for (int i = 0; i < positions.length; i++) {
                Object va = a[positions[i]];
                Object vb = b[positions[i]];
                boolean missingA = CellValues.isMissing(va);
                boolean missingB = CellValues.isMissing(vb);
                int cmp;
                if (missingA || missingB) {
                    cmp = Boolean.compare(missingA, missingB);
                } else {
                    cmp = CellValues.compare(va, vb);
                    if (!ascending.get(i)) {
                        cmp = -cmp;
                    }
                }
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
        rows.sort(comparator);
        return SegmentTable.wrap(table.columns(), rows);
    }

    @Override
    public SegmentTable equiJoin(SegmentTable left, SegmentTable right,
                                 List<String> leftOn, List<String> rightOn,
                                 JoinType how, String leftSuffix, String rightSuffix) {
        if (leftOn.size() != rightOn.size() || leftOn.isEmpty()) {
            throw new IllegalArgumentException("Join keys must be non-empty and pairwise: " + leftOn + " / " + rightOn);
        }
        int[] leftKeys = positions(left, leftOn);
        int[] rightKeys = positions(right, rightOn);

        // right key columns that share their name with the paired left key are emitted once
        Set<Integer> mergedRightKeys = new HashSet<>();
        Map<Integer, Integer> rightKeyToLeftKey = new HashMap<>();
        for (int i = 0; i < leftOn.size(); i++) {
            if (leftOn.get(i).equals(rightOn.get(i))) {
                mergedRightKeys.add(rightKeys[i]);
                rightKeyToLeftKey.put(rightKeys[i], leftKeys[i]);
            }
        }
        List<Integer> rightKept = new ArrayList<>();
        for (int c = 0; c < right.columns().size(); c++) {
            if (!mergedRightKeys.contains(c)) {
                rightKept.add(c);
            }
        }
        Set<String> leftNames = new HashSet<>(left.columns());
        Set<String> rightNames = new HashSet<>();
        for (int c : rightKept) {
            rightNames.add(right.columns().get(c));
        }
        List<String> outColumns = new ArrayList<>();
        for (String c : left.columns()) {
            outColumns.add(rightNames.contains(c) ? c + leftSuffix : c);
        }
        for (int c : rightKept) {
            String name = right.columns().get(c);
            outColumns.add(leftNames.contains(name) ? name + rightSuffix : name);
        }

        Map<List<Object>, List<Integer>> rightIndex = new HashMap<>();
        List<Object[]> rightRows = right.rawRows();
        for (int r = 0; r < rightRows.size(); r++) {
            rightIndex.computeIfAbsent(keyOf(rightRows.get(r), rightKeys), k -> new ArrayList<>()).add(r);
        }

        int leftWidth = left.columns().size();
        boolean[] rightMatched = new boolean[rightRows.size()];
        List<Object[]> out = new ArrayList<>();
        for (Object[] l : left.rawRows()) {
            List<Integer> matches = rightIndex.get(keyOf(l, leftKeys));
            if (matches == null || matches.isEmpty()) {
                if (how.keepsLeft()) {
                    out.add(Arrays.copyOf(l, outColumns.size()));
                }
                continue;
            }
            for (int m : matches) {
                rightMatched[m] = true;
                Object[] row = Arrays.copyOf(l, outColumns.size());
                Object[] r = rightRows.get(m);
                for (int k = 0; k < rightKept.size(); k++) {
                    row[leftWidth + k] = r[rightKept.get(k)];
                }
                out.add(row);
            }
        }
        if (how.keepsRight()) {
            for (int m = 0; m < rightRows.size(); m++) {
                if (rightMatched[m]) {
                    continue;
                }
                Object[] r = rightRows.get(m);
                Object[] row = new Object[outColumns.size()];
                for (Map.Entry<Integer, Integer> e : rightKeyToLeftKey.entrySet()) {
                    row[e.getValue()] = r[e.getKey()];
                }
                for (int k = 0; k < rightKept.size(); k++) {
                    row[leftWidth + k] = r[rightKept.get(k)];
                }
                out.add(row);
            }
        }
        log.trace("[STORE] {} join {}x{} -> {} rows", how, left.size(), right.size(), out.size());
        return SegmentTable.wrap(outColumns, out);
    }

    @Override
    public SegmentTable groupAggregate(SegmentTable table, List<String> byColumns,
                                       String aggregateColumn, AggregateOp op) {
        int[] by = positions(table, byColumns);
        int target = table.indexOf(aggregateColumn);
        Map<List<Object>, Object[]> groups = new LinkedHashMap<>();
        Map<List<Object>, Accumulator> accumulators = new HashMap<>();
        for (Object[] r : table.rawRows()) {
            List<Object> key = keyOf(r, by);
            groups.computeIfAbsent(key, k -> {
                Object[] first = new Object[by.length];
                for (int i = 0; i < by.length; i++) {
                    first[i] = r[by[i]];
                }
                return first;
            });
            accumulators.computeIfAbsent(key, k -> new Accumulator(op)).add(r[target], aggregateColumn);
        }
        List<String> outColumns = new ArrayList<>(byColumns);
        outColumns.add(aggregateColumn);
        List<Object[]> out = new ArrayList<>(groups.size());
        for (Map.Entry<List<Object>, Object[]> e : groups.entrySet()) {
            Object[] row = Arrays.copyOf(e.getValue(), outColumns.size());
            row[by.length] = accumulators.get(e.getKey()).result();
            out.add(row);
        }
        return SegmentTable.wrap(outColumns, out);
    }

    @Override
    public SegmentTable forwardFill(SegmentTable table, List<String> columns, List<String> partitionColumns) {
        return fill(table, columns, partitionColumns, true);
    }

    @Override
    public SegmentTable backwardFill(SegmentTable table, List<String> columns, List<String> partitionColumns) {
        return fill(table, columns, partitionColumns, false);
    }

    @Override
    public SegmentTable concat(List<SegmentTable> tables) {
        LinkedHashSet<String> union = new LinkedHashSet<>();
        for (SegmentTable t : tables) {
            union.addAll(t.columns());
        }
        List<String> outColumns = new ArrayList<>(union);
        Map<String, Integer> target = new HashMap<>();
        for (int i = 0; i < outColumns.size(); i++) {
            target.put(outColumns.get(i), i);
        }
        List<Object[]> out = new ArrayList<>();
        for (SegmentTable t : tables) {
            int[] mapping = new int[t.columns().size()];
            for (int c = 0; c < mapping.length; c++) {
                mapping[c] = target.get(t.columns().get(c));
            }
            for (Object[] r : t.rawRows()) {
                Object[] row = new Object[outColumns.size()];
                for (int c = 0; c < mapping.length; c++) {
                    row[mapping[c]] = r[c];
                }
                out.add(row);
            }
        }
        return SegmentTable.wrap(outColumns, out);
    }

    @Override
    public SegmentTable dropDuplicates(SegmentTable table, List<String> subset) {
        List<String> on = subset == null || subset.isEmpty() ? table.columns() : subset;
        int[] keys = positions(table, on);
        Set<List<Object>> seen = new HashSet<>();
        List<Object[]> out = new ArrayList<>();
        for (Object[] r : table.rawRows()) {
            if (seen.add(keyOf(r, keys))) {
                out.add(r);
            }
        }
        return SegmentTable.wrap(table.columns(), out);
    }

    @Override
    public SegmentTable selectColumns(SegmentTable table, List<String> columns) {
        int[] keep = positions(table, columns);
        List<Object[]> out = new ArrayList<>(table.size());
        for (Object[] r : table.rawRows()) {
            Object[] row = new Object[keep.length];
            for (int i = 0; i < keep.length; i++) {
                row[i] = r[keep[i]];
            }
            out.add(row);
        }
        return SegmentTable.wrap(columns, out);
    }

    @Override
    public SegmentTable dropColumns(SegmentTable table, List<String> columns) {
        List<String> kept = new ArrayList<>(table.columns());
        kept.removeAll(columns);
        return selectColumns(table, kept);
    }

    @Override
    public SegmentTable renameColumns(SegmentTable table, List<String> from, List<String> to) {
        if (from.size() != to.size()) {
            throw new IllegalArgumentException("Rename lists differ in size: " + from + " / " + to);
        }
        List<String> names = new ArrayList<>(table.columns());
        for (int i = 0; i < from.size(); i++) {
            names.set(table.indexOf(from.get(i)), to.get(i));
        }
        return table.withColumnNames(names);
    }

    @Override
    public SegmentTable castColumnType(SegmentTable table, String column, ColumnType type) {
        int target = table.indexOf(column);
        List<Object[]> out = new ArrayList<>(table.size());
        for (Object[] r : table.rawRows()) {
            Object[] row = r.clone();
            row[target] = cast(r[target], type, column);
            out.add(row);
        }
        return SegmentTable.wrap(table.columns(), out);
    }

    /* ------------------------------------------------------------------ */

    private SegmentTable fill(SegmentTable table, List<String> columns, List<String> partitionColumns, boolean forward) {
        int[] targets = positions(table, columns);
        int[] partitions = positions(table, partitionColumns == null ? List.of() : partitionColumns);
        List<Object[]> rows = table.rawRows();
        Object[][] out = new Object[rows.size()][];
        Object[] carried = new Object[targets.length];
        List<Object> currentPartition = null;
        for (int step = 0; step < rows.size(); step++) {
            int i = forward ? step : rows.size() - 1 - step;
            Object[] row = rows.get(i).clone();
            List<Object> partition = keyOf(row, partitions);
            if (!partition.equals(currentPartition)) {
                Arrays.fill(carried, null);
                currentPartition = partition;
            }
            for (int t = 0; t < targets.length; t++) {
                if (CellValues.isMissing(row[targets[t]])) {
                    row[targets[t]] = carried[t];
                } else {
                    carried[t] = row[targets[t]];
                }
            }
            out[i] = row;
        }
        return SegmentTable.wrap(table.columns(), new ArrayList<>(Arrays.asList(out)));
    }

    private static Object cast(Object value, ColumnType type, String column) {
        if (CellValues.isMissing(value)) {
            return null;
        }
        switch (type) {
            case LONG:
                if (value instanceof Number n) {
                    return CellValues.isIntegral(n) ? n.longValue() : (long) n.doubleValue();
                }
                return new BigDecimal(value.toString().trim()).longValue();
            case DOUBLE:
                if (value instanceof Number n) {
                    return n.doubleValue();
                }
                return Double.parseDouble(value.toString().trim());
            case STRING:
                return value.toString();
            default:
                throw new IllegalArgumentException("Unsupported cast of column '" + column + "' to " + type);
        }
    }

    private static int[] positions(SegmentTable table, List<String> columns) {
        int[] out = new int[columns.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = table.indexOf(columns.get(i));
        }
        return out;
    }

    private static List<Object> keyOf(Object[] row, int[] positions) {
        List<Object> key = new ArrayList<>(positions.length);
        for (int p : positions) {
            key.add(CellValues.normalize(row[p]));
        }
        return key;
    }

    /** Running aggregate over one group; missing values are skipped. */
    private static final class Accumulator {

        private final AggregateOp op;
        private Object extreme;
        private long count;
        private long longSum;
        private double doubleSum;
        private boolean integral = true;

        Accumulator(AggregateOp op) {
            this.op = op;
        }

        void add(Object value, String column) {
            if (CellValues.isMissing(value)) {
                return;
            }
            count++;
            switch (op) {
                case MIN:
                    extreme = extreme == null ? value : CellValues.min(extreme, value);
                    break;
                case MAX:
                    extreme = extreme == null ? value : CellValues.max(extreme, value);
                    break;
                case SUM:
                    if (integral && CellValues.isIntegral(value)) {
                        longSum += ((Number) value).longValue();
                    } else {
                        if (integral) {
                            doubleSum = longSum;
                            integral = false;
                        }
                        doubleSum += CellValues.toDouble(value, column);
                    }
                    break;
                default:
                    break;
            }
        }

        Object result() {
            switch (op) {
                case MIN:
                case MAX:
                    return extreme;
                case COUNT:
                    return count;
                case SUM:
                    return integral ? (Object) longSum : (Object) doubleSum;
                default:
                    throw new IllegalStateException("Unhandled aggregate " + op);
            }
        }
    }
}
