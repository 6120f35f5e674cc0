package com.di.segmerge.merge;

import com.di.segmerge.table.SegmentLayout;
import com.di.segmerge.table.SegmentTable;
import com.di.segmerge.util.CellValues;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeSet;

/**
 * Shared breakpoint partition of two segment tables.
 *
 * <p>Per track, every start and end of both sides becomes a breakpoint. For each pair of
 * consecutive breakpoints {@code [p, q)} the covering row of a side is the last segment, in
 * {@code (start, end)} order, starting at or before {@code p}; it only counts when {@code p}
 * lies strictly before that segment's end and the segment carries a source row.
 */
final class BreakpointSweep {

    private static final Comparator<List<Object>> KEY_ORDER = (a, b) -> {
        for (int i = 0; i < a.size(); i++) {
            int cmp = CellValues.compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    };

    private BreakpointSweep() {}

    /**
     * @param left        left side, sorted by key, start and end
     * @param leftSource  column of {@code left} holding source row numbers, missing for fillers
     * @param right       right side, sorted the same way
     * @param rightSource column of {@code right} holding source row numbers
     * @return pieces covered by at least one side, sorted by key then start
     */
    static List<SweepSegment> sweep(SegmentTable left, String leftSource,
                                    SegmentTable right, String rightSource,
                                    SegmentLayout layout) {
        Map<List<Object>, Track> tracks = new LinkedHashMap<>();
        collect(left, leftSource, layout, tracks, true);
        collect(right, rightSource, layout, tracks, false);

        List<Track> ordered = new ArrayList<>(tracks.values());
        ordered.sort((a, b) -> KEY_ORDER.compare(a.key, b.key));

        List<SweepSegment> out = new ArrayList<>();
        for (Track track : ordered) {
            TreeSet<Object> points = new TreeSet<>(CellValues::compare);
            for (Cover c : track.left) {
                points.add(c.start);
                points.add(c.end);
            }
            for (Cover c : track.right) {
                points.add(c.start);
                points.add(c.end);
            }
            List<Object> breakpoints = new ArrayList<>(points);
            Cursor leftCursor = new Cursor(track.left);
            Cursor rightCursor = new Cursor(track.right);
            for (int k = 0; k + 1 < breakpoints.size(); k++) {
                Object p = breakpoints.get(k);
                SweepSegment piece = new SweepSegment(track.key, p, breakpoints.get(k + 1),
                        leftCursor.coverAt(p), rightCursor.coverAt(p));
                if (!piece.bothAbsent()) {
                    out.add(piece);
                }
            }
        }
        return out;
    }

    private static void collect(SegmentTable side, String sourceColumn, SegmentLayout layout,
                                Map<List<Object>, Track> tracks, boolean isLeft) {
        int start = side.indexOf(layout.start());
        int end = side.indexOf(layout.end());
        int source = side.indexOf(sourceColumn);
        for (int i = 0; i < side.size(); i++) {
            List<Object> key = side.values(i, layout.discrete());
            Track track = tracks.computeIfAbsent(CellValues.key(key), k -> new Track(key));
            Object src = side.get(i, source);
            Cover cover = new Cover(side.get(i, start), side.get(i, end),
                    CellValues.isMissing(src) ? null : ((Number) src).intValue());
            (isLeft ? track.left : track.right).add(cover);
        }
    }

    private record Cover(Object start, Object end, Integer source) {}

    private static final class Track {
        final List<Object> key;
        final List<Cover> left = new ArrayList<>();
        final List<Cover> right = new ArrayList<>();

        Track(List<Object> key) {
            this.key = key;
        }
    }

    /** Forward-only lookup over one side's segments; breakpoints must be asked in increasing order. */
    private static final class Cursor {
        private final List<Cover> covers;
        private int position = -1;

        Cursor(List<Cover> covers) {
            this.covers = covers;
        }

        OptionalInt coverAt(Object point) {
            while (position + 1 < covers.size()
                    && CellValues.compare(covers.get(position + 1).start, point) <= 0) {
                position++;
            }
            if (position < 0) {
                return OptionalInt.empty();
            }
            Cover c = covers.get(position);
            if (c.source == null || CellValues.compare(point, c.end) >= 0) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(c.source);
        }
    }
}
