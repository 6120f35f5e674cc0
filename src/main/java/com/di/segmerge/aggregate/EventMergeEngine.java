package com.di.segmerge.aggregate;

import com.di.segmerge.config.SegMergeProperties;
import com.di.segmerge.exception.SchemaException;
import com.di.segmerge.merge.IntervalMergeEngine;
import com.di.segmerge.table.SegmentLayout;
import com.di.segmerge.table.SegmentTable;
import com.di.segmerge.table.TabularStore;
import com.di.segmerge.util.ArgumentValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Stamps every interval segment with the latest event state of its track.
 *
 * <p>Events are points in time. They are interleaved with the interval rows by time, events
 * first on ties, and their payload is carried forward onto the following interval rows of the
 * same track until the next event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventMergeEngine {

    private static final String TIME = "__time__";
    private static final String KIND = "__kind__";
    private static final long EVENT_ROW = 0L;
    private static final long INTERVAL_ROW = 1L;

    private final TabularStore store;
    private final IntervalMergeEngine mergeEngine;
    private final SegMergeProperties properties;

    /**
     * @param intervals table carrying the layout's discrete and interval columns
     * @param events    table carrying the discrete columns and a single time column, the
     *                  layout's start column when present, otherwise its end column
     * @return the interval rows, sorted by key and start, with event payload columns appended
     */
    public SegmentTable mergeEvent(SegmentTable intervals, SegmentTable events, SegmentLayout layout) {
        ArgumentValidator.validateTable(intervals, layout, "Interval table");
        ArgumentValidator.requireNonNull(events, "Event table");
        if (!layout.discretePresentIn(events).equals(layout.discrete())) {
            throw new SchemaException(String.format(
                    "Event table is missing discrete column(s), expected %s, available: %s",
                    layout.discrete(), events.columns()));
        }
        String timeColumn = timeColumn(events, layout);

        List<String> eventPayload = new ArrayList<>();
        List<String> renamedPayload = new ArrayList<>();
        for (String c : events.columns()) {
            if (layout.discrete().contains(c) || c.equals(timeColumn)) {
                continue;
            }
            eventPayload.add(c);
            renamedPayload.add(intervals.hasColumn(c) ? c + properties.getEventSuffix() : c);
        }

        SegmentTable normalized = mergeEngine.normalizeBounds(intervals, layout);
        SegmentTable intervalRows = normalized
                .withColumn(TIME, normalized.column(layout.start()))
                .withColumn(KIND, Collections.nCopies(normalized.size(), INTERVAL_ROW));

        List<String> from = new ArrayList<>(eventPayload);
        from.add(timeColumn);
        List<String> to = new ArrayList<>(renamedPayload);
        to.add(TIME);
        List<String> eventColumns = new ArrayList<>(layout.discrete());
        eventColumns.add(timeColumn);
        eventColumns.addAll(eventPayload);
        SegmentTable eventRows = store.renameColumns(store.selectColumns(events, eventColumns), from, to);
        eventRows = eventRows.withColumn(KIND, Collections.nCopies(eventRows.size(), EVENT_ROW));

        List<String> order = new ArrayList<>(layout.discrete());
        order.add(TIME);
        order.add(KIND);
        SegmentTable stream = store.sort(store.concat(List.of(intervalRows, eventRows)), order);
        SegmentTable filled = store.forwardFill(stream, renamedPayload, layout.discrete());

        int kind = filled.indexOf(KIND);
        BitSet keep = new BitSet(filled.size());
        for (int i = 0; i < filled.size(); i++) {
            keep.set(i, ((Number) filled.get(i, kind)).longValue() == INTERVAL_ROW);
        }
        List<String> outColumns = new ArrayList<>(intervals.columns());
        outColumns.addAll(renamedPayload);
        SegmentTable out = store.sort(store.selectColumns(filled.filter(keep), outColumns), layout.trackOrder());
        log.debug("[EVENT] intervals={} events={} event-columns={} out={}",
                intervals.size(), events.size(), renamedPayload, out.size());
        return out;
    }

    private static String timeColumn(SegmentTable events, SegmentLayout layout) {
        if (events.hasColumn(layout.start())) {
            return layout.start();
        }
        if (events.hasColumn(layout.end())) {
            return layout.end();
        }
        throw new SchemaException(String.format(
                "Event table has no time column: expected %s or %s", layout.start(), layout.end()));
    }
}
