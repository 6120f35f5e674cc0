package com.di.segmerge.service;

import com.di.segmerge.aggregate.ConstantRunAggregator;
import com.di.segmerge.aggregate.EventMergeEngine;
import com.di.segmerge.aggregate.RegularSegmentation;
import com.di.segmerge.config.SegMergeProperties;
import com.di.segmerge.merge.BaseSegmentFate;
import com.di.segmerge.merge.IntervalMergeEngine;
import com.di.segmerge.merge.OverlayMergeEngine;
import com.di.segmerge.segment.ContinuityEngine;
import com.di.segmerge.table.SegmentLayout;
import com.di.segmerge.table.SegmentTable;
import com.di.segmerge.util.ArgumentValidator;
import com.di.segmerge.zone.AdmissiblePartitionBuilder;
import com.di.segmerge.zone.ZoneDetector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for every segment operation, taking the discrete and continuous column names
 * the way callers pass them and applying the configured defaults.
 */
@Service
@RequiredArgsConstructor
public class SegmentMergeService {

    private final ContinuityEngine continuityEngine;
    private final ZoneDetector zoneDetector;
    private final AdmissiblePartitionBuilder admissibleBuilder;
    private final IntervalMergeEngine mergeEngine;
    private final OverlayMergeEngine overlayEngine;
    private final ConstantRunAggregator constantRunAggregator;
    private final RegularSegmentation regularSegmentation;
    private final EventMergeEngine eventMergeEngine;
    private final SegMergeProperties properties;

    // ============================================================================
    // Continuity
    // ============================================================================

    public boolean[] computeDiscontinuity(SegmentTable table, List<String> discrete, List<String> continuous) {
        return continuityEngine.computeDiscontinuity(table, layout(table, discrete, continuous));
    }

    /** Gap filling with the configured width limit, result sorted. */
    public SegmentTable createContinuity(SegmentTable table, List<String> discrete, List<String> continuous) {
        return createContinuity(table, discrete, continuous, properties.getContinuityLimit(), true);
    }

    public SegmentTable createContinuity(SegmentTable table, List<String> discrete, List<String> continuous,
                                         Double limit, boolean sort) {
        return continuityEngine.createContinuity(table, layout(table, discrete, continuous),
                ArgumentValidator.validateLimit(limit), sort);
    }

    // ============================================================================
    // Zones and admissibility
    // ============================================================================

    public SegmentTable createZones(SegmentTable table, List<String> discrete, List<String> continuous) {
        return zoneDetector.createZones(table, layout(table, discrete, continuous));
    }

    public boolean[] getOverlapping(SegmentTable table, List<String> discrete, List<String> continuous) {
        return zoneDetector.getOverlapping(table, layout(table, discrete, continuous));
    }

    public boolean isAdmissible(SegmentTable table, List<String> discrete, List<String> continuous) {
        return zoneDetector.isAdmissible(table, layout(table, discrete, continuous));
    }

    /** Rows of the table that overlap another row of their track. */
    public SegmentTable sampleNonAdmissible(SegmentTable table, List<String> discrete, List<String> continuous) {
        return zoneDetector.sampleNonAdmissible(table, layout(table, discrete, continuous));
    }

    public SegmentTable buildAdmissible(SegmentTable table, List<String> discrete, List<String> continuous) {
        return admissibleBuilder.build(table, layout(table, discrete, continuous));
    }

    // ============================================================================
    // Merges
    // ============================================================================

    public SegmentTable merge(SegmentTable left, SegmentTable right,
                              List<String> discrete, List<String> continuous, String how) {
        return mergeEngine.merge(left, right, discrete, continuous, how);
    }

    public SegmentTable merge(SegmentTable left, SegmentTable right,
                              List<String> discrete, List<String> continuous, String how,
                              boolean suppressDuplicates, boolean verbose) {
        return mergeEngine.merge(left, right, discrete, continuous, how, suppressDuplicates, verbose);
    }

    public SegmentTable suppressDuplicates(SegmentTable table, List<String> discrete, List<String> continuous) {
        return mergeEngine.suppressDuplicates(table, layout(table, discrete, continuous));
    }

    /** Overlays {@code override} onto the admissible {@code base}, override winning. */
    public SegmentTable unbalancedMerge(SegmentTable base, SegmentTable override,
                                       List<String> discrete, List<String> continuous) {
        ArgumentValidator.requireNonNull(override, "Override table");
        return overlayEngine.overlay(base, override, layout(base, discrete, continuous));
    }

    public List<BaseSegmentFate> classifyBase(SegmentTable base, SegmentTable override,
                                              List<String> discrete, List<String> continuous) {
        ArgumentValidator.requireNonNull(override, "Override table");
        return overlayEngine.classifyBase(base, override, layout(base, discrete, continuous));
    }

    public SegmentTable mergeEvent(SegmentTable intervals, SegmentTable events,
                                   List<String> discrete, List<String> continuous) {
        return eventMergeEngine.mergeEvent(intervals, events, layout(intervals, discrete, continuous));
    }

    // ============================================================================
    // Aggregation
    // ============================================================================

    public SegmentTable aggregateConstant(SegmentTable table, List<String> discrete, List<String> continuous) {
        return constantRunAggregator.aggregate(table, layout(table, discrete, continuous));
    }

    public SegmentTable createRegularSegmentSegmentation(SegmentTable table, double length,
                                                         List<String> discrete, List<String> continuous) {
        return regularSegmentation.segment(table, length, layout(table, discrete, continuous));
    }

    private static SegmentLayout layout(SegmentTable table, List<String> discrete, List<String> continuous) {
        ArgumentValidator.requireNonNull(table, "Table");
        ArgumentValidator.requireNonNull(discrete, "Discrete columns");
        ArgumentValidator.requireNonNull(continuous, "Continuous columns");
        return SegmentLayout.of(discrete, continuous);
    }
}
