package com.di.segmerge.config;

import com.di.segmerge.runner.MergeOperation;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * One batch run of a segment operation over JSON files, started with the application
 * when {@link #enabled} is true.
 *
 * <pre>
 * segmerge:
 *   job:
 *     enabled: true
 *     operation: MERGE
 *     left-file: data/left.json
 *     right-file: data/right.json
 *     output-file: out/merged.json
 *     discrete-columns: id
 *     continuous-columns: t1,t2
 *     how: outer
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "segmerge.job")
public class MergeJobProperties {

    private boolean enabled = false;

    private MergeOperation operation = MergeOperation.MERGE;

    /** Main input; the left table of two-table operations, the base table of an overlay merge. */
    private String leftFile;

    /** Second input of two-table operations; unused otherwise. */
    private String rightFile;

    private String outputFile;

    private List<String> discreteColumns = new ArrayList<>();

    /** Exactly two names: start column then end column. */
    private List<String> continuousColumns = new ArrayList<>();

    /** Join kind for MERGE. */
    private String how = "outer";

    /** Bin length for REGULAR_SEGMENTATION. */
    private double length = 0;

    /** Gap width limit for CREATE_CONTINUITY; null = bridge every gap. */
    private Double limit;
}
