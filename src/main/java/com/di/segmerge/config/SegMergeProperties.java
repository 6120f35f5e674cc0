package com.di.segmerge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for the segment engines, bound from {@code application.yml}.
 *
 * <pre>
 * segmerge:
 *   merge:
 *     suppress-duplicates: false
 *     verbose: false
 *     continuity-limit:
 *     left-suffix: _left
 *     right-suffix: _right
 *     event-suffix: _event
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "segmerge.merge")
public class SegMergeProperties {

    /** Coalesce adjacent merge output rows with identical payload. */
    private boolean suppressDuplicates = false;

    /** Log merge row counts at INFO instead of DEBUG. */
    private boolean verbose = false;

    /**
     * Widest gap that continuity filling may bridge, in units of the continuous columns.
     * Null = no limit.
     */
    private Double continuityLimit;

    /** Appended to a left payload column whose name also exists on the right. */
    private String leftSuffix = "_left";

    /** Appended to a right payload column whose name also exists on the left. */
    private String rightSuffix = "_right";

    /** Appended to an event payload column whose name already exists in the interval table. */
    private String eventSuffix = "_event";
}
