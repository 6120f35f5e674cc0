package com.di.segmerge.runner;

import com.di.segmerge.config.MergeJobProperties;
import com.di.segmerge.exception.SchemaException;
import com.di.segmerge.io.SegmentTableJson;
import com.di.segmerge.service.SegmentMergeService;
import com.di.segmerge.table.SegmentTable;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Runs one configured segment operation over JSON files: reads the input table(s), applies the
 * operation and writes the result.
 */
@Service
@Slf4j
public class MergeJobRunner {

    private final SegmentMergeService mergeService;
    private final SegmentTableJson tableJson;
    private final MergeJobProperties jobProperties;

    public MergeJobRunner(SegmentMergeService mergeService, SegmentTableJson tableJson,
                          MergeJobProperties jobProperties) {
        this.mergeService = mergeService;
        this.tableJson = tableJson;
        this.jobProperties = jobProperties != null ? jobProperties : new MergeJobProperties();
    }

    /**
     * @return the table written to the output file
     * @throws UncheckedIOException if an input cannot be read or the output cannot be written
     */
    public SegmentTable runJob() {
        String jobId = "job-" + UUID.randomUUID();
        MDC.put("jobId", jobId);
        try {
            MergeOperation operation = jobProperties.getOperation();
            log.info("[JOB] {} starting {} left={} right={} output={}", jobId, operation,
                    jobProperties.getLeftFile(), jobProperties.getRightFile(), jobProperties.getOutputFile());
            long startedAt = System.currentTimeMillis();

            SegmentTable left = readTable("left-file", jobProperties.getLeftFile());
            SegmentTable right = operation.isTwoTables()
                    ? readTable("right-file", jobProperties.getRightFile())
                    : null;
            SegmentTable result = execute(operation, left, right);

            writeTable(result);
            log.info("[JOB] {} finished {} rows={} in {} ms", jobId, operation, result.size(),
                    System.currentTimeMillis() - startedAt);
            return result;
        } finally {
            MDC.remove("jobId");
        }
    }

    /** Applies the operation to tables already loaded. */
    public SegmentTable execute(MergeOperation operation, SegmentTable left, SegmentTable right) {
        List<String> discrete = jobProperties.getDiscreteColumns();
        List<String> continuous = jobProperties.getContinuousColumns();
        switch (operation) {
            case MERGE:
                return mergeService.merge(left, right, discrete, continuous, jobProperties.getHow());
            case OVERLAY_MERGE:
                return mergeService.unbalancedMerge(left, right, discrete, continuous);
            case MERGE_EVENT:
                return mergeService.mergeEvent(left, right, discrete, continuous);
            case AGGREGATE_CONSTANT:
                return mergeService.aggregateConstant(left, discrete, continuous);
            case REGULAR_SEGMENTATION:
                return mergeService.createRegularSegmentSegmentation(left, jobProperties.getLength(),
                        discrete, continuous);
            case BUILD_ADMISSIBLE:
                return mergeService.buildAdmissible(left, discrete, continuous);
            case CREATE_CONTINUITY:
                return mergeService.createContinuity(left, discrete, continuous, jobProperties.getLimit(), true);
            default:
                throw new IllegalStateException("Unhandled operation " + operation);
        }
    }

    private SegmentTable readTable(String property, String file) {
        if (file == null || file.isBlank()) {
            throw new SchemaException("segmerge.job." + property + " must be set for this operation");
        }
        try {
            return tableJson.read(Path.of(file));
        } catch (IOException e) {
            log.error("[JOB] cannot read {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Failed to read table from " + file, e);
        }
    }

    private void writeTable(SegmentTable table) {
        String file = jobProperties.getOutputFile();
        if (file == null || file.isBlank()) {
            log.info("[JOB] no output-file configured, result not written");
            return;
        }
        try {
            tableJson.write(table, Path.of(file));
        } catch (IOException e) {
            log.error("[JOB] cannot write {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Failed to write table to " + file, e);
        }
    }
}
