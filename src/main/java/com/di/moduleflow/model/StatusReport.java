package com.di.moduleflow.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single persisted audit record of one module run.
 *
 * <p>Exactly one report is written to the status log per module invocation, whatever the
 * outcome. {@link #status} is one of:
 * <pre>
 *   SUCCESS
 *   EMPTY
 *   FAILED --> ROLLBACK SUCCESSFUL: ERROR:&lt;message&gt;
 *   FAILED --> ROLLBACK FAILED: ERROR:&lt;message&gt;
 * </pre>
 *
 * <p>The status log is keyed by {@code (organization_id, run_id)}; {@link #toRow()} produces
 * the column layout and {@link #fromRow(Map)} reads it back for run history.
 */
@Value
@Builder(toBuilder = true)
public class StatusReport {

    public static final String SUCCESS = "SUCCESS";
    public static final String EMPTY = "EMPTY";
    public static final String FAILED_PREFIX = "FAILED --> ";

    /** Retention recorded on SUCCESS and EMPTY reports; FAILED reports record 0. */
    public static final int VACUUM_RETENTION_HOURS = 168;

    String organizationId;
    String runId;
    int moduleId;
    String moduleName;
    String primordialDateString;

    // ---- run window (epoch millis) -----------------------------------------
    long runStartTs;
    long runEndTs;
    long fromTs;
    long untilTs;

    String dataFrequency;
    String status;
    long recordsAppended;
    long lastOptimizedTs;
    int vacuumRetentionHours;

    // ---- audit echoes ------------------------------------------------------
    String inputConfig;
    String parsedConfig;

    /** Snapshot instant of the pipeline run that produced this report; orders history. */
    long pipelineSnapTs;

    public boolean isFailed() {
        return status != null && status.startsWith(FAILED_PREFIX);
    }

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("organization_id", organizationId);
        row.put("run_id", runId);
        row.put("module_id", moduleId);
        row.put("module_name", moduleName);
        row.put("primordial_date_string", primordialDateString);
        row.put("run_start_ts", runStartTs);
        row.put("run_end_ts", runEndTs);
        row.put("from_ts", fromTs);
        row.put("until_ts", untilTs);
        row.put("data_frequency", dataFrequency);
        row.put("status", status);
        row.put("records_appended", recordsAppended);
        row.put("last_optimized_ts", lastOptimizedTs);
        row.put("vacuum_retention_hours", vacuumRetentionHours);
        row.put("input_config", inputConfig);
        row.put("parsed_config", parsedConfig);
        row.put("pipeline_snap_ts", pipelineSnapTs);
        return row;
    }

    public static StatusReport fromRow(Map<String, Object> row) {
        return StatusReport.builder()
                .organizationId(asString(row.get("organization_id")))
                .runId(asString(row.get("run_id")))
                .moduleId((int) asLong(row.get("module_id")))
                .moduleName(asString(row.get("module_name")))
                .primordialDateString(asString(row.get("primordial_date_string")))
                .runStartTs(asLong(row.get("run_start_ts")))
                .runEndTs(asLong(row.get("run_end_ts")))
                .fromTs(asLong(row.get("from_ts")))
                .untilTs(asLong(row.get("until_ts")))
                .dataFrequency(asString(row.get("data_frequency")))
                .status(asString(row.get("status")))
                .recordsAppended(asLong(row.get("records_appended")))
                .lastOptimizedTs(asLong(row.get("last_optimized_ts")))
                .vacuumRetentionHours((int) asLong(row.get("vacuum_retention_hours")))
                .inputConfig(asString(row.get("input_config")))
                .parsedConfig(asString(row.get("parsed_config")))
                .pipelineSnapTs(asLong(row.get("pipeline_snap_ts")))
                .build();
    }

    private static String asString(Object v) {
        return v == null ? null : v.toString();
    }

    private static long asLong(Object v) {
        if (v == null) return 0L;
        if (v instanceof Number) return ((Number) v).longValue();
        return Long.parseLong(v.toString().trim());
    }
}
