package com.di.moduleflow.config;

import com.di.moduleflow.model.PipelineTable;
import com.di.moduleflow.model.StatusReport;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the pipeline configuration resolved for one run.
 */
public interface PipelineConfig {

    String getOrganizationId();

    String getRunId();

    String getPrimordialDateString();

    Instant getPipelineSnapTime();

    /** Start of the module's incremental window (inclusive). */
    Instant fromTime(int moduleId);

    /** End of the module's incremental window (exclusive). */
    Instant untilTime(int moduleId);

    /**
     * Window end recorded by EMPTY and FAILED reports: {@link #fromTime(int)} for modules that
     * must not advance while empty, {@link #untilTime(int)} otherwise.
     */
    Instant verifiedUntilTime(int moduleId);

    /** True when this organization has no prior successful or empty run. */
    boolean isFirstRun();

    boolean isLocalTesting();

    boolean isDebug();

    /** Latest non-failed report per module from earlier runs. */
    List<StatusReport> getLastRunDetail();

    /** Configuration as supplied, serialized for audit. */
    String getInputConfig();

    /** Configuration as resolved for this run, serialized for audit. */
    String getParsedConfig();

    Map<String, String> getInitialSessionConf();

    Duration getOptimizeInterval();

    int getDefaultSourcePartitions();

    PipelineTable getStatusTarget();

    List<String> getTempCleanupPaths();
}
