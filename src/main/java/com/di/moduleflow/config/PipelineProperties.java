package com.di.moduleflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single binding for pipeline-wide configuration.
 *
 * <pre>
 * moduleflow:
 *   pipeline:
 *     organization-id: 2222170229861029
 *     primordial-date-string: 2024-01-01
 *     max-days: 60
 *     local-testing: false
 *     optimize-interval: 7d
 *     non-empty-modules: [1005]
 *     temp-cleanup-paths: [/tmp/moduleflow/bronze/batches]
 *     session-conf:
 *       moduleflow.shuffle.partitions.max: 1000
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "moduleflow.pipeline")
public class PipelineProperties {

    /** Workspace / tenant the status log rows are keyed by. */
    private String organizationId = "default";

    /** Earliest date any module reads from on its first run (yyyy-MM-dd, UTC). */
    private String primordialDateString = "2024-01-01";

    /** Upper bound, in days, of one module's incremental window. */
    private int maxDays = 60;

    /** Isolated test mode: never schedules optimize. */
    private boolean localTesting = false;

    /** Verbose schema verification logs. */
    private boolean debug = false;

    private Duration optimizeInterval = Duration.ofDays(7);

    /** Partition count assumed when the source cannot report one (streaming). */
    private int defaultSourcePartitions = 200;

    // ------------------------------------------------------------------ //
    // Status log                                                          //
    // ------------------------------------------------------------------ //

    private String statusDatabase = "moduleflow_etl";
    private String statusTable = "pipeline_report";

    /**
     * Modules whose window must not advance while empty or failed; their EMPTY and FAILED
     * reports record {@code untilTs = fromTs}.
     */
    private List<Integer> nonEmptyModules = new ArrayList<>(List.of(1005));

    /** Scratch directories removed after post-processing. */
    private List<String> tempCleanupPaths = new ArrayList<>();

    /** Session configuration in force before any module runs; restored after each success. */
    private Map<String, String> sessionConf = new LinkedHashMap<>();
}
