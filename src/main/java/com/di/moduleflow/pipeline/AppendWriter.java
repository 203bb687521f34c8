package com.di.moduleflow.pipeline;

import com.di.moduleflow.config.ExecutionContext;
import com.di.moduleflow.config.PipelineConfig;
import com.di.moduleflow.dataset.Dataset;
import com.di.moduleflow.model.Module;
import com.di.moduleflow.model.PipelineTable;
import com.di.moduleflow.model.RecordCountPolicy;
import com.di.moduleflow.model.StatusReport;
import com.di.moduleflow.storage.Database;
import com.di.moduleflow.util.ModuleMetrics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends a module's output to its target and records a SUCCESS report.
 *
 * <pre>
 *   1. size write partitions        (PartitionSizer, sets a session override)
 *   2. write                        (false from storage = fatal)
 *   3. count records for the window (RecordCountPolicy)
 *   4. schedule optimize            (OptimizeScheduler → PostProcessor.markOptimize)
 *   5. commit the write             (no longer reverted by a rollback)
 *   6. restore session overrides
 *   7. persist SUCCESS report
 * </pre>
 * Anything thrown in steps 1-5 goes to {@link FailureHandler}; no SUCCESS report is produced
 * after that.
 */
@Slf4j
public class AppendWriter implements ModuleWriter {

    @Getter
    private final PipelineTable target;

    private final Database database;
    private final ExecutionContext context;
    private final PipelineConfig config;
    private final PartitionSizer partitionSizer;
    private final OptimizeScheduler optimizeScheduler;
    private final PostProcessor postProcessor;
    private final StatusReportWriter reportWriter;
    private final FailureHandler failureHandler;
    private final ModuleMetrics metrics;

    public AppendWriter(PipelineTable target,
                        Database database,
                        ExecutionContext context,
                        PartitionSizer partitionSizer,
                        OptimizeScheduler optimizeScheduler,
                        PostProcessor postProcessor,
                        StatusReportWriter reportWriter,
                        FailureHandler failureHandler,
                        ModuleMetrics metrics) {
        this.target = target;
        this.database = database;
        this.context = context;
        this.config = context.getConfig();
        this.partitionSizer = partitionSizer;
        this.optimizeScheduler = optimizeScheduler;
        this.postProcessor = postProcessor;
        this.reportWriter = reportWriter;
        this.failureHandler = failureHandler;
        this.metrics = metrics;
    }

    @Override
    public ModuleResult write(Dataset dataset, Module module, int sourcePartitions) {
        long startTime = context.getClock().millis();
        int moduleId = module.moduleId();

        long recordsAppended;
        long lastOptimizedTs;
        try {
            int partitions = partitionSizer.writePartitions(sourcePartitions, target);
            Dataset finalDataset = dataset.repartition(partitions);

            log.info("[APPEND] Beginning append to {} (partitions={})", target.tableFullName(), partitions);
            if (!database.write(finalDataset, target)) {
                throw new WriteFailureException("PIPELINE FAILURE");
            }

            recordsAppended = countRecords(finalDataset, moduleId);
            log.info("[APPEND] SUCCESS! {}: {} records appended.", module.moduleName(), recordsAppended);

            lastOptimizedTs = optimizeScheduler.getLastOptimized(moduleId);
            if (optimizeScheduler.needsOptimize(moduleId, target)) {
                postProcessor.markOptimize(target);
                lastOptimizedTs = config.untilTime(moduleId).toEpochMilli();
            }

            database.commit(target);
        } catch (Throwable t) {
            return failureHandler.failModule(module, target, t);
        }

        context.getSessionConf().restore(config.getInitialSessionConf());

        long endTime = context.getClock().millis();
        metrics.recordAppend(recordsAppended, endTime - startTime);

        StatusReport report = reportWriter.reportFor(module)
                .runStartTs(startTime)
                .runEndTs(endTime)
                .untilTs(config.untilTime(moduleId).toEpochMilli())
                .dataFrequency(target.getDataFrequency().name())
                .status(StatusReport.SUCCESS)
                .recordsAppended(recordsAppended)
                .lastOptimizedTs(lastOptimizedTs)
                .vacuumRetentionHours(StatusReport.VACUUM_RETENTION_HOURS)
                .build();
        reportWriter.finalizeModule(report);
        return ModuleResult.success(report);
    }

    private long countRecords(Dataset written, int moduleId) {
        if (target.getRecordCountPolicy() == RecordCountPolicy.WINDOWED_REREAD) {
            return database.readIncremental(target,
                            config.fromTime(moduleId), config.untilTime(moduleId),
                            target.requireIncrementalRead())
                    .count();
        }
        return written.count();
    }
}
