package com.di.moduleflow.pipeline;

import com.di.moduleflow.config.ExecutionContext;
import com.di.moduleflow.config.PipelineConfig;
import com.di.moduleflow.model.Module;
import com.di.moduleflow.model.StatusReport;

/**
 * Records an EMPTY run for a module whose source had no new data. Nothing is written to the
 * target and nothing is rolled back.
 */
public class EmptyInputHandler {

    private final ExecutionContext context;
    private final PipelineConfig config;
    private final StatusReportWriter reportWriter;
    private final OptimizeScheduler optimizeScheduler;

    public EmptyInputHandler(ExecutionContext context,
                             StatusReportWriter reportWriter,
                             OptimizeScheduler optimizeScheduler) {
        this.context = context;
        this.config = context.getConfig();
        this.reportWriter = reportWriter;
        this.optimizeScheduler = optimizeScheduler;
    }

    public ModuleResult noNewDataHandler(Module module, String reason) {
        long now = context.getClock().millis();
        StatusReport report = reportWriter.reportFor(module)
                .runStartTs(now)
                .runEndTs(now)
                .untilTs(config.verifiedUntilTime(module.moduleId()).toEpochMilli())
                .dataFrequency("")
                .status(StatusReport.EMPTY)
                .recordsAppended(0L)
                .lastOptimizedTs(optimizeScheduler.getLastOptimized(module.moduleId()))
                .vacuumRetentionHours(StatusReport.VACUUM_RETENTION_HOURS)
                .build();
        reportWriter.finalizeModule(report);
        return ModuleResult.empty(reason, report);
    }
}
