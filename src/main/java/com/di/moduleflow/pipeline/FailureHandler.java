package com.di.moduleflow.pipeline;

import com.di.moduleflow.config.ExecutionContext;
import com.di.moduleflow.config.PipelineConfig;
import com.di.moduleflow.model.Module;
import com.di.moduleflow.model.PipelineTable;
import com.di.moduleflow.model.StatusReport;
import com.di.moduleflow.storage.Database;
import com.di.moduleflow.util.ModuleMetrics;
import lombok.extern.slf4j.Slf4j;

/**
 * The only path to a FAILED report. Runs a fixed three-step protocol:
 * <ol>
 *   <li>attempt to roll the target back (a failing rollback is logged, never raised)</li>
 *   <li>persist the FAILED report</li>
 *   <li>return the failed result to the caller</li>
 * </ol>
 * The order is fixed: the report is durable before anyone observes the failure.
 */
@Slf4j
public class FailureHandler {

    private final Database database;
    private final PipelineConfig config;
    private final StatusReportWriter reportWriter;
    private final OptimizeScheduler optimizeScheduler;
    private final ModuleMetrics metrics;

    public FailureHandler(Database database,
                          ExecutionContext context,
                          StatusReportWriter reportWriter,
                          OptimizeScheduler optimizeScheduler,
                          ModuleMetrics metrics) {
        this.database = database;
        this.config = context.getConfig();
        this.reportWriter = reportWriter;
        this.optimizeScheduler = optimizeScheduler;
        this.metrics = metrics;
    }

    /**
     * Failure path for anything thrown while a module executes, checked exceptions and
     * {@link Error}s included. A {@link VirtualMachineError} is rethrown once its FAILED report
     * is persisted.
     */
    public ModuleResult failModule(Module module, PipelineTable target, Throwable cause) {
        String msg = module.moduleName() + " FAILED -->\nMessage: " + cause.getMessage() + "\nCause:" + cause.getCause();
        log.error("[MODULE] {}", msg, cause);
        ModuleResult failed = failModule(module, target, msg, FailureKind.categorize(cause));
        if (cause instanceof VirtualMachineError) {
            throw (VirtualMachineError) cause;
        }
        return failed;
    }

    public ModuleResult failModule(Module module, PipelineTable target, String msg, FailureKind kind) {
        log.warn("[ROLLBACK] Attempting Roll back {}.", module.moduleName());
        RollbackOutcome rollback = rollback(module, target);
        metrics.recordRollback(rollback.getLabel());

        StatusReport report = reportWriter.reportFor(module)
                .runStartTs(0L)
                .runEndTs(0L)
                .untilTs(config.verifiedUntilTime(module.moduleId()).toEpochMilli())
                .dataFrequency(target.getDataFrequency().name())
                .status(StatusReport.FAILED_PREFIX + rollback.getLabel() + ": ERROR:" + msg)
                .recordsAppended(0L)
                .lastOptimizedTs(optimizeScheduler.getLastOptimized(module.moduleId()))
                .vacuumRetentionHours(0)
                .build();
        reportWriter.finalizeModule(report);
        return ModuleResult.failed(kind, msg, report);
    }

    private RollbackOutcome rollback(Module module, PipelineTable target) {
        try {
            database.rollbackTarget(target);
            return RollbackOutcome.ROLLBACK_SUCCESSFUL;
        } catch (RuntimeException e) {
            log.error("[ROLLBACK] ROLLBACK FAILED: {} -->\nMessage: {}\nCause:{}",
                    module.moduleName(), e.getMessage(), e.getCause(), e);
            return RollbackOutcome.ROLLBACK_FAILED;
        }
    }
}
