package com.di.moduleflow.pipeline;

import com.di.moduleflow.config.ExecutionContext;
import com.di.moduleflow.config.PipelineConfig;
import com.di.moduleflow.dataset.InMemoryDataset;
import com.di.moduleflow.model.Module;
import com.di.moduleflow.model.StatusReport;
import com.di.moduleflow.storage.Database;
import com.di.moduleflow.util.ModuleMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Persists status reports to the append-only status log keyed by
 * {@code (organization_id, run_id)}. Called exactly once per module invocation; calling it
 * twice for the same module run is a caller defect and is not guarded against.
 */
@Slf4j
public class StatusReportWriter {

    private final Database database;
    private final PipelineConfig config;
    private final ModuleMetrics metrics;

    public StatusReportWriter(Database database, ExecutionContext context, ModuleMetrics metrics) {
        this.database = database;
        this.config = context.getConfig();
        this.metrics = metrics;
    }

    /**
     * Builder pre-filled with the fields every report shares: identity, window start and the
     * configuration echoes.
     */
    public StatusReport.StatusReportBuilder reportFor(Module module) {
        return StatusReport.builder()
                .organizationId(config.getOrganizationId())
                .runId(config.getRunId())
                .moduleId(module.moduleId())
                .moduleName(module.moduleName())
                .primordialDateString(config.getPrimordialDateString())
                .fromTs(config.fromTime(module.moduleId()).toEpochMilli())
                .inputConfig(config.getInputConfig())
                .parsedConfig(config.getParsedConfig())
                .pipelineSnapTs(config.getPipelineSnapTime().toEpochMilli());
    }

    public void finalizeModule(StatusReport report) {
        if (report.getStatus() == null || report.getStatus().isBlank()) {
            throw new IllegalArgumentException("status must be set before a report is persisted");
        }
        boolean written = database.write(InMemoryDataset.of(List.of(report.toRow())), config.getStatusTarget());
        if (!written) {
            throw new StatusReportPersistenceException("Status report for module "
                    + report.getModuleId() + "-" + report.getModuleName() + " could not be written to "
                    + config.getStatusTarget().tableFullName());
        }
        database.commit(config.getStatusTarget());
        metrics.recordModuleRun(outcomeTag(report), report.getModuleId());
        log.info("[REPORT] moduleId={} recordsAppended={} window=[{}, {}) status={}",
                report.getModuleId(), report.getRecordsAppended(),
                report.getFromTs(), report.getUntilTs(), report.getStatus());
    }

    private static String outcomeTag(StatusReport report) {
        if (report.isFailed()) return "failed";
        return StatusReport.EMPTY.equals(report.getStatus()) ? "empty" : "success";
    }
}
