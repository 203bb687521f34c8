package com.di.moduleflow.config;

import com.di.moduleflow.model.DataFrequency;
import com.di.moduleflow.model.PipelineTable;
import com.di.moduleflow.model.StatusReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PipelineConfig} resolved from {@link PipelineProperties} and the status-log history.
 *
 * <p>Window resolution per module:
 * <pre>
 *   fromTime  = untilTs of the module's latest prior report
 *               (start of the primordial date, UTC, when there is none)
 *   untilTime = min(pipelineSnapTime, fromTime + maxDays)
 * </pre>
 */
@Slf4j
public class DefaultPipelineConfig implements PipelineConfig {

    private final PipelineProperties props;
    private final PipelineRun run;
    private final List<StatusReport> lastRunDetail;
    private final Instant primordialTime;
    private final PipelineTable statusTarget;
    private final String inputConfig;
    private final String parsedConfig;

    public DefaultPipelineConfig(PipelineProperties props,
                                 PipelineRun run,
                                 List<StatusReport> lastRunDetail,
                                 ObjectMapper om) {
        this.props = props;
        this.run = run;
        this.lastRunDetail = List.copyOf(lastRunDetail);
        this.primordialTime = parsePrimordial(props.getPrimordialDateString());
        this.statusTarget = statusTarget(props);
        this.inputConfig = toJson(om, props);
        this.parsedConfig = toJson(om, parsedView());

        log.info("[CONFIG] organizationId={} runId={} firstRun={} localTesting={} snapTime={}",
                props.getOrganizationId(), run.runId(), isFirstRun(), props.isLocalTesting(), run.snapTime());
    }

    @Override
    public String getOrganizationId() {
        return props.getOrganizationId();
    }

    @Override
    public String getRunId() {
        return run.runId();
    }

    @Override
    public String getPrimordialDateString() {
        return props.getPrimordialDateString();
    }

    @Override
    public Instant getPipelineSnapTime() {
        return run.snapTime();
    }

    @Override
    public Instant fromTime(int moduleId) {
        if (isFirstRun()) return primordialTime;
        return lastReport(moduleId)
                .map(r -> Instant.ofEpochMilli(r.getUntilTs()))
                .orElse(primordialTime);
    }

    @Override
    public Instant untilTime(int moduleId) {
        Instant cap = fromTime(moduleId).plus(Duration.ofDays(props.getMaxDays()));
        return cap.isBefore(run.snapTime()) ? cap : run.snapTime();
    }

    @Override
    public Instant verifiedUntilTime(int moduleId) {
        return props.getNonEmptyModules().contains(moduleId) ? fromTime(moduleId) : untilTime(moduleId);
    }

    @Override
    public boolean isFirstRun() {
        return lastRunDetail.isEmpty();
    }

    @Override
    public boolean isLocalTesting() {
        return props.isLocalTesting();
    }

    @Override
    public boolean isDebug() {
        return props.isDebug();
    }

    @Override
    public List<StatusReport> getLastRunDetail() {
        return lastRunDetail;
    }

    @Override
    public String getInputConfig() {
        return inputConfig;
    }

    @Override
    public String getParsedConfig() {
        return parsedConfig;
    }

    @Override
    public Map<String, String> getInitialSessionConf() {
        return Map.copyOf(props.getSessionConf());
    }

    @Override
    public Duration getOptimizeInterval() {
        return props.getOptimizeInterval();
    }

    @Override
    public int getDefaultSourcePartitions() {
        return props.getDefaultSourcePartitions();
    }

    @Override
    public PipelineTable getStatusTarget() {
        return statusTarget;
    }

    @Override
    public List<String> getTempCleanupPaths() {
        return List.copyOf(props.getTempCleanupPaths());
    }

    /** Append-only status log keyed by {@code (organization_id, run_id)}. */
    public static PipelineTable statusTarget(PipelineProperties props) {
        return PipelineTable.builder()
                .name(props.getStatusTable())
                .databaseName(props.getStatusDatabase())
                .keys(List.of("organization_id", "run_id"))
                .incrementalColumns(List.of("pipeline_snap_ts"))
                .dataFrequency(DataFrequency.MILESTONE)
                .build();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<StatusReport> lastReport(int moduleId) {
        return lastRunDetail.stream().filter(r -> r.getModuleId() == moduleId).findFirst();
    }

    private Map<String, Object> parsedView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("organizationId", props.getOrganizationId());
        view.put("runId", run.runId());
        view.put("pipelineSnapTime", run.snapTime().toString());
        view.put("primordialTime", primordialTime.toString());
        view.put("maxDays", props.getMaxDays());
        view.put("firstRun", isFirstRun());
        view.put("localTesting", props.isLocalTesting());
        view.put("optimizeInterval", props.getOptimizeInterval().toString());
        view.put("nonEmptyModules", props.getNonEmptyModules());
        view.put("statusTarget", statusTarget.tableFullName());
        return view;
    }

    private static Instant parsePrimordial(String date) {
        if (date == null || date.isBlank()) {
            throw new IllegalArgumentException("primordial-date-string cannot be null or empty");
        }
        try {
            return LocalDate.parse(date.trim()).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "primordial-date-string must be yyyy-MM-dd, got '" + date + "'", e);
        }
    }

    private static String toJson(ObjectMapper om, Object value) {
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize pipeline configuration for audit", e);
        }
    }
}
