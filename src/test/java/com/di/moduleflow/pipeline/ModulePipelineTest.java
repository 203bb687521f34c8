package com.di.moduleflow.pipeline;

import com.di.moduleflow.config.ExecutionContext;
import com.di.moduleflow.config.PipelineProperties;
import com.di.moduleflow.dataset.ColumnType;
import com.di.moduleflow.dataset.InMemoryDataset;
import com.di.moduleflow.dataset.RequiredColumn;
import com.di.moduleflow.dataset.RequiredSchema;
import com.di.moduleflow.dataset.TransformStage;
import com.di.moduleflow.model.Module;
import com.di.moduleflow.model.PipelineTable;
import com.di.moduleflow.model.RecordCountPolicy;
import com.di.moduleflow.model.StatusReport;
import com.di.moduleflow.schema.InMemorySchemaRegistry;
import com.di.moduleflow.util.ModuleMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.di.moduleflow.pipeline.PipelineFixture.NOW;
import static com.di.moduleflow.pipeline.PipelineFixture.PRIMORDIAL;
import static com.di.moduleflow.pipeline.PipelineFixture.row;
import static com.di.moduleflow.pipeline.PipelineFixture.statusReports;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ModulePipeline Tests")
class ModulePipelineTest {

    private static final Module CLUSTER_EVENTS = new Module(2010, "Bronze_ClusterEvents");
    private static final PipelineTable TARGET = PipelineTable.builder()
            .name("cluster_events_bronze")
            .databaseName("moduleflow_etl")
            .keys(List.of("cluster_id", "ts"))
            .incrementalColumns(List.of("ts"))
            .build();

    private RecordingDatabase database;
    private InMemorySchemaRegistry schemaRegistry;
    private ExecutionContext context;
    private SimpleMeterRegistry meterRegistry;
    private ModulePipeline pipeline;

    @BeforeEach
    void setUp() {
        database = new RecordingDatabase();
        schemaRegistry = new InMemorySchemaRegistry();
        meterRegistry = new SimpleMeterRegistry();
        context = PipelineFixture.context();
        pipeline = new ModulePipeline(database, schemaRegistry, context, new ModuleMetrics(meterRegistry));
    }

    private InMemoryDataset threeEvents() {
        return InMemoryDataset.of(
                row("cluster_id", "c-1", "ts", 1L),
                row("cluster_id", "c-2", "ts", 2L),
                row("cluster_id", "c-3", "ts", 3L));
    }

    private EtlDefinition definition(InMemoryDataset source, List<TransformStage> transforms) {
        return pipeline.etlDefinition(source, transforms, pipeline.append(TARGET), CLUSTER_EVENTS);
    }

    // ============================================================================
    // Success
    // ============================================================================

    @Test
    @DisplayName("Should append rows and persist a SUCCESS report")
    void testProcess_Success() {
        ModuleResult result = definition(threeEvents(), List.of()).process();

        assertTrue(result.isSuccess());
        StatusReport report = result.getReport();
        assertEquals(StatusReport.SUCCESS, report.getStatus());
        assertEquals(3L, report.getRecordsAppended());
        assertEquals(PRIMORDIAL.toEpochMilli(), report.getFromTs());
        assertEquals(NOW.toEpochMilli(), report.getUntilTs());
        assertEquals(NOW.toEpochMilli(), report.getRunStartTs());
        assertEquals(168, report.getVacuumRetentionHours());
        assertEquals("MILESTONE", report.getDataFrequency());
        assertEquals("org-1", report.getOrganizationId());
        assertEquals("run-1", report.getRunId());

        assertEquals(3L, database.read(TARGET).count());
        assertEquals(List.of(report), statusReports(database, context));
        assertTrue(database.rollbacks().isEmpty());
    }

    @Test
    @DisplayName("Should apply transforms in list order")
    void testProcess_TransformOrder() {
        TransformStage first = d -> ((InMemoryDataset) d).withColumn("step", r -> "a");
        TransformStage second = d -> ((InMemoryDataset) d).withColumn("step", r -> r.get("step") + "b");

        definition(threeEvents(), List.of(first, second)).process();

        database.read(TARGET).rows().forEach(r -> assertEquals("ab", r.get("step")));
    }

    @Test
    @DisplayName("Should size an unbounded source with the default partition count")
    void testProcess_UnboundedSourceUsesDefaultPartitions() {
        definition(threeEvents().unbounded(), List.of()).process();

        assertEquals(200, database.lastWritten(TARGET).tryPartitionCount().getAsInt());
    }

    @Test
    @DisplayName("Should mark the target on first run and optimize it in post-processing")
    void testRun_OptimizesMarkedTargets() {
        List<ModuleResult> results = pipeline.run(List.of(definition(threeEvents(), List.of())));

        assertEquals(1, results.size());
        assertEquals(NOW.toEpochMilli(), results.get(0).getReport().getLastOptimizedTs());
        assertEquals(List.of(TARGET.tableFullName()), database.getOptimizedTables());
        assertTrue(pipeline.getPostProcessor().getMarked().isEmpty());
    }

    @Test
    @DisplayName("Should never schedule optimize in local testing")
    void testRun_LocalTestingSkipsOptimize() {
        PipelineProperties props = PipelineFixture.props();
        props.setLocalTesting(true);
        context = PipelineFixture.context(props, List.of());
        pipeline = new ModulePipeline(database, schemaRegistry, context, new ModuleMetrics(meterRegistry));

        List<ModuleResult> results = pipeline.run(List.of(definition(threeEvents(), List.of())));

        assertEquals(0L, results.get(0).getReport().getLastOptimizedTs());
        assertTrue(database.getOptimizedTables().isEmpty());
    }

    // ============================================================================
    // Empty input
    // ============================================================================

    @Test
    @DisplayName("Should persist an EMPTY report without touching the target")
    void testProcess_EmptySource() {
        ModuleResult result = definition(InMemoryDataset.empty(), List.of()).process();

        assertEquals(ModuleResult.Outcome.EMPTY, result.getOutcome());
        assertTrue(result.getMessage().contains("No New Data Retrieved for Module 2010-Bronze_ClusterEvents"));
        StatusReport report = result.getReport();
        assertEquals(StatusReport.EMPTY, report.getStatus());
        assertEquals(0L, report.getRecordsAppended());
        assertEquals(168, report.getVacuumRetentionHours());
        assertEquals(NOW.toEpochMilli(), report.getUntilTs());

        assertEquals(0, database.writeCalls(TARGET));
        assertTrue(database.rollbacks().isEmpty());
        assertEquals(1, statusReports(database, context).size());
        assertEquals(1.0, meterRegistry.find("moduleflow.module.runs").tag("status", "empty").counter().count());
    }

    @Test
    @DisplayName("Should hold the window of a non-empty module when its source is empty")
    void testProcess_EmptySourceForNonEmptyModule() {
        Module audit = new Module(1005, "Bronze_AuditLogs");
        ModuleResult result = pipeline.etlDefinition(InMemoryDataset.empty(), List.of(),
                pipeline.append(TARGET), audit).process();

        assertEquals(result.getReport().getFromTs(), result.getReport().getUntilTs());
    }

    // ============================================================================
    // Failure
    // ============================================================================

    @Test
    @DisplayName("Should roll back once and persist FAILED when storage rejects the write")
    void testProcess_WriteRejected() {
        database.failWritesTo(TARGET);

        ModuleResult result = definition(threeEvents(), List.of()).process();

        assertTrue(result.isFailed());
        assertEquals(FailureKind.WRITE_FAILURE, result.getKind());
        String msg = "Bronze_ClusterEvents FAILED -->\nMessage: PIPELINE FAILURE\nCause:null";
        assertEquals(msg, result.getMessage());

        StatusReport report = result.getReport();
        assertEquals("FAILED --> ROLLBACK SUCCESSFUL: ERROR:" + msg, report.getStatus());
        assertEquals(0L, report.getRecordsAppended());
        assertEquals(0, report.getVacuumRetentionHours());
        assertEquals(0L, report.getRunStartTs());
        assertEquals(0L, report.getRunEndTs());
        assertEquals(List.of(TARGET.tableFullName()), database.rollbacks());
        assertEquals(List.of(report), statusReports(database, context));
    }

    @Test
    @DisplayName("Should report ROLLBACK FAILED when the rollback itself throws")
    void testProcess_RollbackThrows() {
        database.failWritesTo(TARGET).rollbackThrows();

        ModuleResult result = definition(threeEvents(), List.of()).process();

        assertTrue(result.isFailed());
        assertTrue(result.getReport().getStatus().startsWith("FAILED --> ROLLBACK FAILED: ERROR:"));
        assertEquals(1, statusReports(database, context).size());
        assertEquals(1.0, meterRegistry.find("moduleflow.module.rollbacks")
                .tag("outcome", "ROLLBACK FAILED").counter().count());
    }

    @Test
    @DisplayName("Should fail before the write when the minimum schema is not met")
    void testProcess_SchemaViolation() {
        schemaRegistry.register(CLUSTER_EVENTS.moduleId(),
                RequiredSchema.of(RequiredColumn.required("cluster_name", ColumnType.STRING)));

        ModuleResult result = definition(threeEvents(), List.of()).process();

        assertTrue(result.isFailed());
        assertEquals(FailureKind.SCHEMA_VALIDATION, result.getKind());
        assertTrue(result.getReport().getStatus().contains("Minimum schema verification failed"));
        assertEquals(0, database.writeCalls(TARGET));
        assertEquals(1, database.rollbacks().size());
    }

    @Test
    @DisplayName("Should route a throwing transform through the failure path")
    void testProcess_TransformThrows() {
        List<String> applied = new ArrayList<>();
        TransformStage boom = d -> {
            applied.add("boom");
            throw new IllegalStateException("bad join key");
        };
        TransformStage never = d -> {
            applied.add("never");
            return d;
        };

        ModuleResult result = definition(threeEvents(), List.of(boom, never)).process();

        assertEquals(FailureKind.UNHANDLED, result.getKind());
        assertEquals(List.of("boom"), applied);
        assertTrue(result.getReport().getStatus().contains("Message: bad join key"));
        assertEquals(0, database.writeCalls(TARGET));
    }

    @Test
    @DisplayName("Should hold the window of a non-empty module on failure")
    void testProcess_FailedNonEmptyModuleHoldsWindow() {
        database.failWritesTo(TARGET);
        Module audit = new Module(1005, "Bronze_AuditLogs");

        ModuleResult result = pipeline.etlDefinition(threeEvents(), List.of(),
                pipeline.append(TARGET), audit).process();

        assertEquals(PRIMORDIAL.toEpochMilli(), result.getReport().getUntilTs());
    }

    @Test
    @DisplayName("Should persist a FAILED report when a transform throws an Error")
    void testProcess_TransformThrowsError() {
        TransformStage assertion = d -> {
            throw new AssertionError("unexpected cluster state");
        };

        ModuleResult result = definition(threeEvents(), List.of(assertion)).process();

        assertTrue(result.isFailed());
        assertEquals(FailureKind.UNHANDLED, result.getKind());
        assertTrue(result.getReport().getStatus().contains("Message: unexpected cluster state"));
        assertEquals(1, statusReports(database, context).size());
        assertEquals(0, database.writeCalls(TARGET));
    }

    @Test
    @DisplayName("Should persist the FAILED report before rethrowing a virtual machine error")
    void testProcess_VirtualMachineErrorRethrownAfterReport() {
        TransformStage exhausted = d -> {
            throw new OutOfMemoryError("Java heap space");
        };

        assertThrows(OutOfMemoryError.class,
                () -> definition(threeEvents(), List.of(exhausted)).process());

        List<StatusReport> reports = statusReports(database, context);
        assertEquals(1, reports.size());
        assertTrue(reports.get(0).isFailed());
    }

    @Test
    @DisplayName("Should keep rows another module committed to the same target when a later module fails before writing")
    void testRun_SharedTargetSurvivesEarlyFailure() {
        schemaRegistry.register(2011, RequiredSchema.of(RequiredColumn.required("job_id", ColumnType.LONG)));

        List<ModuleResult> results = pipeline.run(List.of(
                definition(threeEvents(), List.of()),
                pipeline.etlDefinition(threeEvents(), List.of(), pipeline.append(TARGET),
                        new Module(2011, "Bronze_Jobs"))));

        assertTrue(results.get(0).isSuccess());
        assertTrue(results.get(1).isFailed());
        assertTrue(results.get(1).getReport().getStatus().startsWith("FAILED --> ROLLBACK SUCCESSFUL"));
        assertEquals(3L, database.read(TARGET).count());
        assertEquals(results.get(0).getReport().getRecordsAppended(), database.read(TARGET).count());
    }

    @Test
    @DisplayName("Should remove only its own rows when a later module fails after writing to a shared target")
    void testRun_SharedTargetRollsBackOwnWriteOnly() {
        TransformStage boomAfterWrite = d -> ((InMemoryDataset) d).withColumn("job_id", r -> 7L);
        PipelineTable windowed = TARGET.toBuilder()
                .recordCountPolicy(RecordCountPolicy.WINDOWED_REREAD)
                .build();

        List<ModuleResult> results = pipeline.run(List.of(
                definition(threeEvents(), List.of()),
                pipeline.etlDefinition(threeEvents(), List.of(boomAfterWrite), pipeline.append(windowed),
                        new Module(2011, "Bronze_Jobs"))));

        assertTrue(results.get(0).isSuccess());
        assertTrue(results.get(1).isFailed());
        assertEquals(2, database.writeCalls(TARGET));
        assertEquals(3L, database.read(TARGET).count());
        database.read(TARGET).rows().forEach(r -> assertFalse(r.containsKey("job_id")));
    }

    @Test
    @DisplayName("Should surface a status log write failure instead of reporting twice")
    void testProcess_StatusPersistenceFails() {
        database.failWritesTo(context.getConfig().getStatusTarget());

        assertThrows(StatusReportPersistenceException.class,
                () -> definition(threeEvents(), List.of()).process());
        assertTrue(database.rollbacks().isEmpty());
    }

    // ============================================================================
    // Run loop
    // ============================================================================

    @Test
    @DisplayName("Should keep running later modules after a failure, one report each")
    void testRun_ContinuesAfterFailure() {
        PipelineTable other = TARGET.toBuilder().name("jobs_bronze").build();
        database.failWritesTo(TARGET);

        List<ModuleResult> results = pipeline.run(List.of(
                definition(threeEvents(), List.of()),
                pipeline.etlDefinition(threeEvents(), List.of(), pipeline.append(other),
                        new Module(2011, "Bronze_Jobs"))));

        assertTrue(results.get(0).isFailed());
        assertTrue(results.get(1).isSuccess());
        assertEquals(2, statusReports(database, context).size());
        assertEquals(List.of(other.tableFullName()), database.getOptimizedTables());
    }

    @Test
    @DisplayName("Should resume from the prior report's untilTs on a later run")
    void testProcess_ResumesFromHistory() {
        Instant priorUntil = NOW.minus(Duration.ofDays(3));
        context = PipelineFixture.context(PipelineFixture.props(), List.of(
                PipelineFixture.priorReport(CLUSTER_EVENTS.moduleId(), priorUntil, NOW.minus(Duration.ofDays(1)))));
        pipeline = new ModulePipeline(database, schemaRegistry, context, new ModuleMetrics(meterRegistry));

        StatusReport report = definition(threeEvents(), List.of()).process().getReport();

        assertEquals(priorUntil.toEpochMilli(), report.getFromTs());
        assertEquals(NOW.minus(Duration.ofDays(1)).toEpochMilli(), report.getLastOptimizedTs());
        assertTrue(pipeline.getPostProcessor().getMarked().isEmpty());
    }
}
