package com.di.moduleflow.pipeline;

import com.di.moduleflow.config.ExecutionContext;
import com.di.moduleflow.config.PipelineConfig;
import com.di.moduleflow.dataset.Dataset;
import com.di.moduleflow.dataset.TransformStage;
import com.di.moduleflow.model.Module;
import com.di.moduleflow.model.PipelineTable;
import com.di.moduleflow.schema.SchemaRegistry;
import com.di.moduleflow.storage.Database;
import com.di.moduleflow.util.ModuleMetrics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Assembles module executions for one pipeline run and drives them.
 *
 * <pre>{@code
 * ModulePipeline pipeline = new ModulePipeline(database, schemaRegistry, context, metrics);
 * EtlDefinition clusterEvents = pipeline.etlDefinition(
 *         clusterEventsSource,
 *         List.of(dedupe, enrichWithClusterName),
 *         pipeline.append(clusterEventsTarget),
 *         new Module(1005, "Bronze_ClusterEvents"));
 * List<ModuleResult> results = pipeline.run(List.of(clusterEvents));
 * }</pre>
 */
@Slf4j
public class ModulePipeline {

    private final Database database;
    private final SchemaRegistry schemaRegistry;
    private final ExecutionContext context;
    private final PipelineConfig config;
    private final ModuleMetrics metrics;

    @Getter
    private final OptimizeScheduler optimizeScheduler;
    @Getter
    private final PostProcessor postProcessor;
    private final StatusReportWriter reportWriter;
    private final FailureHandler failureHandler;
    private final EmptyInputHandler emptyInputHandler;
    private final PartitionSizer partitionSizer;

    public ModulePipeline(Database database,
                          SchemaRegistry schemaRegistry,
                          ExecutionContext context,
                          ModuleMetrics metrics) {
        this.database = database;
        this.schemaRegistry = schemaRegistry;
        this.context = context;
        this.config = context.getConfig();
        this.metrics = metrics;

        this.optimizeScheduler = new OptimizeScheduler(context);
        this.postProcessor = new PostProcessor(database);
        this.reportWriter = new StatusReportWriter(database, context, metrics);
        this.failureHandler = new FailureHandler(database, context, reportWriter, optimizeScheduler, metrics);
        this.emptyInputHandler = new EmptyInputHandler(context, reportWriter, optimizeScheduler);
        this.partitionSizer = new PartitionSizer(context.getSessionConf());
    }

    /** Write step that appends to {@code target}. */
    public AppendWriter append(PipelineTable target) {
        return new AppendWriter(target, database, context, partitionSizer, optimizeScheduler,
                postProcessor, reportWriter, failureHandler, metrics);
    }

    public EtlDefinition etlDefinition(Dataset source,
                                       List<TransformStage> transforms,
                                       ModuleWriter writer,
                                       Module module) {
        return new EtlDefinition(source, transforms, writer, module,
                config, schemaRegistry, emptyInputHandler, failureHandler);
    }

    /**
     * Runs the modules one after another, then post-processes once. The session configuration
     * is reset before every module, since a failed module leaves its overrides in place.
     */
    public List<ModuleResult> run(List<EtlDefinition> definitions) {
        List<ModuleResult> results = new ArrayList<>(definitions.size());
        for (EtlDefinition definition : definitions) {
            restoreSessionConf();
            results.add(definition.process());
        }
        long failed = results.stream().filter(ModuleResult::isFailed).count();
        log.info("[PIPELINE] runId={} modules={} failed={}", config.getRunId(), results.size(), failed);
        initiatePostProcessing();
        return results;
    }

    public void restoreSessionConf() {
        context.getSessionConf().restore(config.getInitialSessionConf());
    }

    /** Optimizes marked targets and removes scratch directories. */
    public void initiatePostProcessing() {
        postProcessor.optimize();
        for (String path : config.getTempCleanupPaths()) {
            deleteRecursively(Paths.get(path));
        }
    }

    private static void deleteRecursively(Path root) {
        if (!Files.exists(root)) return;
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            log.info("[POSTPROCESS] removed {}", root);
        } catch (IOException | UncheckedIOException e) {
            log.warn("[POSTPROCESS] could not remove {}: {}", root, e.getMessage());
        }
    }
}
