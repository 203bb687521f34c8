package com.di.moduleflow.pipeline;

import com.di.moduleflow.config.PipelineConfig;
import com.di.moduleflow.dataset.Dataset;
import com.di.moduleflow.dataset.TransformStage;
import com.di.moduleflow.model.Module;
import com.di.moduleflow.schema.SchemaRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;
import java.util.OptionalInt;

/**
 * One executable module: source, transform chain, write step and owning module. Built by
 * {@link ModulePipeline#etlDefinition} and consumed once through {@link #process()}.
 *
 * <p>Ordering within an invocation is strict: schema validation, then transforms in list
 * order, then the write, then the status report. Every invocation ends with exactly one
 * persisted report.
 */
@Slf4j
public class EtlDefinition {

    static final String MDC_MODULE_ID = "moduleId";
    static final String MDC_MODULE_NAME = "moduleName";

    private final Dataset source;
    private final List<TransformStage> transforms;
    private final ModuleWriter writer;
    @Getter
    private final Module module;

    private final PipelineConfig config;
    private final SchemaRegistry schemaRegistry;
    private final EmptyInputHandler emptyInputHandler;
    private final FailureHandler failureHandler;

    EtlDefinition(Dataset source,
                  List<TransformStage> transforms,
                  ModuleWriter writer,
                  Module module,
                  PipelineConfig config,
                  SchemaRegistry schemaRegistry,
                  EmptyInputHandler emptyInputHandler,
                  FailureHandler failureHandler) {
        this.source = source;
        this.transforms = transforms == null ? List.of() : List.copyOf(transforms);
        this.writer = writer;
        this.module = module;
        this.config = config;
        this.schemaRegistry = schemaRegistry;
        this.emptyInputHandler = emptyInputHandler;
        this.failureHandler = failureHandler;
    }

    public ModuleResult process() {
        MDC.put(MDC_MODULE_ID, String.valueOf(module.moduleId()));
        MDC.put(MDC_MODULE_NAME, module.moduleName());
        try {
            log.info("[MODULE] Beginning: {}", module.moduleName());
            return route(execute());
        } finally {
            MDC.remove(MDC_MODULE_ID);
            MDC.remove(MDC_MODULE_NAME);
        }
    }

    private ModuleResult execute() {
        Dataset current;
        int sourcePartitions;
        try {
            if (source.isEmpty()) {
                String msg = "ALERT: No New Data Retrieved for Module " + module.label() + "! Skipping";
                log.warn("[MODULE] {}", msg);
                return ModuleResult.emptyInput(msg);
            }

            log.info("[MODULE] Validating Input Schemas");
            Dataset verified = source.verifyMinimumSchema(schemaRegistry.get(module), true, config.isDebug());

            OptionalInt parts = verified.tryPartitionCount();
            if (parts.isPresent()) {
                sourcePartitions = parts.getAsInt();
            } else {
                log.info("[MODULE] Delaying source shuffle partition set since input is stream");
                sourcePartitions = config.getDefaultSourcePartitions();
            }

            current = verified;
            for (TransformStage stage : transforms) {
                current = current.transform(stage);
            }
        } catch (Throwable t) {
            return failureHandler.failModule(module, writer.getTarget(), t);
        }
        return writer.write(current, module, sourcePartitions);
    }

    private ModuleResult route(ModuleResult result) {
        switch (result.getOutcome()) {
            case FAILED:
                log.error("[MODULE] FAILED: {} Module ({}): {}",
                        module.label(), result.getKind(), result.getReport().getStatus());
                return result;
            case EMPTY:
                log.warn("[MODULE] EMPTY: {} Module: SKIPPING", module.label());
                return emptyInputHandler.noNewDataHandler(module, result.getMessage());
            default:
                return result;
        }
    }
}
