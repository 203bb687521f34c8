package com.di.moduleflow.pipeline;

import com.di.moduleflow.config.ExecutionContext;
import com.di.moduleflow.config.PipelineConfig;
import com.di.moduleflow.model.PipelineTable;
import com.di.moduleflow.model.StatusReport;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Decides whether a module's target is due for physical optimization.
 *
 * <pre>
 *   needsOptimize = (lastOptimized &lt; now - interval  OR  firstRun)  AND  NOT localTesting
 * </pre>
 * The interval is the pipeline-wide {@code optimize-interval} (7 days by default) unless the
 * target carries its own optimize frequency. {@code now} comes from the context clock, so
 * equal inputs always yield the same decision.
 */
@Slf4j
public class OptimizeScheduler {

    private final PipelineConfig config;
    private final ExecutionContext context;

    public OptimizeScheduler(ExecutionContext context) {
        this.context = context;
        this.config = context.getConfig();
    }

    /**
     * Last-optimized timestamp recorded by the module's most recent prior run; 0 on first run
     * or when the module has never run.
     */
    public long getLastOptimized(int moduleId) {
        if (config.isFirstRun()) return 0L;
        return config.getLastRunDetail().stream()
                .filter(r -> r.getModuleId() == moduleId)
                .mapToLong(StatusReport::getLastOptimizedTs)
                .findFirst()
                .orElse(0L);
    }

    public boolean needsOptimize(int moduleId) {
        return needsOptimize(moduleId, config.getOptimizeInterval());
    }

    public boolean needsOptimize(int moduleId, PipelineTable target) {
        return needsOptimize(moduleId, target.optimizeFrequency().orElse(config.getOptimizeInterval()));
    }

    private boolean needsOptimize(int moduleId, Duration interval) {
        if (config.isLocalTesting()) return false;
        long threshold = context.getClock().millis() - interval.toMillis();
        long lastOptimized = getLastOptimized(moduleId);
        boolean due = lastOptimized < threshold || config.isFirstRun();
        log.debug("[OPTIMIZE] moduleId={} lastOptimized={} threshold={} due={}",
                moduleId, lastOptimized, threshold, due);
        return due;
    }
}
