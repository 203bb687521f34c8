package com.di.moduleflow.pipeline;

import com.di.moduleflow.model.PipelineTable;
import com.di.moduleflow.storage.Database;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Optimize collaborator. Modules only mark their targets while they run; the actual
 * optimization happens once, after every module of the run has reported.
 */
@Slf4j
public class PostProcessor {

    private final Database database;
    private final Map<String, PipelineTable> marked = new LinkedHashMap<>();

    public PostProcessor(Database database) {
        this.database = database;
    }

    public synchronized void markOptimize(PipelineTable target) {
        if (marked.putIfAbsent(target.tableFullName(), target) == null) {
            log.info("[OPTIMIZE] marked {}", target.tableFullName());
        }
    }

    public synchronized List<PipelineTable> getMarked() {
        return List.copyOf(marked.values());
    }

    /**
     * Optimizes every marked target, then clears the marks. A failing target is logged and
     * skipped: module reports are already durable at this point.
     *
     * @return targets that were optimized successfully
     */
    public synchronized List<PipelineTable> optimize() {
        List<PipelineTable> done = new ArrayList<>();
        for (PipelineTable target : marked.values()) {
            try {
                database.optimize(target);
                done.add(target);
            } catch (RuntimeException e) {
                log.warn("[OPTIMIZE] optimize of {} failed: {}", target.tableFullName(), e.getMessage(), e);
            }
        }
        log.info("[OPTIMIZE] optimized {}/{} marked targets", done.size(), marked.size());
        marked.clear();
        return done;
    }
}
