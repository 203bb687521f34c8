package com.di.moduleflow.config;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Identity of one pipeline run: the run id the status log is keyed by, and the snapshot
 * instant every module's window is capped at. Captured once, before any module runs.
 */
public record PipelineRun(String runId, Instant snapTime) {

    public static PipelineRun start(Clock clock) {
        return new PipelineRun(UUID.randomUUID().toString(), clock.instant());
    }
}
