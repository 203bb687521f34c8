package com.di.moduleflow.config;

import lombok.Value;

import java.time.Clock;

/**
 * Explicit per-run context handed to every pipeline component: the config accessor, the
 * mutable session overrides and the clock all time decisions read from.
 */
@Value
public class ExecutionContext {

    PipelineConfig config;
    SessionConf sessionConf;
    Clock clock;

    public static ExecutionContext of(PipelineConfig config, Clock clock) {
        return new ExecutionContext(config, new SessionConf(config.getInitialSessionConf()), clock);
    }
}
