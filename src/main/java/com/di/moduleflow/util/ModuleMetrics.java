package com.di.moduleflow.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for module executions: outcomes, appended record counts, append durations and
 * rollbacks. Every persisted status report is counted exactly once.
 */
@Slf4j
@Component
public class ModuleMetrics {

    static final String RUNS = "moduleflow.module.runs";
    static final String RECORDS = "moduleflow.module.records.appended";
    static final String APPEND_DURATION = "moduleflow.module.append.duration";
    static final String ROLLBACKS = "moduleflow.module.rollbacks";

    private final MeterRegistry meterRegistry;
    private final DistributionSummary recordsAppended;
    private final Timer appendTimer;

    public ModuleMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.recordsAppended = DistributionSummary.builder(RECORDS)
                .description("Records appended per successful module run")
                .baseUnit("rows")
                .register(meterRegistry);

        this.appendTimer = Timer.builder(APPEND_DURATION)
                .description("Time from append start to success report")
                .register(meterRegistry);
    }

    /**
     * Counts one persisted status report.
     *
     * @param outcome {@code success}, {@code empty} or {@code failed}
     */
    public void recordModuleRun(String outcome, int moduleId) {
        Counter.builder(RUNS)
                .description("Module runs by outcome")
                .tag("status", outcome)
                .register(meterRegistry)
                .increment();
        log.debug("Recorded module run: moduleId={}, outcome={}", moduleId, outcome);
    }

    public void recordAppend(long records, long durationMs) {
        recordsAppended.record(records);
        appendTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * @param outcome rollback outcome label, e.g. {@code ROLLBACK SUCCESSFUL}
     */
    public void recordRollback(String outcome) {
        Counter.builder(ROLLBACKS)
                .description("Target rollbacks by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public double getRunCount(String outcome) {
        Counter c = meterRegistry.find(RUNS).tag("status", outcome).counter();
        return c == null ? 0.0 : c.count();
    }
}
