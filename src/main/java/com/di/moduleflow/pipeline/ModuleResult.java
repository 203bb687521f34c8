package com.di.moduleflow.pipeline;

import com.di.moduleflow.model.StatusReport;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one module invocation.
 *
 * <ul>
 *   <li>{@link Outcome#SUCCESS}: report persisted with status SUCCESS</li>
 *   <li>{@link Outcome#EMPTY}: no new data; {@link #report} is null until the empty-input
 *       handler has persisted the EMPTY report</li>
 *   <li>{@link Outcome#FAILED}: rollback attempted and FAILED report persisted; {@link #kind}
 *       says why</li>
 * </ul>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ModuleResult {

    public enum Outcome {
        SUCCESS, EMPTY, FAILED
    }

    Outcome outcome;
    FailureKind kind;
    String message;
    StatusReport report;

    public static ModuleResult success(StatusReport report) {
        return new ModuleResult(Outcome.SUCCESS, null, report.getStatus(), report);
    }

    /** Empty source detected; no report yet. */
    public static ModuleResult emptyInput(String reason) {
        return new ModuleResult(Outcome.EMPTY, null, reason, null);
    }

    public static ModuleResult empty(String reason, StatusReport report) {
        return new ModuleResult(Outcome.EMPTY, null, reason, report);
    }

    public static ModuleResult failed(FailureKind kind, String message, StatusReport report) {
        return new ModuleResult(Outcome.FAILED, kind, message, report);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
