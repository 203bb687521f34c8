package com.di.moduleflow.pipeline;

/**
 * Result of the rollback attempted before a FAILED report is written.
 */
public enum RollbackOutcome {

    ROLLBACK_SUCCESSFUL("ROLLBACK SUCCESSFUL"),
    ROLLBACK_FAILED("ROLLBACK FAILED");

    private final String label;

    RollbackOutcome(String label) {
        this.label = label;
    }

    /** Text embedded in the FAILED status string. */
    public String getLabel() {
        return label;
    }
}
