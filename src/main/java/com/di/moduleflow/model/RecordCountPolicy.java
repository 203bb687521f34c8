package com.di.moduleflow.model;

/**
 * How {@code recordsAppended} is computed after a successful write.
 */
public enum RecordCountPolicy {

    /** Count the dataset that was just written. */
    DIRECT,

    /**
     * Re-read the written window from the target and count that. For targets whose source
     * encoding is too expensive to scan a second time (compressed raw event files, etc).
     * Requires {@link PipelineTable#getIncrementalRead()}.
     */
    WINDOWED_REREAD
}
