package com.di.moduleflow.storage;

import com.di.moduleflow.dataset.Dataset;
import com.di.moduleflow.model.IncrementalRead;
import com.di.moduleflow.model.PipelineTable;

import java.time.Instant;

/**
 * Storage collaborator: durable reads, writes and rollback of pipeline targets.
 * Implementations are selected by {@code moduleflow.storage.type}.
 */
public interface Database {

    /**
     * Appends the dataset to the target.
     *
     * @return false when the store reports the write as unsuccessful; callers treat that as
     *         fatal for the run
     */
    boolean write(Dataset dataset, PipelineTable target);

    /**
     * Reverts the target's uncommitted write, if there is one. Writes already made permanent
     * through {@link #commit(PipelineTable)} are never touched, so a rollback with nothing
     * pending is a no-op.
     *
     * @throws RuntimeException implementation-defined, when the rollback itself fails
     */
    void rollbackTarget(PipelineTable target);

    /**
     * Makes the pending write to the target permanent. A later
     * {@link #rollbackTarget(PipelineTable)} no longer reverts it.
     */
    void commit(PipelineTable target);

    /** Full contents of the target; empty when the target does not exist yet. */
    Dataset read(PipelineTable target);

    /**
     * Rows of the target that belong to the window {@code [from, until)} on
     * {@link IncrementalRead#epochMillisColumn()}, pruned on the date column with
     * {@link IncrementalRead#additionalLagDays()} of slack.
     */
    Dataset readIncremental(PipelineTable target, Instant from, Instant until, IncrementalRead read);

    /** Physical compaction / statistics maintenance for the target. */
    void optimize(PipelineTable target);
}
