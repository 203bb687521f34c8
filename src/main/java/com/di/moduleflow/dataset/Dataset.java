package com.di.moduleflow.dataset;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Narrow capability view of the dataset engine a module reads from and writes with.
 *
 * <p>Every call may be long-running and is blocking: it either returns a definite result or
 * throws. Implementations are expected to be immutable: transforming operations return a new
 * dataset.
 */
public interface Dataset {

    boolean isEmpty();

    /**
     * Checks that every required column exists with a compatible type.
     *
     * @param requiredSchema minimum schema for the module
     * @param enforceNonNull when true, non-nullable required columns may not contain nulls
     * @param debug          log every column decision
     * @return a dataset in which missing nullable columns are present (as nulls)
     * @throws SchemaValidationException on a missing required column, a type mismatch, or a
     *                                   null in an enforced non-null column
     */
    Dataset verifyMinimumSchema(RequiredSchema requiredSchema, boolean enforceNonNull, boolean debug);

    /**
     * Static partition count, or empty for an unbounded (streaming) source. Never throws for
     * the streaming case.
     */
    OptionalInt tryPartitionCount();

    default Dataset transform(TransformStage stage) {
        return stage.apply(this);
    }

    Dataset repartition(int partitions);

    long count();

    /**
     * Materializes the rows. Intended for storage implementations and small datasets such as a
     * single status report.
     */
    List<Map<String, Object>> rows();
}
