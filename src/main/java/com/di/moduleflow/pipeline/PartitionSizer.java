package com.di.moduleflow.pipeline;

import com.di.moduleflow.config.SessionConf;
import com.di.moduleflow.model.PipelineTable;
import lombok.extern.slf4j.Slf4j;

/**
 * Sizes the write partitioning of a module's output.
 *
 * <pre>
 *   partitions = min( max(1, ceil(sourcePartitions × target.shuffleFactor)),
 *                     session[moduleflow.shuffle.partitions.max] )
 * </pre>
 * The chosen count is also published as the session override
 * {@value #SHUFFLE_PARTITIONS}, which the append path restores after a successful write.
 */
@Slf4j
public class PartitionSizer {

    public static final String SHUFFLE_PARTITIONS = "moduleflow.shuffle.partitions";
    public static final String MAX_SHUFFLE_PARTITIONS = "moduleflow.shuffle.partitions.max";

    private final SessionConf sessionConf;

    public PartitionSizer(SessionConf sessionConf) {
        this.sessionConf = sessionConf;
    }

    public int writePartitions(int sourcePartitions, PipelineTable target) {
        if (sourcePartitions < 1) {
            throw new IllegalArgumentException("sourcePartitions must be >= 1, got " + sourcePartitions);
        }
        int desired = (int) Math.max(1L, (long) Math.ceil(sourcePartitions * target.getShuffleFactor()));
        int max = sessionConf.getInt(MAX_SHUFFLE_PARTITIONS, Integer.MAX_VALUE);
        int partitions = Math.max(1, Math.min(desired, max));

        sessionConf.set(SHUFFLE_PARTITIONS, String.valueOf(partitions));
        log.debug("[PARTITION] target={} source={} factor={} max={} -> {}",
                target.tableFullName(), sourcePartitions, target.getShuffleFactor(), max, partitions);
        return partitions;
    }
}
