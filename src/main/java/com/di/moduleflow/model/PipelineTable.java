package com.di.moduleflow.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable destination of a module's output.
 *
 * <p>Built once per pipeline configuration and read-only while modules execute:
 * <pre>{@code
 * PipelineTable target = PipelineTable.builder()
 *         .name("cluster_events_bronze")
 *         .databaseName("overwatch_etl")
 *         .keys(List.of("organization_id", "cluster_id", "timestamp"))
 *         .incrementalColumns(List.of("timestamp"))
 *         .dataFrequency(DataFrequency.MILESTONE)
 *         .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class PipelineTable {

    String name;

    @Builder.Default
    String databaseName = "default";

    @Builder.Default
    List<String> keys = List.of();

    @Builder.Default
    List<String> incrementalColumns = List.of();

    @Builder.Default
    List<String> partitionBy = List.of();

    @Builder.Default
    DataFrequency dataFrequency = DataFrequency.MILESTONE;

    /** Overrides the pipeline-wide optimize interval for this target when set. */
    Duration optimizeFrequency;

    @Builder.Default
    RecordCountPolicy recordCountPolicy = RecordCountPolicy.DIRECT;

    /** Only consulted when {@link #recordCountPolicy} is {@link RecordCountPolicy#WINDOWED_REREAD}. */
    IncrementalRead incrementalRead;

    /** Multiplier applied to the source partition count when sizing the write. */
    @Builder.Default
    double shuffleFactor = 1.0;

    public String tableFullName() {
        return databaseName + "." + name;
    }

    public Optional<Duration> optimizeFrequency() {
        return Optional.ofNullable(optimizeFrequency);
    }

    /**
     * @throws IllegalStateException when the count policy needs a re-read descriptor that is missing
     */
    public IncrementalRead requireIncrementalRead() {
        if (incrementalRead == null) {
            throw new IllegalStateException(
                    "Target " + tableFullName() + " uses " + recordCountPolicy + " but has no incrementalRead");
        }
        return incrementalRead;
    }
}
