package com.di.moduleflow.dataset;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Row-list implementation of {@link Dataset}. Used for local testing, for the one-row status
 * report written by every module, and for reads served by the in-memory and JDBC stores.
 *
 * <p>Rows are column-name to value maps; null values are allowed. An unbounded instance
 * (see {@link #unbounded()}) reports no static partition count, like a streaming source.
 */
@Slf4j
public final class InMemoryDataset implements Dataset {

    private final List<Map<String, Object>> rows;
    private final Integer partitions;

    private InMemoryDataset(List<Map<String, Object>> rows, Integer partitions) {
        this.rows = Collections.unmodifiableList(rows);
        this.partitions = partitions;
    }

    public static InMemoryDataset of(List<? extends Map<String, ?>> rows) {
        return new InMemoryDataset(copy(rows), 1);
    }

    @SafeVarargs
    public static InMemoryDataset of(Map<String, ?>... rows) {
        return of(List.of(rows));
    }

    public static InMemoryDataset empty() {
        return new InMemoryDataset(new ArrayList<>(), 1);
    }

    /** Same rows, but behaves like a streaming source with no static partition count. */
    public InMemoryDataset unbounded() {
        return new InMemoryDataset(rows, null);
    }

    public InMemoryDataset filter(Predicate<Map<String, Object>> predicate) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (predicate.test(row)) out.add(row);
        }
        return new InMemoryDataset(out, partitions);
    }

    /** Adds (or replaces) a column computed from each row. */
    public InMemoryDataset withColumn(String name, Function<Map<String, Object>, Object> fn) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>(row);
            copy.put(name, fn.apply(row));
            out.add(copy);
        }
        return new InMemoryDataset(out, partitions);
    }

    // ------------------------------------------------------------------
    // Dataset
    // ------------------------------------------------------------------

    @Override
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public Dataset verifyMinimumSchema(RequiredSchema requiredSchema, boolean enforceNonNull, boolean debug) {
        if (requiredSchema == null || requiredSchema.isEmpty()) {
            return this;
        }
        List<String> violations = new ArrayList<>();
        List<RequiredColumn> missingNullable = new ArrayList<>();

        for (RequiredColumn col : requiredSchema.columns()) {
            boolean present = rows.stream().allMatch(r -> r.containsKey(col.name()));
            if (!present) {
                if (col.nullable()) {
                    missingNullable.add(col);
                    if (debug) log.debug("[SCHEMA] column '{}' missing, adding as null", col.name());
                } else {
                    violations.add("required column '" + col.name() + "' is missing");
                }
                continue;
            }
            for (Map<String, Object> row : rows) {
                Object v = row.get(col.name());
                if (v == null) {
                    if (enforceNonNull && !col.nullable()) {
                        violations.add("column '" + col.name() + "' contains nulls but is non-nullable");
                        break;
                    }
                } else if (!col.type().accepts(v)) {
                    violations.add("column '" + col.name() + "' expected " + col.type()
                            + " but found " + v.getClass().getSimpleName());
                    break;
                }
            }
            if (debug) log.debug("[SCHEMA] column '{}' verified as {}", col.name(), col.type());
        }

        if (!violations.isEmpty()) {
            throw new SchemaValidationException(violations);
        }
        if (missingNullable.isEmpty()) {
            return this;
        }
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>(row);
            for (RequiredColumn col : missingNullable) copy.putIfAbsent(col.name(), null);
            out.add(copy);
        }
        return new InMemoryDataset(out, partitions);
    }

    @Override
    public OptionalInt tryPartitionCount() {
        return partitions == null ? OptionalInt.empty() : OptionalInt.of(partitions);
    }

    @Override
    public Dataset repartition(int partitionCount) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partition count must be >= 1, got " + partitionCount);
        }
        return new InMemoryDataset(rows, partitionCount);
    }

    @Override
    public long count() {
        return rows.size();
    }

    @Override
    public List<Map<String, Object>> rows() {
        return rows;
    }

    @Override
    public String toString() {
        return "InMemoryDataset{rows=" + rows.size() + ", partitions=" + (partitions == null ? "unbounded" : partitions) + "}";
    }

    private static List<Map<String, Object>> copy(List<? extends Map<String, ?>> rows) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, ?> r : rows) out.add(new LinkedHashMap<>(r));
        return out;
    }
}
