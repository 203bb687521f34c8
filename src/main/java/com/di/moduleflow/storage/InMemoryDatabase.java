package com.di.moduleflow.storage;

import com.di.moduleflow.dataset.Dataset;
import com.di.moduleflow.dataset.InMemoryDataset;
import com.di.moduleflow.model.IncrementalRead;
import com.di.moduleflow.model.PipelineTable;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of {@link Database}. Suitable for local testing and unit tests.
 * When {@code moduleflow.storage.type=jdbc}, {@link JdbcDatabase} is used instead.
 *
 * <p>The first uncommitted write to a target remembers its pre-write row count so that
 * {@link #rollbackTarget(PipelineTable)} can restore it; {@link #commit(PipelineTable)}
 * forgets it.
 */
@Slf4j
public class InMemoryDatabase implements Database {

    private final Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();
    private final Map<String, Integer> preWriteSize = new LinkedHashMap<>();
    private final List<String> optimized = new ArrayList<>();

    @Override
    public synchronized boolean write(Dataset dataset, PipelineTable target) {
        String table = target.tableFullName();
        List<Map<String, Object>> rows = tables.computeIfAbsent(table, k -> new ArrayList<>());
        preWriteSize.putIfAbsent(table, rows.size());
        for (Map<String, Object> row : dataset.rows()) {
            rows.add(new LinkedHashMap<>(row));
        }
        log.debug("[MEMDB] appended {} rows to {} (now {})", dataset.rows().size(), table, rows.size());
        return true;
    }

    @Override
    public synchronized void rollbackTarget(PipelineTable target) {
        String table = target.tableFullName();
        Integer size = preWriteSize.remove(table);
        List<Map<String, Object>> rows = tables.get(table);
        if (size == null || rows == null) {
            log.info("[MEMDB] no uncommitted write to roll back for {}", table);
            return;
        }
        int removed = rows.size() - size;
        rows.subList(size, rows.size()).clear();
        log.info("[MEMDB] rolled back {} rows from {}", removed, table);
    }

    @Override
    public synchronized void commit(PipelineTable target) {
        preWriteSize.remove(target.tableFullName());
    }

    @Override
    public synchronized Dataset read(PipelineTable target) {
        return snapshot(target);
    }

    @Override
    public synchronized Dataset readIncremental(PipelineTable target, Instant from, Instant until, IncrementalRead read) {
        InMemoryDataset all = snapshot(target);
        long fromMs = from.toEpochMilli();
        long untilMs = until.toEpochMilli();
        LocalDate fromDate = from.atZone(ZoneOffset.UTC).toLocalDate().minusDays(read.additionalLagDays());
        LocalDate untilDate = until.atZone(ZoneOffset.UTC).toLocalDate();

        return all.filter(row -> {
            if (read.dateColumn() != null && row.get(read.dateColumn()) != null) {
                LocalDate d = toLocalDate(row.get(read.dateColumn()));
                if (d.isBefore(fromDate) || d.isAfter(untilDate)) return false;
            }
            Object epoch = row.get(read.epochMillisColumn());
            if (!(epoch instanceof Number)) return false;
            long ms = ((Number) epoch).longValue();
            return ms >= fromMs && ms < untilMs;
        });
    }

    @Override
    public synchronized void optimize(PipelineTable target) {
        optimized.add(target.tableFullName());
        log.info("[MEMDB] optimize {} (no-op)", target.tableFullName());
    }

    /** Table names passed to {@link #optimize}, in call order. */
    public synchronized List<String> getOptimizedTables() {
        return List.copyOf(optimized);
    }

    private InMemoryDataset snapshot(PipelineTable target) {
        List<Map<String, Object>> rows = tables.get(target.tableFullName());
        return rows == null ? InMemoryDataset.empty() : InMemoryDataset.of(rows);
    }

    private static LocalDate toLocalDate(Object v) {
        if (v instanceof LocalDate) return (LocalDate) v;
        return LocalDate.parse(v.toString());
    }
}
