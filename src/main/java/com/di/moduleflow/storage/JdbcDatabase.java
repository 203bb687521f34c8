package com.di.moduleflow.storage;

import com.di.moduleflow.dataset.Dataset;
import com.di.moduleflow.dataset.InMemoryDataset;
import com.di.moduleflow.model.IncrementalRead;
import com.di.moduleflow.model.PipelineTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Date;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JDBC implementation of {@link Database}. Active when {@code moduleflow.storage.type=jdbc}.
 *
 * <p>Every row written is stamped with the pipeline's {@code run_id} (unless the row already
 * carries one) and with a {@code write_id} token shared by all rows of the target's pending
 * write. {@link #rollbackTarget(PipelineTable)} deletes by that token only, so rows another
 * module committed earlier in the same run survive. Tables written through this class
 * therefore need {@code run_id} and {@code write_id} columns.
 */
@Slf4j
public class JdbcDatabase implements Database {

    static final String RUN_ID_COLUMN = "run_id";
    static final String WRITE_ID_COLUMN = "write_id";

    private final JdbcTemplate jdbc;
    private final String runId;
    private final Map<String, String> pendingWrites = new ConcurrentHashMap<>();

    public JdbcDatabase(JdbcTemplate jdbcTemplate, String runId) {
        this.jdbc = jdbcTemplate;
        this.runId = runId;
    }

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    @Override
    public boolean write(Dataset dataset, PipelineTable target) {
        String table = SqlIdentifiers.validateTableName(target.tableFullName());
        List<Map<String, Object>> rows = dataset.rows();
        if (rows.isEmpty()) {
            log.info("[JDBC] nothing to write to {}", table);
            return true;
        }

        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            for (String col : row.keySet()) columns.add(SqlIdentifiers.validateColumnName(col));
        }
        columns.add(RUN_ID_COLUMN);
        columns.add(WRITE_ID_COLUMN);
        String writeId = pendingWrites.computeIfAbsent(table, k -> UUID.randomUUID().toString());

        String sql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
                + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";

        List<Object[]> batch = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object[] args = new Object[columns.size()];
            int i = 0;
            for (String col : columns) {
                Object v = row.get(col);
                if (v == null && RUN_ID_COLUMN.equals(col)) v = runId;
                if (WRITE_ID_COLUMN.equals(col)) v = writeId;
                args[i++] = toJdbcValue(v);
            }
            batch.add(args);
        }

        int[] counts = jdbc.batchUpdate(sql, batch);
        for (int c : counts) {
            if (c == Statement.EXECUTE_FAILED) {
                log.error("[JDBC] batch insert into {} reported a failed statement", table);
                return false;
            }
        }
        log.debug("[JDBC] inserted {} rows into {}", rows.size(), table);
        return true;
    }

    @Override
    public void rollbackTarget(PipelineTable target) {
        String table = SqlIdentifiers.validateTableName(target.tableFullName());
        String writeId = pendingWrites.remove(table);
        if (writeId == null) {
            log.info("[JDBC] no uncommitted write to roll back for {}", table);
            return;
        }
        int deleted = jdbc.update("DELETE FROM " + table + " WHERE " + WRITE_ID_COLUMN + " = ?", writeId);
        log.info("[JDBC] rolled back {} rows from {} (runId={}, writeId={})", deleted, table, runId, writeId);
    }

    @Override
    public void commit(PipelineTable target) {
        pendingWrites.remove(SqlIdentifiers.validateTableName(target.tableFullName()));
    }

    @Override
    public void optimize(PipelineTable target) {
        String table = SqlIdentifiers.validateTableName(target.tableFullName());
        jdbc.execute("ANALYZE " + table);
        log.info("[JDBC] analyzed {}", table);
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    @Override
    public Dataset read(PipelineTable target) {
        String table = SqlIdentifiers.validateTableName(target.tableFullName());
        try {
            return InMemoryDataset.of(jdbc.queryForList("SELECT * FROM " + table));
        } catch (BadSqlGrammarException e) {
            // Missing table on a fresh installation.
            log.info("[JDBC] {} not readable ({}), treating as empty", table, e.getMessage());
            return InMemoryDataset.empty();
        }
    }

    @Override
    public Dataset readIncremental(PipelineTable target, Instant from, Instant until, IncrementalRead read) {
        String table = SqlIdentifiers.validateTableName(target.tableFullName());
        String epochCol = SqlIdentifiers.validateColumnName(read.epochMillisColumn());

        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table)
                .append(" WHERE ").append(epochCol).append(" >= ? AND ").append(epochCol).append(" < ?");
        List<Object> args = new ArrayList<>(List.of(from.toEpochMilli(), until.toEpochMilli()));
        if (read.dateColumn() != null) {
            String dateCol = SqlIdentifiers.validateColumnName(read.dateColumn());
            LocalDate fromDate = from.atZone(ZoneOffset.UTC).toLocalDate().minusDays(read.additionalLagDays());
            LocalDate untilDate = until.atZone(ZoneOffset.UTC).toLocalDate();
            sql.append(" AND ").append(dateCol).append(" BETWEEN ? AND ?");
            args.add(Date.valueOf(fromDate));
            args.add(Date.valueOf(untilDate));
        }
        return InMemoryDataset.of(jdbc.queryForList(sql.toString(), args.toArray()));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Object toJdbcValue(Object v) {
        if (v instanceof Instant) return Timestamp.from((Instant) v);
        if (v instanceof LocalDate) return Date.valueOf((LocalDate) v);
        return v;
    }
}
