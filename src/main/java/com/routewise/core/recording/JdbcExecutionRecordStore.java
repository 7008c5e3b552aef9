package com.routewise.core.recording;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routewise.core.engine.RoutingException;
import com.routewise.core.model.ExecutionRecord;
import com.routewise.core.model.Request;
import com.routewise.core.model.ResultStatus;
import com.routewise.core.model.SelectionPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * JDBC-backed {@link ExecutionRecordStore}.
 * <p>
 * Each record is one append-only row. The request and plan are stored as
 * JSON; the fields the store queries on get their own columns. The table is
 * created by {@link #createTables()}.
 */
public class JdbcExecutionRecordStore implements ExecutionRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRecordStore.class);

    private static final String TABLE_NAME = "routewise_execution_records";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                seq               BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                record_id         VARCHAR(64)  NOT NULL,
                chain_id          VARCHAR(255) NOT NULL,
                request_id        VARCHAR(255) NOT NULL,
                plan_id           VARCHAR(64)  NOT NULL,
                status            VARCHAR(32)  NOT NULL,
                score             DOUBLE PRECISION NOT NULL,
                execution_ms      BIGINT NOT NULL,
                providers         TEXT NOT NULL,
                error_detail      TEXT,
                user_satisfaction DOUBLE PRECISION,
                request_json      TEXT NOT NULL,
                plan_json         TEXT NOT NULL,
                recorded_at       TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS %s_chain_idx ON %s (chain_id, seq)
            """.formatted(TABLE_NAME, TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (record_id, chain_id, request_id, plan_id, status, score, execution_ms,
                            providers, error_detail, user_satisfaction, request_json, plan_json, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String COLUMNS =
            "record_id, status, score, execution_ms, providers, error_detail, user_satisfaction, "
            + "request_json, plan_json, recorded_at";

    private static final String SELECT_BY_CHAIN_SQL = """
            SELECT %s FROM %s WHERE chain_id = ? ORDER BY seq DESC LIMIT ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_RECENT_SQL = """
            SELECT %s FROM %s ORDER BY seq DESC LIMIT ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT %s FROM %s ORDER BY seq ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String COUNT_SQL = "SELECT COUNT(*) FROM " + TABLE_NAME;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcExecutionRecordStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the record table and its chain index if they do not exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement table = conn.prepareStatement(CREATE_TABLE_SQL);
             PreparedStatement index = conn.prepareStatement(CREATE_INDEX_SQL)) {
            table.execute();
            index.execute();
            log.info("Execution record table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void append(ExecutionRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, record.recordId());
            stmt.setString(2, record.request().chainId());
            stmt.setString(3, record.request().requestId());
            stmt.setString(4, record.plan().planId());
            stmt.setString(5, record.status().wireName());
            stmt.setDouble(6, record.score());
            stmt.setLong(7, record.executionTime().toMillis());
            stmt.setString(8, toJson(record.providersUsed()));
            stmt.setString(9, record.errorDetail());
            if (record.userSatisfaction() != null) {
                stmt.setDouble(10, record.userSatisfaction());
            } else {
                stmt.setNull(10, Types.DOUBLE);
            }
            stmt.setString(11, toJson(record.request()));
            stmt.setString(12, toJson(record.plan()));
            stmt.setTimestamp(13, Timestamp.from(record.recordedAt()));
            stmt.executeUpdate();
            log.debug("Stored execution record '{}' for chain '{}'", record.recordId(), record.request().chainId());
        } catch (SQLException e) {
            throw new RoutingException("Failed to store execution record " + record.recordId(), e);
        }
    }

    @Override
    public List<ExecutionRecord> forChain(String chainId, int limit) {
        var records = new ArrayList<ExecutionRecord>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_CHAIN_SQL)) {
            stmt.setString(1, chainId);
            stmt.setInt(2, Math.max(0, limit));
            readAll(stmt, records);
        } catch (SQLException e) {
            log.error("Failed to read records for chain '{}'", chainId, e);
        }
        Collections.reverse(records);
        return records;
    }

    @Override
    public List<ExecutionRecord> recent(int limit) {
        var records = new ArrayList<ExecutionRecord>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_SQL)) {
            stmt.setInt(1, Math.max(0, limit));
            readAll(stmt, records);
        } catch (SQLException e) {
            log.error("Failed to read recent records", e);
        }
        Collections.reverse(records);
        return records;
    }

    @Override
    public List<ExecutionRecord> all() {
        var records = new ArrayList<ExecutionRecord>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL)) {
            readAll(stmt, records);
        } catch (SQLException e) {
            log.error("Failed to read execution records", e);
        }
        return records;
    }

    @Override
    public long count() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SQL);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            log.error("Failed to count execution records", e);
            return 0L;
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private void readAll(PreparedStatement stmt, List<ExecutionRecord> into) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                into.add(fromResultSet(rs));
            }
        }
    }

    private ExecutionRecord fromResultSet(ResultSet rs) throws SQLException {
        double satisfaction = rs.getDouble("user_satisfaction");
        Double userSatisfaction = rs.wasNull() ? null : satisfaction;
        return new ExecutionRecord(
                rs.getString("record_id"),
                fromJson(rs.getString("request_json"), new TypeReference<Request>() {}),
                fromJson(rs.getString("plan_json"), new TypeReference<SelectionPlan>() {}),
                ResultStatus.fromWire(rs.getString("status")),
                rs.getDouble("score"),
                Duration.ofMillis(rs.getLong("execution_ms")),
                fromJson(rs.getString("providers"), new TypeReference<List<String>>() {}),
                rs.getString("error_detail"),
                userSatisfaction,
                rs.getTimestamp("recorded_at").toInstant());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize execution record field", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize execution record field", e);
        }
    }
}
