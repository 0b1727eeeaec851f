package io.lendflow.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.lendflow.recovery.AttemptResult;
import io.lendflow.recovery.ErrorCategory;
import io.lendflow.recovery.ErrorRecord;
import io.lendflow.recovery.ErrorRecordStore;
import io.lendflow.recovery.ErrorSeverity;
import io.lendflow.recovery.RecoveryAction;
import io.lendflow.recovery.RecoveryAttempt;
import io.lendflow.recovery.RecoveryStatus;
import io.lendflow.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Error records in {@code error_records}. Plans, attempts and context are kept as JSON
 * columns; saving an existing id replaces the row in place.
 */
public final class SqliteErrorRecordStore implements ErrorRecordStore {
    private static final String COLUMNS = """
            error_id,application_id,error_type,message,severity,category,status,context_json,
            planned_actions_json,attempts_json,prior_attempts,max_retries,created_at_ms,updated_at_ms
            """;
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<Map<String, Object>>> MAP_LIST = new TypeReference<>() {
    };

    private final Database database;

    public SqliteErrorRecordStore(Database database) {
        this.database = database;
    }

    @Override
    public void save(ErrorRecord record) {
        String sql = "INSERT INTO error_records(" + COLUMNS + """
                ) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(error_id) DO UPDATE SET
                    status=excluded.status,
                    planned_actions_json=excluded.planned_actions_json,
                    attempts_json=excluded.attempts_json,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            List<String> plan = new ArrayList<>();
            for (RecoveryAction action : record.plannedActions()) {
                plan.add(action.wireName());
            }
            List<Map<String, Object>> attempts = new ArrayList<>();
            for (RecoveryAttempt attempt : record.attempts()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("action", attempt.action().wireName());
                row.put("requested_action", attempt.requestedAction().wireName());
                row.put("timestamp_ms", attempt.timestamp().toEpochMilli());
                row.put("result", attempt.result().wireName());
                row.put("detail", attempt.detail());
                attempts.add(row);
            }
            ps.setString(1, record.errorId());
            ps.setString(2, record.applicationId());
            ps.setString(3, record.errorType());
            ps.setString(4, record.message());
            ps.setString(5, record.severity().wireName());
            ps.setString(6, record.category().wireName());
            ps.setString(7, record.status().wireName());
            ps.setString(8, Jsons.toCompactJson(record.context()));
            ps.setString(9, Jsons.toCompactJson(plan));
            ps.setString(10, Jsons.toCompactJson(attempts));
            ps.setInt(11, record.priorAttempts());
            ps.setInt(12, record.maxRetries());
            ps.setLong(13, record.timestamp().toEpochMilli());
            ps.setLong(14, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save error record", e);
        }
    }

    @Override
    public Optional<ErrorRecord> find(String errorId) {
        List<ErrorRecord> rows = query("SELECT " + COLUMNS + " FROM error_records WHERE error_id=?", errorId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<ErrorRecord> findByApplication(String applicationId) {
        return query("SELECT " + COLUMNS + " FROM error_records WHERE application_id=? ORDER BY created_at_ms ASC, rowid ASC",
                applicationId);
    }

    @Override
    public List<ErrorRecord> findAll() {
        return query("SELECT " + COLUMNS + " FROM error_records ORDER BY created_at_ms ASC, rowid ASC", null);
    }

    private List<ErrorRecord> query(String sql, String param) {
        List<ErrorRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (param != null) {
                ps.setString(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read error records", e);
        }
        return out;
    }

    private static ErrorRecord map(ResultSet rs) throws SQLException {
        List<RecoveryAction> plan = new ArrayList<>();
        for (String action : readJson(rs.getString("planned_actions_json"), STRING_LIST)) {
            plan.add(RecoveryAction.fromString(action));
        }
        List<RecoveryAttempt> attempts = new ArrayList<>();
        for (Map<String, Object> row : readJson(rs.getString("attempts_json"), MAP_LIST)) {
            Object detail = row.get("detail");
            attempts.add(new RecoveryAttempt(
                    RecoveryAction.fromString(String.valueOf(row.get("action"))),
                    RecoveryAction.fromString(String.valueOf(row.get("requested_action"))),
                    Instant.ofEpochMilli(((Number) row.get("timestamp_ms")).longValue()),
                    AttemptResult.fromString(String.valueOf(row.get("result"))),
                    detail == null ? null : detail.toString()
            ));
        }
        return new ErrorRecord(
                rs.getString("error_id"),
                rs.getString("application_id"),
                Instant.ofEpochMilli(rs.getLong("created_at_ms")),
                rs.getString("error_type"),
                rs.getString("message"),
                ErrorSeverity.fromString(rs.getString("severity")),
                ErrorCategory.fromString(rs.getString("category")),
                Jsons.toMap(rs.getString("context_json")),
                plan,
                attempts,
                RecoveryStatus.fromString(rs.getString("status")),
                rs.getInt("prior_attempts"),
                rs.getInt("max_retries")
        );
    }

    private static <T> T readJson(String json, TypeReference<T> type) {
        try {
            return Jsons.compactMapper().readValue(json == null || json.isBlank() ? "[]" : json, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse stored error record JSON", e);
        }
    }
}
