package io.lendflow.storage;

import io.lendflow.error.WorkflowException;
import io.lendflow.model.ApplicationState;
import io.lendflow.state.ApplicationStateStore;
import io.lendflow.state.StateTransition;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Application lifecycle persisted in {@code application_states}, with every transition
 * appended to {@code state_history}.
 */
public final class SqliteApplicationStateStore implements ApplicationStateStore {
    private final Database database;

    public SqliteApplicationStateStore(Database database) {
        this.database = database;
    }

    @Override
    public boolean create(String applicationId, StateTransition initial) {
        long ts = initial.timestamp().toEpochMilli();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR IGNORE INTO application_states(application_id,current_state,created_at_ms,updated_at_ms) VALUES(?,?,?,?)")) {
                ps.setString(1, applicationId);
                ps.setString(2, initial.to().wireName());
                ps.setLong(3, ts);
                ps.setLong(4, ts);
                if (ps.executeUpdate() != 1) {
                    c.rollback();
                    return false;
                }
                insertHistory(c, applicationId, initial);
                c.commit();
                return true;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create application", e);
        }
    }

    @Override
    public Optional<ApplicationState> currentState(String applicationId) {
        String sql = "SELECT current_state FROM application_states WHERE application_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, applicationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(ApplicationState.fromString(rs.getString("current_state")));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read application state", e);
        }
    }

    @Override
    public void recordTransition(String applicationId, StateTransition transition) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE application_states SET current_state=?,updated_at_ms=? WHERE application_id=?")) {
                ps.setString(1, transition.to().wireName());
                ps.setLong(2, transition.timestamp().toEpochMilli());
                ps.setString(3, applicationId);
                if (ps.executeUpdate() != 1) {
                    c.rollback();
                    throw new WorkflowException("Unknown application: " + applicationId);
                }
                insertHistory(c, applicationId, transition);
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record state transition", e);
        }
    }

    @Override
    public List<StateTransition> history(String applicationId) {
        String sql = "SELECT from_state,to_state,reason,occurred_at_ms FROM state_history WHERE application_id=? ORDER BY id ASC";
        List<StateTransition> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, applicationId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String from = rs.getString("from_state");
                    out.add(new StateTransition(
                            from == null ? null : ApplicationState.fromString(from),
                            ApplicationState.fromString(rs.getString("to_state")),
                            rs.getString("reason"),
                            Instant.ofEpochMilli(rs.getLong("occurred_at_ms"))
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read state history", e);
        }
        return out;
    }

    @Override
    public List<String> applicationsIn(ApplicationState state) {
        String sql = "SELECT application_id FROM application_states WHERE current_state=? ORDER BY created_at_ms ASC, application_id ASC";
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, state.wireName());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString("application_id"));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list applications", e);
        }
        return out;
    }

    private static void insertHistory(Connection c, String applicationId, StateTransition transition) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO state_history(application_id,from_state,to_state,reason,occurred_at_ms) VALUES(?,?,?,?,?)")) {
            ps.setString(1, applicationId);
            ps.setString(2, transition.from() == null ? null : transition.from().wireName());
            ps.setString(3, transition.to().wireName());
            ps.setString(4, transition.reason() == null ? "" : transition.reason());
            ps.setLong(5, transition.timestamp().toEpochMilli());
            ps.executeUpdate();
        }
    }
}
