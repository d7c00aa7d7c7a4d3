package io.ehsdesk.storage;

import io.ehsdesk.model.ReportState;
import io.ehsdesk.model.ReportSubmission;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class ReportStore {
    private static final String COLUMNS = "id,task_id,worker_id,report_text,media_source,state,media_path,error,"
            + "created_at_ms,updated_at_ms";

    private final Database database;

    public ReportStore(Database database) {
        this.database = database;
    }

    public long insert(long taskId, long workerId, String reportText, String mediaSource, long nowMs) {
        return database.write("persist report draft for task " + taskId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO report_submissions(task_id,worker_id,report_text,media_source,state,created_at_ms,updated_at_ms) "
                            + "VALUES(?,?,?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setLong(1, taskId);
                ps.setLong(2, workerId);
                ps.setString(3, reportText);
                ps.setString(4, mediaSource);
                ps.setString(5, ReportState.QUEUED.dbValue());
                ps.setLong(6, nowMs);
                ps.setLong(7, nowMs);
                ps.executeUpdate();
                return TaskStore.generatedId(ps);
            }
        });
    }

    public Optional<ReportSubmission> get(long submissionId) {
        return database.read("load report submission " + submissionId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM report_submissions WHERE id=?")) {
                ps.setLong(1, submissionId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<ReportSubmission>empty();
                }
            }
        });
    }

    public List<ReportSubmission> listByTask(long taskId) {
        return database.read("list report submissions of task " + taskId, c -> {
            List<ReportSubmission> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM report_submissions WHERE task_id=? ORDER BY id")) {
                ps.setLong(1, taskId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(map(rs));
                    }
                }
            }
            return out;
        });
    }

    public Optional<ReportSubmission> findInFlight(long taskId) {
        return database.read("look up in-flight report of task " + taskId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM report_submissions WHERE task_id=? AND state IN (?,?) "
                            + "ORDER BY id DESC LIMIT 1")) {
                ps.setLong(1, taskId);
                ps.setString(2, ReportState.QUEUED.dbValue());
                ps.setString(3, ReportState.TRANSFERRING.dbValue());
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<ReportSubmission>empty();
                }
            }
        });
    }

    public boolean markTransferring(long submissionId, long nowMs) {
        return transition(submissionId, ReportState.TRANSFERRING, null, null, nowMs);
    }

    public boolean markCommitted(long submissionId, String mediaPath, long nowMs) {
        return transition(submissionId, ReportState.COMMITTED, mediaPath, null, nowMs);
    }

    public boolean markFailed(long submissionId, String error, long nowMs) {
        return transition(submissionId, ReportState.FAILED, null, error, nowMs);
    }

    public boolean requeue(long submissionId, long nowMs) {
        return transition(submissionId, ReportState.QUEUED, null, null, nowMs);
    }

    /** Fails every submission still queued or transferring; used when a new process takes over. */
    public int failInFlight(String error, long nowMs) {
        return database.write("fail interrupted report submissions", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE report_submissions SET state=?, error=?, updated_at_ms=? WHERE state IN (?,?)")) {
                ps.setString(1, ReportState.FAILED.dbValue());
                ps.setString(2, error);
                ps.setLong(3, nowMs);
                ps.setString(4, ReportState.QUEUED.dbValue());
                ps.setString(5, ReportState.TRANSFERRING.dbValue());
                return ps.executeUpdate();
            }
        });
    }

    private boolean transition(long submissionId, ReportState state, String mediaPath, String error, long nowMs) {
        return database.write("mark report submission " + submissionId + " " + state.dbValue(), c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE report_submissions SET state=?, media_path=?, error=?, updated_at_ms=? WHERE id=?")) {
                ps.setString(1, state.dbValue());
                ps.setString(2, mediaPath);
                ps.setString(3, error);
                ps.setLong(4, nowMs);
                ps.setLong(5, submissionId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    private ReportSubmission map(ResultSet rs) throws SQLException {
        return new ReportSubmission(
                rs.getLong("id"),
                rs.getLong("task_id"),
                rs.getLong("worker_id"),
                rs.getString("report_text"),
                rs.getString("media_source"),
                ReportState.fromString(rs.getString("state")),
                rs.getString("media_path"),
                rs.getString("error"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}
