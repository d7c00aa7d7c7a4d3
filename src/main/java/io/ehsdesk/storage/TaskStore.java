package io.ehsdesk.storage;

import io.ehsdesk.model.TaskRecord;
import io.ehsdesk.model.TaskStatus;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class TaskStore {
    private static final String COLUMNS = "id,worker_id,worker_username,task_description,status,"
            + "violation_comment,violation_timestamp,worker_report,worker_media";

    private final Database database;

    public TaskStore(Database database) {
        this.database = database;
    }

    public long insert(long workerId, String workerUsername, String description) {
        return database.write("insert task", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO tasks(worker_id,worker_username,task_description,status) VALUES(?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setLong(1, workerId);
                ps.setString(2, workerUsername);
                ps.setString(3, description);
                ps.setString(4, TaskStatus.PENDING.value());
                ps.executeUpdate();
                return generatedId(ps);
            }
        });
    }

    public Optional<TaskRecord> get(long taskId) {
        return database.read("load task " + taskId, c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM tasks WHERE id=?")) {
                ps.setLong(1, taskId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<TaskRecord>empty();
                }
            }
        });
    }

    public List<TaskRecord> listAll() {
        return database.read("list tasks", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM tasks ORDER BY id")) {
                return mapAll(ps);
            }
        });
    }

    public List<TaskRecord> listByWorker(long workerId) {
        return database.read("list tasks of worker " + workerId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM tasks WHERE worker_id=? ORDER BY id")) {
                ps.setLong(1, workerId);
                return mapAll(ps);
            }
        });
    }

    public List<TaskRecord> listOpenByWorker(long workerId) {
        return database.read("list open tasks of worker " + workerId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM tasks WHERE worker_id=? AND status!=? ORDER BY id")) {
                ps.setLong(1, workerId);
                ps.setString(2, TaskStatus.COMPLETED.value());
                return mapAll(ps);
            }
        });
    }

    public List<TaskRecord> listByStatus(String status) {
        return database.read("list tasks by status", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM tasks WHERE status=? ORDER BY id")) {
                ps.setString(1, status);
                return mapAll(ps);
            }
        });
    }

    /** Overwrites status and violation annotation. Returns false when the row does not exist. */
    public boolean updateViolation(long taskId, String status, String comment, String timestamp) {
        return database.write("update task violation " + taskId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE tasks SET status=?, violation_comment=?, violation_timestamp=? WHERE id=?")) {
                ps.setString(1, status);
                ps.setString(2, comment);
                ps.setString(3, timestamp);
                ps.setLong(4, taskId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /**
     * Writes the worker report and media path and marks the task completed, only if the task is
     * still assigned to {@code workerId}. Returns false when no row matched.
     */
    public boolean updateCompletion(long taskId, long workerId, String report, String mediaPath) {
        return database.write("complete task " + taskId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE tasks SET worker_report=?, worker_media=?, status=? WHERE id=? AND worker_id=?")) {
                ps.setString(1, report);
                ps.setString(2, mediaPath);
                ps.setString(3, TaskStatus.COMPLETED.value());
                ps.setLong(4, taskId);
                ps.setLong(5, workerId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    public boolean delete(long taskId) {
        return database.write("delete task " + taskId, c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM tasks WHERE id=?")) {
                ps.setLong(1, taskId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    static long generatedId(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("Insert did not return a generated id");
            }
            return keys.getLong(1);
        }
    }

    private List<TaskRecord> mapAll(PreparedStatement ps) throws SQLException {
        List<TaskRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
        }
        return out;
    }

    private TaskRecord map(ResultSet rs) throws SQLException {
        return new TaskRecord(
                rs.getLong("id"),
                rs.getLong("worker_id"),
                rs.getString("worker_username"),
                rs.getString("task_description"),
                rs.getString("status"),
                rs.getString("violation_comment"),
                rs.getString("violation_timestamp"),
                rs.getString("worker_report"),
                rs.getString("worker_media")
        );
    }
}
