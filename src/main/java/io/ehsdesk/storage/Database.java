package io.ehsdesk.storage;

import io.ehsdesk.config.EhsDeskConfig;
import io.ehsdesk.error.StoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

public final class Database {
    private static final String BUSY_TIMEOUT_MS = "5000";

    private final EhsDeskConfig config;
    private final String jdbcUrl;
    private final StoreWriteLock writeLock;

    public Database(EhsDeskConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.writeLock = new StoreWriteLock();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public StoreWriteLock writeLock() {
        return writeLock;
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", BUSY_TIMEOUT_MS);
        return DriverManager.getConnection(jdbcUrl, props);
    }

    /** Runs one read statement without the write lock. */
    public <T> T read(String operation, SqlWork<T> work) {
        try (Connection c = openConnection()) {
            return work.apply(c);
        } catch (SQLException e) {
            throw new StoreException("Failed to " + operation, e);
        }
    }

    /** Runs one mutating statement while holding the write lock. */
    public <T> T write(String operation, SqlWork<T> work) {
        return writeLock.guard(() -> {
            try (Connection c = openConnection()) {
                return work.apply(c);
            } catch (SQLException e) {
                throw new StoreException("Failed to " + operation, e);
            }
        });
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.uploadsDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        writeLock.guard(() -> {
            try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
                st.execute("""
                        CREATE TABLE IF NOT EXISTS users (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            username TEXT UNIQUE,
                            password TEXT,
                            role TEXT
                        )
                        """);
                st.execute("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            worker_id INTEGER,
                            worker_username TEXT,
                            task_description TEXT,
                            status TEXT,
                            violation_comment TEXT,
                            violation_timestamp TEXT,
                            worker_report TEXT,
                            worker_media TEXT
                        )
                        """);
                st.execute("""
                        CREATE TABLE IF NOT EXISTS rules (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            rule_text TEXT NOT NULL,
                            feedback TEXT,
                            timestamp TEXT
                        )
                        """);
                st.execute("""
                        CREATE TABLE IF NOT EXISTS report_submissions (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            task_id INTEGER NOT NULL,
                            worker_id INTEGER NOT NULL,
                            report_text TEXT NOT NULL,
                            media_source TEXT NOT NULL,
                            state TEXT NOT NULL,
                            media_path TEXT,
                            error TEXT,
                            created_at_ms INTEGER NOT NULL,
                            updated_at_ms INTEGER NOT NULL
                        )
                        """);

                st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_worker_status ON tasks(worker_id, status)");
                st.execute("CREATE INDEX IF NOT EXISTS idx_users_role ON users(role)");
                st.execute("CREATE INDEX IF NOT EXISTS idx_report_submissions_task_state ON report_submissions(task_id, state)");
                st.execute("CREATE INDEX IF NOT EXISTS idx_report_submissions_state ON report_submissions(state)");
            } catch (SQLException e) {
                throw new StoreException("Failed to initialize SQLite schema", e);
            }
        });
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "busy_timeout", BUSY_TIMEOUT_MS);
        } catch (SQLException e) {
            throw new StoreException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }
}
