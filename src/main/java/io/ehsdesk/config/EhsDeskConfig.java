package io.ehsdesk.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class EhsDeskConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE_NAME = "ehs.db";
    public static final String SETTINGS_FILE_NAME = "ehsdesk-settings.json";

    private final Path rootDir;

    public EhsDeskConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static EhsDeskConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new EhsDeskConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path uploadsDir() {
        return rootDir.resolve("uploads");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    /**
     * Destination of a worker's media upload for one task. One file per (task, worker) pair;
     * a later successful report for the same task overwrites it.
     */
    public Path uploadTarget(long taskId, long workerId) {
        return uploadsDir().resolve("task_" + taskId + "_user_" + workerId);
    }
}
