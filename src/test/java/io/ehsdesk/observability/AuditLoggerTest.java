package io.ehsdesk.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.ehsdesk.util.Hashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsChainAcrossLoggerInstances() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file);
            Assertions.assertEquals("", first.currentHash());
            first.log(AuditLogger.AuditEvent.of("task.assign", "manager:1", "worker/2", "ok", Map.of("worker_id", 2)));
            String afterFirst = first.currentHash();
            Assertions.assertEquals(64, afterFirst.length());

            AuditLogger reopened = new AuditLogger(file);
            Assertions.assertEquals(afterFirst, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("rule.add", "manager:1", "rules", "ok", null));

            List<JsonNode> rows = reopened.tail(10);
            Assertions.assertEquals(2, rows.size());
            Assertions.assertEquals("", rows.get(0).path("prev_hash").asText());
            Assertions.assertEquals(afterFirst, rows.get(1).path("prev_hash").asText());
            Assertions.assertEquals("rule.add", rows.get(1).path("action").asText());
            Assertions.assertEquals(reopened.currentHash(), rows.get(1).path("hash").asText());
            Assertions.assertEquals(1, reopened.tail(1).size());
            Assertions.assertNotEquals(Hashing.sha256Hex(""), reopened.currentHash());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
