package com.warden.core.audit;

import com.warden.core.risk.RiskTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditExporterTest {

    private AuditLog auditLog;
    private AuditExporter exporter;

    @BeforeEach
    void setUp() {
        auditLog = new AuditLog();
        exporter = new AuditExporter(auditLog);
        auditLog.record(AuditEntry.builder(AuditActor.SCHEDULER, "Copy report", "requested")
                .riskTier(RiskTier.WARNING)
                .plan("PLAN-2026-0001", "TASK-001")
                .requestId("CR-1"));
        auditLog.record(AuditEntry.builder(AuditActor.SYSTEM, "Copy report", "timed-out")
                .riskTier(RiskTier.WARNING)
                .error("timeout after 5s")
                .resolvedBy("system")
                .plan("PLAN-2026-0001", "TASK-001")
                .requestId("CR-1"));
    }

    @Test
    @DisplayName("JSON uses snake_case fields, lower-case actors and ISO timestamps")
    void jsonShape() {
        String json = exporter.toJson();

        assertTrue(json.contains("\"totalEntries\" : 2"));
        assertTrue(json.contains("\"risk_tier\" : \"WARNING\""));
        assertTrue(json.contains("\"actor\" : \"scheduler\""));
        assertTrue(json.contains("\"request_id\" : \"CR-1\""));
        assertFalse(json.contains("\"error\" : null"));
        assertTrue(json.matches("(?s).*\"exportedAt\" : \"\\d{4}-\\d{2}-\\d{2}T.*"));
    }

    @Test
    @DisplayName("exported file can be read back")
    void exportAndRead(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("nested/audit.json");

        exporter.exportTo(file);
        assertTrue(Files.exists(file));

        Map<String, Object> document = exporter.read(file);
        assertEquals(2, document.get("totalEntries"));
        List<?> entries = (List<?>) document.get("entries");
        @SuppressWarnings("unchecked")
        Map<String, Object> last = (Map<String, Object>) entries.get(1);
        assertEquals("timed-out", last.get("outcome"));
        assertEquals("timeout after 5s", last.get("error"));
        assertEquals("system", last.get("actor"));
    }
}
