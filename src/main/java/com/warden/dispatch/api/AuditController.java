package com.warden.dispatch.api;

import com.warden.core.audit.AuditEntry;
import com.warden.core.audit.AuditExporter;
import com.warden.core.audit.AuditLog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final AuditLog auditLog;
    private final AuditExporter auditExporter;

    public AuditController(AuditLog auditLog, AuditExporter auditExporter) {
        this.auditLog = auditLog;
        this.auditExporter = auditExporter;
    }

    /**
     * GET /api/v1/audit?limit=N: Last N entries, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<AuditEntry>> tail(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(auditLog.tail(limit));
    }

    /**
     * GET /api/v1/audit/export: The whole log as an export document.
     */
    @GetMapping("/export")
    public ResponseEntity<Map<String, Object>> export() {
        return ResponseEntity.ok(auditExporter.snapshot());
    }
}
