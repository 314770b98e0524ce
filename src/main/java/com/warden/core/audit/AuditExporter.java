package com.warden.core.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialises the {@link AuditLog} to JSON: {@code {exportedAt, totalEntries, entries[]}}.
 */
@Component
public class AuditExporter {

    private static final Logger log = LoggerFactory.getLogger(AuditExporter.class);

    private final AuditLog auditLog;
    private final ObjectMapper objectMapper;

    public AuditExporter(AuditLog auditLog) {
        this.auditLog = auditLog;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Map<String, Object> snapshot() {
        List<AuditEntry> entries = auditLog.exportAll();
        var document = new LinkedHashMap<String, Object>();
        document.put("exportedAt", Instant.now());
        document.put("totalEntries", entries.size());
        document.put("entries", entries);
        return document;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(snapshot());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialise audit log", e);
        }
    }

    public void exportTo(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson());
        log.info("Audit log exported to {} ({} entries)", file, auditLog.size());
    }

    /**
     * Reads a previously exported document back as a generic tree.
     */
    public Map<String, Object> read(Path file) throws IOException {
        @SuppressWarnings("unchecked")
        Map<String, Object> document = objectMapper.readValue(file.toFile(), Map.class);
        return document;
    }
}
