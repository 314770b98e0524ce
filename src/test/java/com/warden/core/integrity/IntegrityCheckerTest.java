package com.warden.core.integrity;

import com.warden.core.audit.AuditEntry;
import com.warden.core.audit.AuditLog;
import com.warden.core.metrics.WardenMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntegrityCheckerTest {

    @TempDir
    Path dir;

    private AuditLog auditLog;
    private SimpleMeterRegistry registry;
    private Path config;
    private Path policy;

    @BeforeEach
    void setUp() throws Exception {
        auditLog = new AuditLog();
        registry = new SimpleMeterRegistry();
        config = Files.writeString(dir.resolve("app.yml"), "mode: strict\n");
        Files.createDirectories(dir.resolve("policies"));
        policy = Files.writeString(dir.resolve("policies/default.txt"), "format_drive\n");
    }

    private IntegrityChecker checker(List<Path> roots) {
        var checker = new IntegrityChecker(auditLog, new WardenMetrics(registry), roots, Duration.ZERO);
        checker.start();
        return checker;
    }

    @Test
    @DisplayName("untouched files verify clean")
    void intact() {
        IntegrityChecker checker = checker(List.of(config));

        assertTrue(checker.verify().isEmpty());
        assertEquals(0, auditLog.size());
    }

    @Test
    @DisplayName("directories are tracked file by file")
    void directoriesExpanded() {
        IntegrityChecker checker = checker(List.of(dir));

        assertEquals(2, checker.trackedFiles().size());
    }

    @Test
    @DisplayName("a modified file is reported and audited as tampered")
    void modified() throws Exception {
        IntegrityChecker checker = checker(List.of(config, policy));
        Files.writeString(policy, "nothing blocked\n");

        List<IntegrityViolation> violations = checker.verify();

        assertEquals(1, violations.size());
        assertEquals(IntegrityViolation.Kind.MODIFIED, violations.get(0).kind());
        AuditEntry entry = auditLog.exportAll().get(0);
        assertEquals("tampered", entry.outcome());
        assertTrue(entry.action().endsWith("default.txt"));
        assertTrue(entry.error().startsWith("MODIFIED"));
        assertEquals(1.0, registry.find("warden.integrity.violations").counter().count());
    }

    @Test
    @DisplayName("a deleted file is reported")
    void deleted() throws Exception {
        IntegrityChecker checker = checker(List.of(config));
        Files.delete(config);

        assertEquals(IntegrityViolation.Kind.DELETED, checker.verify().get(0).kind());
    }

    @Test
    @DisplayName("a new baseline accepts the current contents")
    void rebaseline() throws Exception {
        IntegrityChecker checker = checker(List.of(config));
        Files.writeString(config, "mode: relaxed\n");

        assertEquals(1, checker.takeBaseline());
        assertTrue(checker.verify().isEmpty());
    }

    @Test
    @DisplayName("missing paths are skipped")
    void missingPath() {
        IntegrityChecker checker = checker(List.of(dir.resolve("absent.yml")));

        assertTrue(checker.trackedFiles().isEmpty());
    }

    @Test
    @DisplayName("sha256 is hex encoded")
    void sha256() throws Exception {
        Path empty = Files.writeString(dir.resolve("empty"), "");

        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", IntegrityChecker.sha256(empty));
    }
}
