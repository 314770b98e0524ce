package com.warden.core.audit;

import com.warden.core.risk.RiskTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AuditLogTest {

    private AuditLog auditLog;

    @BeforeEach
    void setUp() {
        auditLog = new AuditLog();
    }

    private AuditEntry entry(String action) {
        return AuditEntry.builder(AuditActor.SYSTEM, action, "auto-approved").riskTier(RiskTier.SAFE).build();
    }

    @Test
    @DisplayName("tail returns the last N entries oldest first")
    void tailReturnsLastEntries() {
        for (int i = 1; i <= 5; i++) {
            auditLog.append(entry("action-" + i));
        }

        List<AuditEntry> tail = auditLog.tail(3);

        assertEquals(List.of("action-3", "action-4", "action-5"), tail.stream().map(AuditEntry::action).toList());
    }

    @Test
    @DisplayName("tail with a limit larger than the log returns everything")
    void tailLargerThanLog() {
        auditLog.append(entry("only"));

        assertEquals(1, auditLog.tail(100).size());
        assertTrue(auditLog.tail(0).isEmpty());
    }

    @Test
    @DisplayName("builder fills correlation fields")
    void builderFillsCorrelation() {
        AuditEntry recorded = auditLog.record(AuditEntry.builder(AuditActor.USER, "Delete temp", "approved")
                .riskTier(RiskTier.WARNING)
                .resolvedBy("alice")
                .plan("PLAN-2026-0001", "TASK-001")
                .requestId("CR-1"));

        assertEquals(AuditActor.USER, recorded.actor());
        assertEquals("alice", recorded.resolvedBy());
        assertEquals("PLAN-2026-0001", recorded.planId());
        assertEquals("TASK-001", recorded.taskId());
        assertEquals("CR-1", recorded.requestId());
        assertNotNull(recorded.timestamp());
        assertNull(recorded.error());
    }

    @Test
    @DisplayName("export is a snapshot that later appends do not change")
    void exportIsSnapshot() {
        auditLog.append(entry("first"));
        List<AuditEntry> exported = auditLog.exportAll();
        auditLog.append(entry("second"));

        assertEquals(1, exported.size());
        assertEquals(2, auditLog.size());
        assertThrows(UnsupportedOperationException.class, () -> exported.add(entry("x")));
    }

    @Test
    @DisplayName("concurrent appends are all kept")
    void concurrentAppends() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            int thread = t;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    auditLog.append(entry(thread + ":" + i));
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        List<AuditEntry> all = auditLog.exportAll();
        assertEquals(threads * perThread, all.size());
        assertEquals(threads * perThread, new HashSet<>(all.stream().map(AuditEntry::action).toList()).size());
    }

    @Test
    @DisplayName("actors serialise in lower case")
    void actorValue() {
        assertEquals("scheduler", AuditActor.SCHEDULER.value());
    }
}
