package com.warden.core.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only, lock-free record of every classified action and confirmation outcome.
 * <p>
 * Entries are kept in the order their appends complete. Reads return copies and never
 * block writers. Each entry is also written to the {@code warden.audit} logger.
 */
@Service
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);
    private static final Logger auditLog = LoggerFactory.getLogger("warden.audit");

    private final ConcurrentLinkedDeque<AuditEntry> entries = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();

    public AuditEntry append(AuditEntry entry) {
        Objects.requireNonNull(entry, "entry");
        entries.addLast(entry);
        size.incrementAndGet();
        auditLog.info("{} {} [{}] {}{}", entry.actor().value(), entry.outcome(),
                entry.riskTier() != null ? entry.riskTier() : "-", entry.action(),
                entry.error() != null ? " (" + entry.error() + ")" : "");
        return entry;
    }

    /**
     * Builds and appends an entry in one step.
     */
    public AuditEntry record(AuditEntry.Builder builder) {
        return append(builder.build());
    }

    /**
     * Returns the last {@code n} entries, oldest first.
     */
    public List<AuditEntry> tail(int n) {
        if (n <= 0) {
            return List.of();
        }
        var reversed = new ArrayList<AuditEntry>(Math.min(n, size.get()));
        Iterator<AuditEntry> it = entries.descendingIterator();
        while (it.hasNext() && reversed.size() < n) {
            reversed.add(it.next());
        }
        var result = new ArrayList<AuditEntry>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            result.add(reversed.get(i));
        }
        return List.copyOf(result);
    }

    /**
     * Snapshot of the whole log, oldest first.
     */
    public List<AuditEntry> exportAll() {
        var snapshot = List.copyOf(new ArrayList<>(entries));
        log.debug("Exported {} audit entries", snapshot.size());
        return snapshot;
    }

    public int size() {
        return size.get();
    }
}
