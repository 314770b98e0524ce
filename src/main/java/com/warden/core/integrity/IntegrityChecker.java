package com.warden.core.integrity;

import com.warden.core.audit.AuditActor;
import com.warden.core.audit.AuditEntry;
import com.warden.core.audit.AuditLog;
import com.warden.core.metrics.WardenMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Detects tampering with a configured set of files by comparing SHA-256 content hashes
 * against a baseline taken at startup. Violations are written to the {@link AuditLog}.
 */
@Service
public class IntegrityChecker {

    private static final Logger log = LoggerFactory.getLogger(IntegrityChecker.class);

    private final AuditLog auditLog;
    private final WardenMetrics metrics;
    private final List<Path> roots;
    private final Duration checkInterval;
    private final Map<Path, String> baseline = new LinkedHashMap<>();

    private ScheduledExecutorService scheduler;

    @Autowired
    public IntegrityChecker(AuditLog auditLog, WardenMetrics metrics, IntegrityProperties properties) {
        this(auditLog, metrics, properties.getFiles().stream().map(Path::of).toList(), properties.getCheckInterval());
    }

    public IntegrityChecker(AuditLog auditLog, WardenMetrics metrics, Collection<Path> roots, Duration checkInterval) {
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.roots = List.copyOf(roots);
        this.checkInterval = checkInterval != null ? checkInterval : Duration.ZERO;
    }

    @PostConstruct
    void start() {
        takeBaseline();
        if (!checkInterval.isZero() && !checkInterval.isNegative() && !baseline.isEmpty()) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "integrity-check");
                t.setDaemon(true);
                return t;
            });
            long ms = checkInterval.toMillis();
            scheduler.scheduleAtFixedRate(this::verifyQuietly, ms, ms, TimeUnit.MILLISECONDS);
            log.info("Integrity verification every {}s", checkInterval.toSeconds());
        }
    }

    @PreDestroy
    void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * (Re)computes the baseline hashes of every configured file.
     *
     * @return number of files tracked
     */
    public synchronized int takeBaseline() {
        baseline.clear();
        for (Path root : roots) {
            for (Path file : expand(root)) {
                try {
                    baseline.put(file, sha256(file));
                } catch (IOException e) {
                    log.error("Cannot hash {}, not tracking it: {}", file, e.getMessage());
                }
            }
        }
        if (!roots.isEmpty()) {
            log.info("Integrity baseline: {} file(s) tracked", baseline.size());
        }
        return baseline.size();
    }

    /**
     * Compares every tracked file against its baseline.
     */
    public synchronized List<IntegrityViolation> verify() {
        var violations = new ArrayList<IntegrityViolation>();
        baseline.forEach((file, expected) -> {
            try {
                String actual = sha256(file);
                if (!actual.equals(expected)) {
                    violations.add(new IntegrityViolation(file.toString(), IntegrityViolation.Kind.MODIFIED,
                            "hash changed from " + expected.substring(0, 12) + " to " + actual.substring(0, 12)));
                }
            } catch (NoSuchFileException e) {
                violations.add(new IntegrityViolation(file.toString(), IntegrityViolation.Kind.DELETED, "file deleted"));
            } catch (IOException e) {
                violations.add(new IntegrityViolation(file.toString(), IntegrityViolation.Kind.UNREADABLE,
                        e.getMessage()));
            }
        });

        for (IntegrityViolation v : violations) {
            log.error("Integrity violation: {} {} ({})", v.kind(), v.path(), v.detail());
            auditLog.record(AuditEntry.builder(AuditActor.SYSTEM, "integrity check: " + v.path(), "tampered")
                    .error(v.kind() + ": " + v.detail()));
        }
        if (!violations.isEmpty()) {
            metrics.recordIntegrityViolations(violations.size());
        }
        return violations;
    }

    public synchronized List<String> trackedFiles() {
        return baseline.keySet().stream().map(Path::toString).sorted().toList();
    }

    private void verifyQuietly() {
        try {
            verify();
        } catch (RuntimeException e) {
            log.warn("Integrity verification failed: {}", e.getMessage(), e);
        }
    }

    private static List<Path> expand(Path root) {
        Path normalized = root.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            log.warn("Integrity path does not exist: {}", normalized);
            return List.of();
        }
        if (!Files.isDirectory(normalized)) {
            return List.of(normalized);
        }
        try (Stream<Path> walk = Files.walk(normalized)) {
            return walk.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            log.error("Cannot list {}: {}", normalized, e.getMessage());
            return List.of();
        }
    }

    static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
