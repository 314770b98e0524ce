package com.warden.core.confirmation;

import com.warden.core.action.AgentAction;
import com.warden.core.audit.AuditActor;
import com.warden.core.audit.AuditEntry;
import com.warden.core.audit.AuditLog;
import com.warden.core.logging.MdcContext;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.risk.RiskAssessment;
import com.warden.core.risk.RiskClassifier;
import com.warden.core.risk.RiskTier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Brokers external approval for actions that are not trivially safe.
 * <p>
 * Safe actions are approved and blocked actions denied immediately, without creating a request.
 * Warning and danger actions become a {@link ConfirmationRequest} that is published to every
 * {@link ApproverTransport} and resolved exactly once: by {@link #submitResponse}, by
 * {@link #denyPending}, or by its own timeout, which the gateway enforces on a dedicated timer
 * thread. State is synchronized per request only; unrelated requests never contend.
 * <p>
 * Transports hear about resolutions on a separate notifier thread, after the waiting caller has
 * been woken, so a slow transport never delays a caller or another request's timeout.
 */
@Service
public class ConfirmationGateway {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationGateway.class);

    public static final String SYSTEM_RESOLVER = "system";

    private final RiskClassifier classifier;
    private final AuditLog auditLog;
    private final WardenMetrics metrics;
    private final Duration defaultTimeout;
    private final int historyLimit;

    private final CopyOnWriteArrayList<ApproverTransport> transports;
    private final ConcurrentHashMap<String, ConfirmationRequest> pending = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ScheduledFuture<?>> timeouts = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<ConfirmationSnapshot> history = new ConcurrentLinkedDeque<>();
    private final AtomicInteger historySize = new AtomicInteger();
    private final RequestIdGenerator idGenerator = new RequestIdGenerator();
    private final ScheduledThreadPoolExecutor timer;
    private final ExecutorService notifier;

    @Autowired
    public ConfirmationGateway(RiskClassifier classifier, AuditLog auditLog, List<ApproverTransport> transports,
                               WardenMetrics metrics, ConfirmationProperties properties) {
        this(classifier, auditLog, transports, metrics, properties.getDefaultTimeout(), properties.getHistoryLimit());
    }

    public ConfirmationGateway(RiskClassifier classifier, AuditLog auditLog, List<ApproverTransport> transports,
                               WardenMetrics metrics, Duration defaultTimeout, int historyLimit) {
        this.classifier = classifier;
        this.auditLog = auditLog;
        this.transports = new CopyOnWriteArrayList<>(transports);
        this.metrics = metrics;
        this.defaultTimeout = defaultTimeout;
        this.historyLimit = Math.max(1, historyLimit);
        this.timer = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "confirmation-timeout");
            t.setDaemon(true);
            return t;
        });
        this.timer.setRemoveOnCancelPolicy(true);
        this.notifier = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "confirmation-notify");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        timer.shutdownNow();
        int denied = 0;
        for (ConfirmationRequest request : List.copyOf(pending.values())) {
            if (resolve(request, ConfirmationStatus.DENIED, SYSTEM_RESOLVER, "gateway shutting down")) {
                denied++;
            }
        }
        if (denied > 0) {
            log.warn("Denied {} pending confirmation(s) on shutdown", denied);
        }
        notifier.shutdown();
        try {
            if (!notifier.awaitTermination(5, TimeUnit.SECONDS)) {
                notifier.shutdownNow();
            }
        } catch (InterruptedException e) {
            notifier.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Handle for removing a transport registered at runtime.
     */
    @FunctionalInterface
    public interface Registration {
        void remove();
    }

    public Registration registerTransport(ApproverTransport transport) {
        transports.add(transport);
        return () -> transports.remove(transport);
    }

    public ApprovalOutcome requestConfirmation(AgentAction action, String description, Duration timeout) {
        return requestConfirmation(action, description, timeout, null, null);
    }

    /**
     * Classifies the action and, if it needs approval, blocks the calling thread until the request
     * is resolved or times out. An interrupt while waiting denies the request.
     */
    public ApprovalOutcome requestConfirmation(AgentAction action, String description, Duration timeout,
                                               String planId, String taskId) {
        Submission submission = submit(action, description, timeout, planId, taskId);
        try {
            return submission.outcome().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConfirmationRequest request = submission.request();
            if (request == null) {
                return submission.outcome().join();
            }
            resolve(request, ConfirmationStatus.DENIED, SYSTEM_RESOLVER, "interrupted while awaiting confirmation");
            return toOutcome(request, request.resolution());
        } catch (ExecutionException e) {
            throw new IllegalStateException("Confirmation failed unexpectedly", e.getCause());
        }
    }

    /**
     * Non-blocking form of {@link #requestConfirmation}: the returned future completes when the
     * request is resolved. It never completes exceptionally.
     */
    public CompletableFuture<ApprovalOutcome> requestConfirmationAsync(AgentAction action, String description,
                                                                      Duration timeout, String planId, String taskId) {
        return submit(action, description, timeout, planId, taskId).outcome();
    }

    private record Submission(ConfirmationRequest request, CompletableFuture<ApprovalOutcome> outcome) {}

    private Submission submit(AgentAction action, String description, Duration timeout, String planId, String taskId) {
        RiskAssessment assessment = classifier.classify(action, description);
        metrics.recordClassification(assessment.tier().name());
        AuditActor requester = planId != null ? AuditActor.SCHEDULER : AuditActor.SYSTEM;

        if (assessment.tier() == RiskTier.SAFE) {
            auditLog.record(AuditEntry.builder(requester, assessment.description(), "auto-approved")
                    .riskTier(RiskTier.SAFE)
                    .plan(planId, taskId));
            metrics.recordConfirmation("approved", RiskTier.SAFE.name());
            return new Submission(null, CompletableFuture.completedFuture(ApprovalOutcome.autoApproved(RiskTier.SAFE)));
        }

        if (assessment.tier() == RiskTier.BLOCKED) {
            log.warn("Blocked action '{}': {}", assessment.description(), assessment.reason());
            ApprovalOutcome outcome = ApprovalOutcome.blocked(assessment.reason());
            auditLog.record(AuditEntry.builder(requester, assessment.description(), "blocked")
                    .riskTier(RiskTier.BLOCKED)
                    .error(outcome.reason())
                    .plan(planId, taskId));
            metrics.recordConfirmation("blocked", RiskTier.BLOCKED.name());
            return new Submission(null, CompletableFuture.completedFuture(outcome));
        }

        Duration effectiveTimeout = timeout != null ? timeout : defaultTimeout;
        if (effectiveTimeout.isNegative() || effectiveTimeout.isZero()) {
            throw new IllegalArgumentException("Confirmation timeout must be positive: " + effectiveTimeout);
        }

        var request = new ConfirmationRequest(idGenerator.next(), action.kind(), action.name(), assessment.tier(),
                assessment.description(), action.details(), planId, taskId, effectiveTimeout);

        MdcContext.setRequest(request.id());
        try {
            if (assessment.tier() == RiskTier.DANGER) {
                log.warn("Critical action needs confirmation {}: {} ({})",
                        request.id(), request.description(), assessment.reason());
            } else {
                log.info("Confirmation requested {}: {} ({})", request.id(), request.description(), assessment.reason());
            }
            auditLog.record(AuditEntry.builder(requester, request.description(), "requested")
                    .riskTier(assessment.tier())
                    .plan(planId, taskId)
                    .requestId(request.id()));

            pending.put(request.id(), request);
            timeouts.put(request.id(), timer.schedule(() -> expire(request),
                    effectiveTimeout.toNanos(), TimeUnit.NANOSECONDS));
            if (request.status().isTerminal()) {
                // resolved while the timer was being armed
                cancelTimer(request.id());
            }

            ConfirmationSnapshot snapshot = request.snapshot();
            for (ApproverTransport transport : transports) {
                publishSafely(transport, snapshot);
            }
        } finally {
            MdcContext.clearRequest();
        }

        return new Submission(request, request.completion().thenApply(resolution -> toOutcome(request, resolution)));
    }

    /**
     * Applies an external approver's answer. Never throws: unknown and already-resolved requests
     * are reported through the result and otherwise ignored.
     */
    public ResponseResult submitResponse(String requestId, boolean approved, String resolverId) {
        if (requestId == null) {
            return ResponseResult.NOT_FOUND;
        }
        String resolver = resolverId == null || resolverId.isBlank() ? "user" : resolverId;
        ConfirmationRequest request = pending.get(requestId);
        if (request == null) {
            if (findInHistory(requestId).isPresent()) {
                log.warn("Ignoring late response from {} to already resolved request {}", resolver, requestId);
                metrics.incrementDuplicateResolutions();
                return ResponseResult.ALREADY_RESOLVED;
            }
            log.warn("Ignoring response from {} to unknown request {}", resolver, requestId);
            return ResponseResult.NOT_FOUND;
        }

        boolean applied = resolve(request,
                approved ? ConfirmationStatus.APPROVED : ConfirmationStatus.DENIED,
                resolver,
                approved ? null : "denied by " + resolver);
        if (!applied) {
            log.warn("Ignoring duplicate response from {} to request {} (already {})",
                    resolver, requestId, request.status());
            metrics.incrementDuplicateResolutions();
            return ResponseResult.ALREADY_RESOLVED;
        }
        return ResponseResult.RESOLVED;
    }

    /**
     * Force-denies every pending request that belongs to the given plan.
     *
     * @return number of requests denied by this call
     */
    public int denyPending(String planId, String resolverId, String reason) {
        int denied = 0;
        for (ConfirmationRequest request : List.copyOf(pending.values())) {
            if (planId.equals(request.planId())
                    && resolve(request, ConfirmationStatus.DENIED, resolverId, reason)) {
                denied++;
            }
        }
        if (denied > 0) {
            log.info("Force-denied {} pending confirmation(s) for plan {}: {}", denied, planId, reason);
        }
        return denied;
    }

    public List<ConfirmationSnapshot> listPending() {
        return pending.values().stream()
                .map(ConfirmationRequest::snapshot)
                .sorted(Comparator.comparing(ConfirmationSnapshot::id))
                .toList();
    }

    public List<ConfirmationSnapshot> listPending(String planId) {
        return listPending().stream()
                .filter(s -> planId.equals(s.planId()))
                .toList();
    }

    public Optional<ConfirmationSnapshot> find(String requestId) {
        ConfirmationRequest request = pending.get(requestId);
        if (request != null) {
            return Optional.of(request.snapshot());
        }
        return findInHistory(requestId);
    }

    /**
     * Most recently resolved requests, oldest first.
     */
    public List<ConfirmationSnapshot> getHistory(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        var newestFirst = new ArrayList<ConfirmationSnapshot>();
        Iterator<ConfirmationSnapshot> it = history.descendingIterator();
        while (it.hasNext() && newestFirst.size() < limit) {
            newestFirst.add(it.next());
        }
        var result = new ArrayList<ConfirmationSnapshot>(newestFirst.size());
        for (int i = newestFirst.size() - 1; i >= 0; i--) {
            result.add(newestFirst.get(i));
        }
        return List.copyOf(result);
    }

    public int pendingCount() {
        return pending.size();
    }

    private void expire(ConfirmationRequest request) {
        if (resolve(request, ConfirmationStatus.TIMED_OUT, SYSTEM_RESOLVER,
                "timeout after " + request.timeout().toSeconds() + "s")) {
            log.warn("Confirmation {} timed out: {}", request.id(), request.description());
        }
    }

    /**
     * Single exit point for every resolution. Only the caller that wins the compare-and-set does
     * the bookkeeping, and the waiting task is woken only after the audit entry is written.
     * Transports are notified afterwards, off the calling thread.
     */
    private boolean resolve(ConfirmationRequest request, ConfirmationStatus status, String resolver, String reason) {
        if (!request.tryResolve(status, resolver, reason)) {
            return false;
        }
        cancelTimer(request.id());

        // history first: a late response must always find the request in one of the two places
        ConfirmationSnapshot snapshot = request.snapshot();
        history.addLast(snapshot);
        if (historySize.incrementAndGet() > historyLimit && history.pollFirst() != null) {
            historySize.decrementAndGet();
        }
        pending.remove(request.id());

        AuditActor actor = SYSTEM_RESOLVER.equals(resolver) ? AuditActor.SYSTEM : AuditActor.USER;
        auditLog.record(AuditEntry.builder(actor, request.description(), outcomeLabel(status))
                .riskTier(request.riskTier())
                .error(status == ConfirmationStatus.APPROVED ? null : reason)
                .resolvedBy(resolver)
                .plan(request.planId(), request.taskId())
                .requestId(request.id()));

        long latencyMs = Duration.between(request.createdAt(), snapshot.resolvedAt()).toMillis();
        metrics.recordConfirmationLatency(latencyMs);
        metrics.recordConfirmation(status.name().toLowerCase(), request.riskTier().name());
        log.info("Confirmation {} resolved {} by {} after {}ms", request.id(), status, resolver, latencyMs);

        request.signal();
        notifyResolved(snapshot);
        return true;
    }

    private void notifyResolved(ConfirmationSnapshot snapshot) {
        List<ApproverTransport> targets = List.copyOf(transports);
        if (targets.isEmpty()) {
            return;
        }
        try {
            notifier.execute(() -> targets.forEach(t -> notifyResolvedSafely(t, snapshot)));
        } catch (RejectedExecutionException e) {
            log.debug("Gateway stopped; transports not told about resolution of {}", snapshot.id());
        }
    }

    private ApprovalOutcome toOutcome(ConfirmationRequest request, ConfirmationRequest.Resolution resolution) {
        ApprovalOutcome.Decision decision = switch (resolution.status()) {
            case APPROVED -> ApprovalOutcome.Decision.APPROVED;
            case TIMED_OUT -> ApprovalOutcome.Decision.TIMED_OUT;
            default -> ApprovalOutcome.Decision.DENIED;
        };
        String reason = resolution.reason() != null ? resolution.reason() : "approved by " + resolution.resolvedBy();
        return new ApprovalOutcome(decision, request.riskTier(), request.id(), reason, resolution.resolvedBy());
    }

    private void cancelTimer(String requestId) {
        ScheduledFuture<?> scheduled = timeouts.remove(requestId);
        if (scheduled != null) {
            scheduled.cancel(false);
        }
    }

    private Optional<ConfirmationSnapshot> findInHistory(String requestId) {
        for (ConfirmationSnapshot snapshot : history) {
            if (snapshot.id().equals(requestId)) {
                return Optional.of(snapshot);
            }
        }
        return Optional.empty();
    }

    private static String outcomeLabel(ConfirmationStatus status) {
        return switch (status) {
            case APPROVED -> "approved";
            case DENIED -> "denied";
            case TIMED_OUT -> "timed-out";
            case PENDING -> "pending";
        };
    }

    private void publishSafely(ApproverTransport transport, ConfirmationSnapshot snapshot) {
        try {
            transport.publish(snapshot);
        } catch (Exception e) {
            log.warn("Approver transport {} failed to publish request {}: {}",
                    transport.getClass().getSimpleName(), snapshot.id(), e.getMessage(), e);
        }
    }

    private void notifyResolvedSafely(ApproverTransport transport, ConfirmationSnapshot snapshot) {
        try {
            transport.resolved(snapshot);
        } catch (Exception e) {
            log.warn("Approver transport {} failed on resolution of {}: {}",
                    transport.getClass().getSimpleName(), snapshot.id(), e.getMessage(), e);
        }
    }
}
