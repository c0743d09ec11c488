package com.adkstream.gateway.approval;

import com.adkstream.common.logging.SubsystemLogger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pending human-decision requests keyed by request id.
 * <p>
 * A tool task registers a request and waits on it; any other thread may
 * resolve it. Each request owns its own future, so unrelated requests never
 * contend on a shared lock. A decision that arrives before anyone waits is
 * kept on the pending entry and handed to the next wait for that id, once.
 * When the deadline passes first, the wait completes as a denial flagged
 * {@code timedOut}.
 */
public class ApprovalRegistry {

    /** Deadline for approvals that block a tool's execution. */
    public static final Duration DEFAULT_EXECUTION_TIMEOUT = Duration.ofSeconds(30);
    /** Deadline for interactive UI confirmations. */
    public static final Duration DEFAULT_CONFIRMATION_TIMEOUT = Duration.ofSeconds(60);

    private static final SubsystemLogger log = SubsystemLogger.create("approval");

    // =========================================================================
    // State
    // =========================================================================

    private static final class PendingEntry {
        final PendingApprovalRequest request;
        final CompletableFuture<ApprovalDecision> decision = new CompletableFuture<>();
        final AtomicBoolean awaited = new AtomicBoolean(false);

        PendingEntry(PendingApprovalRequest request) {
            this.request = request;
        }
    }

    private final Map<String, PendingEntry> pending = new ConcurrentHashMap<>();
    /** alternate id (the confirmation call id) to request id */
    private final Map<String, String> aliases = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    public ApprovalRegistry(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    // =========================================================================
    // Operations
    // =========================================================================

    /**
     * Register a request that needs a decision. Registering an id that is
     * already pending replaces the earlier entry.
     */
    public PendingApprovalRequest register(String requestId, String name, Map<String, Object> args) {
        Objects.requireNonNull(requestId, "requestId");
        PendingApprovalRequest request = new PendingApprovalRequest(
                requestId, name, args, System.currentTimeMillis());
        PendingEntry previous = pending.put(requestId, new PendingEntry(request));
        if (previous != null) {
            log.warn("Approval request already pending, replacing it",
                    Map.of("requestId", requestId, "name", String.valueOf(name)));
        } else {
            log.info("Approval requested", Map.of("requestId", requestId, "name", String.valueOf(name)));
        }
        return request;
    }

    /**
     * Let {@code alias} stand for {@code requestId} when resolving, so a
     * client may answer with either the original call id or the id of the
     * confirmation call that announced it. Dropped once the request completes.
     */
    public void addAlias(String alias, String requestId) {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(requestId, "requestId");
        aliases.put(alias, requestId);
    }

    /** The alias registered for {@code requestId}, if any. */
    public Optional<String> aliasOf(String requestId) {
        return aliases.entrySet().stream()
                .filter(e -> e.getValue().equals(requestId))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    /**
     * Wait for the decision on {@code requestId} without blocking the caller.
     * The returned future completes with the resolved decision, or with a
     * timed-out denial once {@code timeout} elapses. Either way the pending
     * entry is gone by the time the future completes.
     */
    public CompletableFuture<ApprovalDecision> awaitDecision(String requestId, Duration timeout) {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(timeout, "timeout");
        PendingEntry entry = pending.get(requestId);
        if (entry == null) {
            log.warn("Await on unknown approval request, treating as denied", Map.of("requestId", requestId));
            return CompletableFuture.completedFuture(ApprovalDecision.deny("No pending approval request"));
        }
        if (!entry.awaited.compareAndSet(false, true)) {
            log.warn("Approval request is already being awaited", Map.of("requestId", requestId));
            return CompletableFuture.completedFuture(ApprovalDecision.deny("Approval request already awaited"));
        }

        ScheduledFuture<?> timer = entry.decision.isDone() ? null : scheduler.schedule(() -> {
            if (entry.decision.complete(ApprovalDecision.timeout(timeout))) {
                log.info("Approval wait timed out", Map.of(
                        "requestId", requestId, "outcome", "timeout", "timeoutMs", timeout.toMillis()));
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        return entry.decision.whenComplete((decision, err) -> {
            if (timer != null) {
                timer.cancel(false);
            }
            if (pending.remove(requestId, entry)) {
                aliases.values().removeIf(requestId::equals);
            }
        });
    }

    /**
     * Blocking form of {@link #awaitDecision}; suspends only the calling
     * thread.
     */
    public ApprovalDecision await(String requestId, Duration timeout) {
        return awaitDecision(requestId, timeout).join();
    }

    /**
     * Deliver a decision for {@code requestId}.
     *
     * @return true if the decision was accepted, false if there was no pending
     *         request or it was already decided
     */
    public boolean resolve(String requestId, ApprovalDecision decision) {
        Objects.requireNonNull(decision, "decision");
        PendingEntry entry = requestId != null ? pending.get(requestId) : null;
        if (entry == null && requestId != null && aliases.containsKey(requestId)) {
            requestId = aliases.get(requestId);
            entry = requestId != null ? pending.get(requestId) : null;
        }
        if (entry == null) {
            log.warn("Resolve for unknown approval request ignored", Map.of("requestId", String.valueOf(requestId)));
            return false;
        }
        boolean awaiting = entry.awaited.get();
        if (!entry.decision.complete(decision)) {
            log.warn("Approval request already decided, ignoring", Map.of("requestId", requestId));
            return false;
        }
        log.info(awaiting ? "Approval resolved" : "Approval resolved before await, buffered",
                Map.of("requestId", requestId, "outcome", decision.outcome()));
        return true;
    }

    // =========================================================================
    // Diagnostics
    // =========================================================================

    public int getPendingCount() {
        return pending.size();
    }

    /**
     * Snapshot of pending requests, oldest first.
     */
    public List<PendingApprovalRequest> getPendingRequests() {
        List<PendingApprovalRequest> snapshot = new ArrayList<>();
        for (PendingEntry entry : pending.values()) {
            snapshot.add(entry.request);
        }
        snapshot.sort(Comparator.comparingLong(PendingApprovalRequest::createdAtMs));
        return snapshot;
    }

    public boolean isPending(String requestId) {
        return requestId != null && pending.containsKey(requestId);
    }
}
