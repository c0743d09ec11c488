package com.adkstream.gateway.approval;

import com.adkstream.gateway.runtime.ToolResult;
import com.adkstream.gateway.runtime.ToolResultSink;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Tools the client executes (location lookup, media playback). The runtime
 * waits on {@link #awaitResult}; the client's result arrives through
 * {@link #resumeTool}. A result that arrives before the wait is kept for a
 * bounded time, and at most {@link #MAX_EARLY_RESULTS} of them are held.
 */
@Slf4j
public class FrontendToolDelegate implements ToolResultSink {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /** Prefix the client adds to ids of confirmation-related results. */
    static final String CONFIRMATION_PREFIX = "confirmation-";

    static final int MAX_EARLY_RESULTS = 256;

    private final Map<String, CompletableFuture<ToolResult>> slots = new ConcurrentHashMap<>();
    private final Cache<String, ToolResult> earlyResults;
    private final ScheduledExecutorService scheduler;
    private final Object lock = new Object();

    public FrontendToolDelegate(ScheduledExecutorService scheduler) {
        this(scheduler, DEFAULT_TIMEOUT);
    }

    /**
     * @param earlyResultTtl how long a result delivered before its wait is kept
     */
    public FrontendToolDelegate(ScheduledExecutorService scheduler, Duration earlyResultTtl) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.earlyResults = Caffeine.newBuilder()
                .expireAfterWrite(earlyResultTtl)
                .maximumSize(MAX_EARLY_RESULTS)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Wait for the client's result for {@code toolCallId}. Completes with an
     * error result when {@code timeout} elapses first.
     */
    public CompletableFuture<ToolResult> awaitResult(String toolCallId, Duration timeout) {
        String id = normalizeId(toolCallId);
        CompletableFuture<ToolResult> slot;
        synchronized (lock) {
            slot = slots.computeIfAbsent(id, k -> new CompletableFuture<>());
            ToolResult early = earlyResults.asMap().remove(id);
            if (early != null && slot.complete(early)) {
                log.debug("Using result delivered before the wait for {}", id);
            }
        }
        ScheduledFuture<?> timer = slot.isDone() ? null : scheduler.schedule(() -> {
            if (slot.complete(ToolResult.error(
                    "Frontend tool execution timed out after " + timeout.toMillis() + "ms"))) {
                log.warn("Frontend tool {} timed out", id);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        return slot.whenComplete((result, err) -> {
            if (timer != null) {
                timer.cancel(false);
            }
            slots.remove(id, slot);
        });
    }

    @Override
    public void resumeTool(String toolCallId, Map<String, Object> result) {
        if (toolCallId == null) {
            log.warn("Frontend tool result without a tool call id ignored");
            return;
        }
        String id = normalizeId(toolCallId);
        ToolResult value = ToolResult.ok(result != null ? result : Map.of());
        CompletableFuture<ToolResult> slot;
        synchronized (lock) {
            slot = slots.get(id);
            if (slot == null) {
                if (earlyResults.asMap().putIfAbsent(id, value) == null) {
                    log.debug("Buffered frontend tool result for {} ahead of its wait", id);
                } else {
                    log.warn("Frontend tool {} already has a buffered result, ignoring", id);
                }
                return;
            }
        }
        if (slot.complete(value)) {
            log.info("Resolved frontend tool result for {}", id);
        } else {
            log.warn("Frontend tool {} already has a result, ignoring", id);
        }
    }

    /** Waits currently in progress. */
    public int getPendingCount() {
        return slots.size();
    }

    /** Results held for a wait that has not started yet. */
    public long getBufferedCount() {
        earlyResults.cleanUp();
        return earlyResults.estimatedSize();
    }

    static String normalizeId(String toolCallId) {
        return toolCallId.startsWith(CONFIRMATION_PREFIX)
                ? toolCallId.substring(CONFIRMATION_PREFIX.length())
                : toolCallId;
    }
}
