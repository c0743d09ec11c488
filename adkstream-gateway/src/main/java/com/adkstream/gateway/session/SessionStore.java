package com.adkstream.gateway.session;

import com.adkstream.gateway.approval.ApprovalRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-memory session store with single-flight creation per identity.
 * <p>
 * The first caller for an identity creates the session through the
 * {@link SessionBackend}; concurrent callers for the same identity wait for
 * that creation and receive the same object.
 */
@Slf4j
public class SessionStore {

    private final Map<String, CompletableFuture<Session>> sessions = new ConcurrentHashMap<>();
    private final SessionBackend backend;
    private final String appName;
    private final Supplier<ApprovalRegistry> approvalRegistryFactory;

    public SessionStore(SessionBackend backend, String appName, Supplier<ApprovalRegistry> approvalRegistryFactory) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.appName = Objects.requireNonNull(appName, "appName");
        this.approvalRegistryFactory = Objects.requireNonNull(approvalRegistryFactory, "approvalRegistryFactory");
    }

    /**
     * Resolve the session for {@code (subject, connectionSignature)}, creating
     * it on first use.
     *
     * @param connectionSignature may be null
     */
    public CreateOrFetch getOrCreate(String subject, String connectionSignature) {
        SessionIdentity identity = new SessionIdentity(subject, connectionSignature);
        String sessionId = identity.sessionId(appName);

        CompletableFuture<Session> slot = new CompletableFuture<>();
        CompletableFuture<Session> inFlight = sessions.putIfAbsent(sessionId, slot);
        if (inFlight != null) {
            return new CreateOrFetch.Fetched(join(inFlight));
        }

        try {
            CreateOrFetch result = backend.create(
                    new Session(sessionId, identity, approvalRegistryFactory.get()));
            slot.complete(result.session());
            if (result.created()) {
                log.info("Session created: {}", sessionId);
            } else {
                log.debug("Session already existed in backend: {}", sessionId);
            }
            return result;
        } catch (RuntimeException e) {
            // Clear the slot so a later call can retry.
            sessions.remove(sessionId, slot);
            slot.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Retrieve a created session by id.
     */
    public Optional<Session> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        CompletableFuture<Session> future = sessions.get(sessionId);
        if (future == null) {
            return backend.fetch(sessionId);
        }
        if (!future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    public List<Session> list() {
        List<Session> result = new ArrayList<>();
        for (CompletableFuture<Session> future : sessions.values()) {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                result.add(future.join());
            }
        }
        return result;
    }

    public int size() {
        return list().size();
    }

    /**
     * Drop every session. For tests and operational resets.
     */
    public void clear() {
        int count = sessions.size();
        sessions.clear();
        backend.clear();
        log.info("Cleared {} session(s)", count);
    }

    public String getAppName() {
        return appName;
    }

    private static Session join(CompletableFuture<Session> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
