package com.adkstream.gateway.session;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime session backend.
 */
public class InMemorySessionBackend implements SessionBackend {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public CreateOrFetch create(Session candidate) {
        Session existing = sessions.putIfAbsent(candidate.getSessionId(), candidate);
        return existing == null
                ? new CreateOrFetch.Created(candidate)
                : new CreateOrFetch.Fetched(existing);
    }

    @Override
    public Optional<Session> fetch(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void clear() {
        sessions.clear();
    }
}
