package com.adkstream.gateway.session;

import java.util.Optional;

/**
 * Where sessions are created. An identity that already exists here yields
 * {@link CreateOrFetch.Fetched} with the existing session, never an error.
 */
public interface SessionBackend {

    CreateOrFetch create(Session candidate);

    Optional<Session> fetch(String sessionId);

    void clear();
}
