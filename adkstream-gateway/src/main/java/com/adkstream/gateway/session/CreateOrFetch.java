package com.adkstream.gateway.session;

/**
 * Result of resolving a session identity: either this call created the
 * session or it already existed.
 */
public sealed interface CreateOrFetch permits CreateOrFetch.Created, CreateOrFetch.Fetched {

    Session session();

    default boolean created() {
        return this instanceof Created;
    }

    record Created(Session session) implements CreateOrFetch {
    }

    record Fetched(Session session) implements CreateOrFetch {
    }
}
