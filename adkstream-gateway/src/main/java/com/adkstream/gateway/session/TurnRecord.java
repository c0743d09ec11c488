package com.adkstream.gateway.session;

/**
 * One conversation turn recorded in a session's history.
 */
public record TurnRecord(
        String invocationId,
        String author,
        String role,
        String text,
        long timestampMs) {
}
