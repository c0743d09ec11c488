package com.adkstream.gateway.runtime;

import com.adkstream.gateway.session.HistoryMessage;
import com.adkstream.gateway.session.Session;

import java.util.List;
import java.util.Objects;

/**
 * Input for one turn: the session and the new user text, plus the client's
 * full message list for context.
 */
public record TurnRequest(Session session, String userText, List<HistoryMessage> messages) {

    public TurnRequest {
        Objects.requireNonNull(session, "session");
        userText = userText != null ? userText : "";
        messages = messages != null ? List.copyOf(messages) : List.of();
    }
}
