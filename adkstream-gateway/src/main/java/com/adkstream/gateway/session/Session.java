package com.adkstream.gateway.session;

import com.adkstream.gateway.approval.ApprovalRegistry;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logical session for one connection identity. Holds the turn history, the
 * replay counter and the session's own approval registry.
 */
@Getter
public class Session {

    private final String sessionId;
    private final SessionIdentity identity;
    private final long createdAtMs;
    private final ApprovalRegistry approvals;
    private final Map<String, Object> state = new ConcurrentHashMap<>();

    // guarded by this
    private final List<TurnRecord> history = new ArrayList<>();
    private int replayedCount;

    public Session(String sessionId, SessionIdentity identity, ApprovalRegistry approvals) {
        this.sessionId = sessionId;
        this.identity = identity;
        this.approvals = approvals;
        this.createdAtMs = System.currentTimeMillis();
    }

    public synchronized List<TurnRecord> getHistory() {
        return List.copyOf(history);
    }

    public synchronized int getReplayedCount() {
        return replayedCount;
    }

    public synchronized void appendTurn(TurnRecord turn) {
        history.add(turn);
    }

    synchronized void setReplayedCount(int replayedCount) {
        this.replayedCount = replayedCount;
    }
}
