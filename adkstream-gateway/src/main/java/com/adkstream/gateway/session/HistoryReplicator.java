package com.adkstream.gateway.session;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Seeds a session with the history messages it has not seen yet, for example
 * after the client switches transports mid-conversation.
 * <p>
 * The last message of the list is the new, unanswered input and is never
 * replayed. Replays are idempotent: the session's replayed count records how
 * far a previous replay got.
 */
@Slf4j
public class HistoryReplicator {

    private final String agentName;

    public HistoryReplicator(String agentName) {
        this.agentName = agentName;
    }

    /**
     * @return number of messages replayed by this call
     */
    public int replayHistory(Session session, List<HistoryMessage> messages) {
        if (messages == null || messages.size() <= 1) {
            return 0;
        }
        int target = messages.size() - 1;
        synchronized (session) {
            int replayed = session.getReplayedCount();
            if (target <= replayed) {
                if (target < replayed) {
                    log.warn("History for {} is shorter than already replayed ({} < {}), ignoring",
                            session.getSessionId(), target, replayed);
                }
                return 0;
            }
            long now = System.currentTimeMillis();
            for (int i = replayed; i < target; i++) {
                HistoryMessage message = messages.get(i);
                String role = message.role() != null ? message.role() : HistoryMessage.ROLE_USER;
                String author = message.isUser() ? HistoryMessage.ROLE_USER : agentName;
                session.appendTurn(new TurnRecord("sync_" + i + "_" + role, author, role, message.text(), now));
            }
            session.setReplayedCount(target);
            log.info("Replayed {} message(s) into {}", target - replayed, session.getSessionId());
            return target - replayed;
        }
    }
}
