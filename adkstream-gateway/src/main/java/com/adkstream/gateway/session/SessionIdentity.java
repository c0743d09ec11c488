package com.adkstream.gateway.session;

import java.util.Objects;

/**
 * Identity of a logical connection: a subject plus an optional connection
 * signature.
 */
public record SessionIdentity(String subject, String connectionSignature) {

    public SessionIdentity {
        Objects.requireNonNull(subject, "subject");
        if (connectionSignature != null && connectionSignature.isBlank()) {
            connectionSignature = null;
        }
    }

    /**
     * Deterministic session id. Without a signature the subject gets one
     * session per application.
     */
    public String sessionId(String appName) {
        return connectionSignature != null
                ? "session_" + subject + "_" + connectionSignature
                : "session_" + subject + "_" + appName;
    }
}
