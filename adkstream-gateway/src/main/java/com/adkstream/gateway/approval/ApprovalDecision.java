package com.adkstream.gateway.approval;

import java.time.Duration;

/**
 * Outcome of an approval wait. A timeout is a denial that also reports its
 * cause.
 */
public record ApprovalDecision(boolean approved, String reason, boolean timedOut) {

    public static ApprovalDecision approve(String reason) {
        return new ApprovalDecision(true, reason, false);
    }

    public static ApprovalDecision deny(String reason) {
        return new ApprovalDecision(false, reason, false);
    }

    public static ApprovalDecision timeout(Duration waited) {
        String elapsed = waited.toMillis() < 1000
                ? waited.toMillis() + "ms"
                : waited.toSeconds() + "s";
        return new ApprovalDecision(false, "Approval timed out after " + elapsed, true);
    }

    /** Outcome label used in logs: approved, denied or timeout. */
    public String outcome() {
        if (approved) {
            return "approved";
        }
        return timedOut ? "timeout" : "denied";
    }
}
