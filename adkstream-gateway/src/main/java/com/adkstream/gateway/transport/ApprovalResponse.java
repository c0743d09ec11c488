package com.adkstream.gateway.transport;

import com.adkstream.gateway.approval.ApprovalDecision;

/**
 * A decision found in a client message.
 *
 * @param approvalId id of the approval request, usually the confirmation
 *                   call id
 * @param toolCallId id of the gated tool call, when the client sent it
 */
public record ApprovalResponse(String approvalId, String toolCallId, boolean approved, String reason) {

    public ApprovalDecision toDecision() {
        return approved ? ApprovalDecision.approve(reason) : ApprovalDecision.deny(reason);
    }
}
