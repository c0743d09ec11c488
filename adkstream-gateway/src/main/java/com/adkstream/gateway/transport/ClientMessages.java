package com.adkstream.gateway.transport;

import com.adkstream.gateway.session.HistoryMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads approval decisions out of UI messages.
 * <p>
 * Two forms are accepted: a tool part in state {@code approval-responded}
 * carrying {@code approval{id,approved,reason}}, and an output of the
 * internal confirmation tool carrying {@code approved} or {@code confirmed}.
 */
public final class ClientMessages {

    static final String STATE_APPROVAL_RESPONDED = "approval-responded";
    static final String STATE_OUTPUT_AVAILABLE = "output-available";

    private ClientMessages() {
    }

    public static List<ApprovalResponse> approvalResponses(HistoryMessage message, String confirmationToolName) {
        List<ApprovalResponse> responses = new ArrayList<>();
        if (message == null) {
            return responses;
        }
        String confirmationPartType = "tool-" + confirmationToolName;
        for (Map<String, Object> part : message.parts()) {
            Object state = part.get("state");
            String toolCallId = asString(part.get("toolCallId"));

            if (STATE_APPROVAL_RESPONDED.equals(state) && part.get("approval") instanceof Map<?, ?> approval) {
                Object approved = approval.get("approved");
                if (approved instanceof Boolean flag) {
                    responses.add(new ApprovalResponse(asString(approval.get("id")), toolCallId,
                            flag, asString(approval.get("reason"))));
                }
            } else if (confirmationPartType.equals(part.get("type"))
                    && STATE_OUTPUT_AVAILABLE.equals(state)
                    && part.get("output") instanceof Map<?, ?> output) {
                Object approved = output.containsKey("approved") ? output.get("approved") : output.get("confirmed");
                responses.add(new ApprovalResponse(toolCallId, null,
                        Boolean.TRUE.equals(approved), asString(output.get("reason"))));
            }
        }
        return responses;
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
