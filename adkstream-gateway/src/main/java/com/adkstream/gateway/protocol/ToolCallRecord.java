package com.adkstream.gateway.protocol;

import lombok.Getter;

import java.util.Map;

/**
 * Per-turn tracking of one tool call seen by the converter.
 */
@Getter
public final class ToolCallRecord {

    public enum State {
        ANNOUNCED,
        INPUT_AVAILABLE,
        APPROVAL_REQUESTED,
        OUTPUT_AVAILABLE,
        OUTPUT_ERROR
    }

    private final String toolCallId;
    private final String toolName;
    /** True for the runtime's confirmation tool, which is never surfaced. */
    private final boolean internal;
    /** For an internal confirmation call, the id of the call it gates. */
    private final String originalToolCallId;
    private Map<String, Object> args = Map.of();
    private State state = State.ANNOUNCED;

    ToolCallRecord(String toolCallId, String toolName, boolean internal, String originalToolCallId) {
        this.toolCallId = toolCallId;
        this.toolName = toolName;
        this.internal = internal;
        this.originalToolCallId = originalToolCallId;
    }

    void inputAvailable(Map<String, Object> args) {
        this.args = args;
        this.state = State.INPUT_AVAILABLE;
    }

    void transition(State next) {
        this.state = next;
    }

    public boolean hasOutput() {
        return state == State.OUTPUT_AVAILABLE || state == State.OUTPUT_ERROR;
    }
}
