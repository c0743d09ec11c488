package com.adkstream.gateway.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One typed chunk of the UI stream protocol, or the terminal marker that
 * ends a turn.
 */
public record ProtocolChunk(String type, Map<String, Object> fields) {

    /** Type name of the terminal marker; never serialized as JSON. */
    public static final String DONE_TYPE = "[DONE]";
    public static final ProtocolChunk DONE = new ProtocolChunk(DONE_TYPE, Map.of());

    public ProtocolChunk {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public boolean isTerminator() {
        return DONE_TYPE.equals(type);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value != null ? value.toString() : null;
    }

    /**
     * JSON body: {@code type} first, then the fields in insertion order.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.putAll(fields);
        return map;
    }

    // =========================================================================
    // Factories
    // =========================================================================

    public static ProtocolChunk of(String type, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must be key/value pairs");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new ProtocolChunk(type, fields);
    }

    public static ProtocolChunk start(String messageId) {
        return of("start", "messageId", messageId);
    }

    public static ProtocolChunk textStart(String id) {
        return of("text-start", "id", id);
    }

    public static ProtocolChunk textDelta(String id, String delta) {
        return of("text-delta", "id", id, "delta", delta);
    }

    public static ProtocolChunk textEnd(String id) {
        return of("text-end", "id", id);
    }

    public static ProtocolChunk toolInputStart(String toolCallId, String toolName) {
        return of("tool-input-start", "toolCallId", toolCallId, "toolName", toolName);
    }

    public static ProtocolChunk toolInputAvailable(String toolCallId, String toolName, Object input) {
        return of("tool-input-available", "toolCallId", toolCallId, "toolName", toolName, "input", input);
    }

    public static ProtocolChunk toolApprovalRequest(String toolCallId, String approvalId) {
        return of("tool-approval-request", "toolCallId", toolCallId, "approvalId", approvalId);
    }

    public static ProtocolChunk toolOutputAvailable(String toolCallId, Object output) {
        return of("tool-output-available", "toolCallId", toolCallId, "output", output);
    }

    public static ProtocolChunk toolOutputError(String toolCallId, String errorText) {
        return of("tool-output-error", "toolCallId", toolCallId, "errorText", errorText);
    }

    public static ProtocolChunk error(String code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        return of("error", "error", error);
    }
}
