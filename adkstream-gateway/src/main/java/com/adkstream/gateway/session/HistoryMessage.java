package com.adkstream.gateway.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * A message from the client's conversation history, in UI message form.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryMessage(String id, String role, List<Map<String, Object>> parts, String content) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public HistoryMessage {
        parts = parts != null ? parts : List.of();
    }

    public static HistoryMessage text(String id, String role, String text) {
        return new HistoryMessage(id, role, List.of(Map.of("type", "text", "text", text)), null);
    }

    public boolean isUser() {
        return ROLE_USER.equals(role);
    }

    /**
     * Concatenated text parts, or the legacy {@code content} string when the
     * message has no parts.
     */
    public String text() {
        if (parts.isEmpty()) {
            return content != null ? content : "";
        }
        StringBuilder sb = new StringBuilder();
        for (Map<String, Object> part : parts) {
            if ("text".equals(part.get("type")) && part.get("text") != null) {
                sb.append(part.get("text"));
            }
        }
        return sb.toString();
    }
}
