package com.adkstream.gateway.runtime;

import java.util.Map;

/**
 * Result of a tool executed outside the runtime, for example in the browser.
 */
public sealed interface ToolResult permits ToolResult.Ok, ToolResult.Err {

    static ToolResult ok(Map<String, Object> value) {
        return new Ok(value);
    }

    static ToolResult error(String message) {
        return new Err(message);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    record Ok(Map<String, Object> value) implements ToolResult {
    }

    record Err(String message) implements ToolResult {
    }
}
