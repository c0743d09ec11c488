package com.adkstream.gateway.runtime;

import java.util.Map;

/**
 * Accepts a tool result produced outside the runtime and unblocks the tool
 * call waiting for it.
 */
public interface ToolResultSink {

    void resumeTool(String toolCallId, Map<String, Object> result);
}
