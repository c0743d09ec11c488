package com.adkstream.gateway.approval;

import com.adkstream.gateway.protocol.RuntimeEvent;
import com.adkstream.common.logging.SubsystemLogger;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runtime-side helper for a tool that must not run without a human decision.
 * <p>
 * The gate registers the request first, then announces the original call and
 * the internal confirmation call, so a decision can never arrive for an
 * unknown id. It then suspends the calling tool task until the decision or
 * the deadline and turns the outcome into the tool's response.
 */
public class ToolApprovalGate {

    private static final SubsystemLogger log = SubsystemLogger.create("approval").child("gate");

    private final ApprovalRegistry registry;
    private final String confirmationToolName;
    private final Duration timeout;

    public ToolApprovalGate(ApprovalRegistry registry, String confirmationToolName, Duration timeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.confirmationToolName = Objects.requireNonNull(confirmationToolName, "confirmationToolName");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Run {@code tool} once approved.
     *
     * @param toolCallId id of the original tool call
     * @param events     sink for the events this call produces, in order
     * @param tool       executes the tool with its args after approval
     * @return the response reported for the original call
     */
    public RuntimeEvent.FunctionResponse execute(String toolCallId, String toolName, Map<String, Object> args,
            Consumer<RuntimeEvent> events, Function<Map<String, Object>, Map<String, Object>> tool) {
        registry.register(toolCallId, toolName, args);

        Map<String, Object> originalCall = new LinkedHashMap<>();
        originalCall.put("id", toolCallId);
        originalCall.put("name", toolName);
        originalCall.put("args", args);
        String confirmationId = "confirmation-" + UUID.randomUUID();
        registry.addAlias(confirmationId, toolCallId);

        events.accept(RuntimeEvent.functionCall(toolCallId, toolName, args));
        events.accept(RuntimeEvent.functionCall(confirmationId, confirmationToolName,
                Map.of("originalFunctionCall", originalCall)));

        ApprovalDecision decision = registry.await(toolCallId, timeout);
        RuntimeEvent.FunctionResponse response = new RuntimeEvent.FunctionResponse(
                toolCallId, toolName, responseFor(toolName, args, decision, tool));
        events.accept(response);
        return response;
    }

    private Map<String, Object> responseFor(String toolName, Map<String, Object> args, ApprovalDecision decision,
            Function<Map<String, Object>, Map<String, Object>> tool) {
        if (decision.approved()) {
            log.info("Tool approved, executing", Map.of("tool", toolName));
            return tool.apply(args);
        }
        Map<String, Object> denied = new LinkedHashMap<>();
        denied.put("success", false);
        if (decision.timedOut()) {
            log.info("Tool not executed: approval timed out", Map.of("tool", toolName));
            denied.put("error", toolName + " approval timed out");
        } else {
            log.info("Tool not executed: rejected by user", Map.of("tool", toolName));
            denied.put("error", toolName + " rejected by user");
        }
        if (decision.reason() != null) {
            denied.put("reason", decision.reason());
        }
        return denied;
    }
}
