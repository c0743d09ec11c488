package com.adkstream.app.runtime;

import com.adkstream.common.config.ConfigService;
import com.adkstream.common.config.StreamConfig;
import com.adkstream.gateway.approval.FrontendToolDelegate;
import com.adkstream.gateway.approval.ToolApprovalGate;
import com.adkstream.gateway.protocol.RuntimeEvent;
import com.adkstream.gateway.runtime.AgentRuntime;
import com.adkstream.gateway.runtime.ToolResult;
import com.adkstream.gateway.runtime.TurnRequest;
import com.adkstream.gateway.session.Session;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scripted runtime that exercises every path of the protocol without a model.
 * It keeps no memory of its own; session history comes from client replay.
 * <ul>
 * <li>"pay 20 to bob" calls {@code process_payment}, which needs approval</li>
 * <li>"where am i" calls {@code get_location}, which the client executes</li>
 * <li>anything else is echoed back as streamed text</li>
 * </ul>
 */
@Slf4j
public class DemoAgentRuntime implements AgentRuntime {

    public static final String PAYMENT_TOOL = "process_payment";
    public static final String LOCATION_TOOL = "get_location";

    private static final Pattern PAYMENT = Pattern.compile(
            "(?i)\\bpay\\s+(\\d+(?:\\.\\d+)?)\\s+to\\s+([\\w-]+)");
    private static final Pattern LOCATION = Pattern.compile("(?i)\\bwhere am i\\b");

    private final ConfigService configService;
    private final FrontendToolDelegate frontendTools;
    private final ExecutorService executor;

    public DemoAgentRuntime(ConfigService configService, FrontendToolDelegate frontendTools,
            ExecutorService executor) {
        this.configService = configService;
        this.frontendTools = frontendTools;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> runTurn(TurnRequest request, Consumer<RuntimeEvent> events) {
        return CompletableFuture.runAsync(() -> play(request, events), executor);
    }

    @Override
    public void sendRealtime(Session session, String mimeType, byte[] data) {
        log.debug("Realtime input for {}: {} ({} bytes)", session.getSessionId(), mimeType, data.length);
    }

    private void play(TurnRequest request, Consumer<RuntimeEvent> events) {
        Session session = request.session();
        String text = request.userText().trim();
        StreamConfig config = configService.loadConfig();

        String reply;
        Matcher payment = PAYMENT.matcher(text);
        if (payment.find()) {
            reply = pay(session, config, payment.group(1), payment.group(2), events);
        } else if (LOCATION.matcher(text).find()) {
            reply = locate(config, events);
        } else {
            reply = "You said: " + text;
        }

        int completionTokens = streamText(reply, events);
        int promptTokens = text.isEmpty() ? 0 : text.split("\\s+").length;
        events.accept(RuntimeEvent.Metadata.usage(promptTokens, completionTokens, promptTokens + completionTokens));
        events.accept(RuntimeEvent.Metadata.finishReason("STOP"));
        events.accept(RuntimeEvent.turnComplete());
    }

    private String pay(Session session, StreamConfig config, String amount, String recipient,
            Consumer<RuntimeEvent> events) {
        String toolCallId = "call-" + UUID.randomUUID();
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("amount", Double.parseDouble(amount));
        args.put("recipient", recipient);

        events.accept(new RuntimeEvent.FunctionCallStarted(toolCallId, PAYMENT_TOOL));
        ToolApprovalGate gate = new ToolApprovalGate(session.getApprovals(), config.getConfirmationToolName(),
                Duration.ofMillis(config.getApproval().getExecutionTimeoutMs()));
        RuntimeEvent.FunctionResponse response = gate.execute(toolCallId, PAYMENT_TOOL, args, events,
                DemoAgentRuntime::processPayment);

        session.getState().put("approval." + toolCallId, response.response());
        if (Boolean.TRUE.equals(response.response().get("success"))) {
            return "Sent " + amount + " to " + recipient + ".";
        }
        return "The payment was not made: " + response.response().get("error") + ".";
    }

    private String locate(StreamConfig config, Consumer<RuntimeEvent> events) {
        String toolCallId = "call-" + UUID.randomUUID();
        events.accept(RuntimeEvent.functionCall(toolCallId, LOCATION_TOOL, Map.of()));

        ToolResult result = frontendTools
                .awaitResult(toolCallId, Duration.ofMillis(config.getApproval().getFrontendToolTimeoutMs()))
                .join();
        if (result instanceof ToolResult.Ok ok) {
            events.accept(RuntimeEvent.functionResponse(toolCallId, LOCATION_TOOL, ok.value()));
            return "Your location: " + ok.value();
        }
        String message = ((ToolResult.Err) result).message();
        events.accept(RuntimeEvent.functionResponse(toolCallId, LOCATION_TOOL, Map.of("error", message)));
        return "I could not get your location: " + message;
    }

    static Map<String, Object> processPayment(Map<String, Object> args) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("transactionId", "txn-" + UUID.randomUUID());
        result.put("amount", args.get("amount"));
        result.put("recipient", args.get("recipient"));
        return result;
    }

    /**
     * @return number of deltas emitted
     */
    private static int streamText(String reply, Consumer<RuntimeEvent> events) {
        String[] words = reply.split(" ");
        for (int i = 0; i < words.length; i++) {
            events.accept(RuntimeEvent.text(i == 0 ? words[i] : " " + words[i]));
        }
        return words.length;
    }
}
