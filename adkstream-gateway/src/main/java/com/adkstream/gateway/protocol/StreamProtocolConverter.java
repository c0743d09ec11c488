package com.adkstream.gateway.protocol;

import com.adkstream.common.config.StreamConfig;
import com.adkstream.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns runtime events into ordered protocol chunks, one event at a time.
 * <p>
 * The converter is Idle until the first event of a turn, which emits
 * {@code start} with a fresh message id. While Active it translates each
 * event, and a turn completion or fatal error emits the closing chunks
 * followed by exactly one terminal marker. The runtime's internal
 * confirmation tool never appears as a tool call; it becomes a single
 * {@code tool-approval-request} naming the call it gates.
 * <p>
 * Instances are not thread-safe: one processing context owns a converter.
 */
@Slf4j
public class StreamProtocolConverter {

    public static final String DEFAULT_CONFIRMATION_TOOL = "adk_request_confirmation";

    /** Placeholder error the runtime reports for a call that waits on confirmation. */
    static final String CONFIRMATION_PENDING_ERROR =
            "This tool call requires confirmation, please approve or reject.";

    static final int DEFAULT_PCM_SAMPLE_RATE = 24_000;

    private final String confirmationToolName;
    private final String agentModel;
    private final Supplier<String> messageIdGenerator;

    /** Null while Idle. */
    private Turn turn;
    private MetadataAccumulator metadata = new MetadataAccumulator();

    public StreamProtocolConverter() {
        this(builder());
    }

    private StreamProtocolConverter(Builder builder) {
        this.confirmationToolName = builder.confirmationToolName;
        this.agentModel = builder.agentModel;
        this.messageIdGenerator = builder.messageIdGenerator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StreamProtocolConverter fromConfig(StreamConfig config) {
        return builder()
                .confirmationToolName(config.getConfirmationToolName())
                .agentModel(config.getAgentModel())
                .build();
    }

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Translate one runtime event.
     *
     * @return the chunks to send, in order; possibly empty
     */
    public List<ProtocolChunk> convert(RuntimeEvent event) {
        Objects.requireNonNull(event, "event");
        List<ProtocolChunk> out = new ArrayList<>();

        if (event instanceof RuntimeEvent.RuntimeError error) {
            log.error("Runtime reported error: {} - {}", error.code(), error.message());
            terminate(ProtocolChunk.error(
                    error.code() != null ? error.code() : "RUNTIME_ERROR",
                    error.message() != null ? error.message() : "Unknown error"), out);
            return out;
        }
        if (event instanceof RuntimeEvent.Metadata update) {
            metadata.merge(update);
            return out;
        }

        Turn active = beginTurnIfIdle(out);

        if (event instanceof RuntimeEvent.TextDelta delta) {
            processTextDelta(active, delta, out);
        } else if (event instanceof RuntimeEvent.Thought thought) {
            processThought(active, thought, out);
        } else if (event instanceof RuntimeEvent.FunctionCallStarted started) {
            processFunctionCallStarted(active, started, out);
        } else if (event instanceof RuntimeEvent.FunctionCall call) {
            processFunctionCall(active, call, out);
        } else if (event instanceof RuntimeEvent.FunctionResponse response) {
            processFunctionResponse(active, response, out);
        } else if (event instanceof RuntimeEvent.ExecutableCode code) {
            out.add(ProtocolChunk.of("data-executable-code",
                    "data", mapOf("language", code.language(), "code", code.code())));
        } else if (event instanceof RuntimeEvent.CodeExecutionResult result) {
            out.add(ProtocolChunk.of("data-code-execution-result",
                    "data", mapOf("outcome", result.outcome(), "output", result.output())));
        } else if (event instanceof RuntimeEvent.InlineData data) {
            processInlineData(active, data, out);
        } else if (event instanceof RuntimeEvent.TurnComplete) {
            processTurnComplete(active, out);
        }
        return out;
    }

    /**
     * The runtime's event stream ended normally. Finalises an Active turn,
     * including one whose completion was held for an approval.
     */
    public List<ProtocolChunk> complete() {
        List<ProtocolChunk> out = new ArrayList<>();
        if (turn != null) {
            if (!turn.awaitingApproval.isEmpty()) {
                log.warn("Stream ended with approvals outstanding for {}", turn.awaitingApproval);
            }
            finalizeTurn(out);
        }
        return out;
    }

    /**
     * The runtime's event stream failed. Emits an error chunk and the
     * terminal marker.
     */
    public List<ProtocolChunk> fail(Throwable error) {
        List<ProtocolChunk> out = new ArrayList<>();
        String message = ErrorUtils.formatErrorMessage(error);
        log.error("Event stream failed: {}", message, error);
        terminate(ProtocolChunk.error("STREAM_FAILURE", message), out);
        return out;
    }

    public boolean isActive() {
        return turn != null;
    }

    public Optional<String> getCurrentMessageId() {
        return turn != null ? Optional.of(turn.messageId) : Optional.empty();
    }

    public Optional<ToolCallRecord> getToolCall(String toolCallId) {
        return turn != null ? Optional.ofNullable(turn.toolCalls.get(toolCallId)) : Optional.empty();
    }

    /**
     * True while a turn completion is held back for an outstanding approval.
     */
    public boolean isCompletionHeld() {
        return turn != null && turn.completionHeld;
    }

    // =========================================================================
    // Turn lifecycle
    // =========================================================================

    private Turn beginTurnIfIdle(List<ProtocolChunk> out) {
        if (turn == null) {
            turn = new Turn(messageIdGenerator.get());
            log.debug("Turn started: {}", turn.messageId);
            out.add(ProtocolChunk.start(turn.messageId));
        }
        return turn;
    }

    private void processTurnComplete(Turn active, List<ProtocolChunk> out) {
        if (!active.awaitingApproval.isEmpty()) {
            active.completionHeld = true;
            log.info("Holding turn completion for {}: approval outstanding for {}",
                    active.messageId, active.awaitingApproval);
            return;
        }
        finalizeTurn(out);
    }

    private void finalizeTurn(List<ProtocolChunk> out) {
        Turn active = turn;
        for (TextBlock block : active.blocks.values()) {
            if (block.open) {
                out.add(ProtocolChunk.textEnd(block.id));
                block.open = false;
            }
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("finishReason", FinishReasons.map(metadata.finishReason));
        Map<String, Object> messageMetadata = buildMessageMetadata(active);
        if (!messageMetadata.isEmpty()) {
            fields.put("messageMetadata", messageMetadata);
        }
        out.add(new ProtocolChunk("finish", fields));
        out.add(ProtocolChunk.DONE);
        log.debug("Turn finished: {}", active.messageId);
        reset();
    }

    private void terminate(ProtocolChunk error, List<ProtocolChunk> out) {
        out.add(error);
        out.add(ProtocolChunk.DONE);
        reset();
    }

    private void reset() {
        turn = null;
        metadata = new MetadataAccumulator();
    }

    // =========================================================================
    // Text
    // =========================================================================

    private void processTextDelta(Turn active, RuntimeEvent.TextDelta delta, List<ProtocolChunk> out) {
        TextBlock block = active.blocks.computeIfAbsent(delta.channel(),
                channel -> new TextBlock(channel.blockId(active.messageId)));
        String text = delta.text();

        if (text == null || text.isEmpty()) {
            if (delta.finished() && block.open) {
                out.add(ProtocolChunk.textEnd(block.id));
                block.open = false;
            }
            return;
        }

        if (delta.channel() == TextChannel.OUTPUT) {
            if (active.repeatsReasoning(text)) {
                log.debug("Dropping output text that repeats reasoning ({} chars)", text.length());
                return;
            }
            // A finished delta carrying the whole block again is a summary, not new text.
            if (delta.finished() && block.accumulated.length() > 0
                    && text.contentEquals(block.accumulated)) {
                if (block.open) {
                    out.add(ProtocolChunk.textEnd(block.id));
                    block.open = false;
                }
                return;
            }
        }

        if (!block.open) {
            out.add(ProtocolChunk.textStart(block.id));
            block.open = true;
        }
        out.add(ProtocolChunk.textDelta(block.id, text));
        block.accumulated.append(text);
        if (delta.finished()) {
            out.add(ProtocolChunk.textEnd(block.id));
            block.open = false;
        }
    }

    private void processThought(Turn active, RuntimeEvent.Thought thought, List<ProtocolChunk> out) {
        if (thought.text() == null || thought.text().isEmpty()) {
            return;
        }
        active.reasoningTexts.add(thought.text());
        String partId = active.messageId + "_reasoning_" + active.reasoningCounter++;
        out.add(ProtocolChunk.of("reasoning-start", "id", partId));
        out.add(ProtocolChunk.of("reasoning-delta", "id", partId, "delta", thought.text()));
        out.add(ProtocolChunk.of("reasoning-end", "id", partId));
    }

    // =========================================================================
    // Tools
    // =========================================================================

    private void processFunctionCallStarted(Turn active, RuntimeEvent.FunctionCallStarted started,
            List<ProtocolChunk> out) {
        if (started.id() == null) {
            log.warn("Tool call {} announced without an id, skipping", started.name());
            return;
        }
        if (isConfirmationTool(started.name())) {
            log.debug("Confirmation call {} announced", started.id());
            return;
        }
        if (active.toolCalls.containsKey(started.id())) {
            return;
        }
        active.toolCalls.put(started.id(), new ToolCallRecord(started.id(), started.name(), false, null));
        out.add(ProtocolChunk.toolInputStart(started.id(), started.name()));
    }

    private void processFunctionCall(Turn active, RuntimeEvent.FunctionCall call, List<ProtocolChunk> out) {
        if (isConfirmationTool(call.name())) {
            processConfirmationCall(active, call, out);
            return;
        }
        if (call.id() == null) {
            log.warn("Tool call {} has no id, skipping", call.name());
            return;
        }
        ToolCallRecord record = active.toolCalls.get(call.id());
        if (record == null) {
            record = new ToolCallRecord(call.id(), call.name(), false, null);
            active.toolCalls.put(call.id(), record);
            out.add(ProtocolChunk.toolInputStart(call.id(), call.name()));
        } else if (record.getState() != ToolCallRecord.State.ANNOUNCED) {
            log.debug("Duplicate tool call {} ignored", call.id());
            return;
        }
        log.debug("Tool call {}(id={}) input available", call.name(), call.id());
        record.inputAvailable(call.args());
        out.add(ProtocolChunk.toolInputAvailable(call.id(), call.name(), call.args()));
    }

    private void processConfirmationCall(Turn active, RuntimeEvent.FunctionCall call, List<ProtocolChunk> out) {
        if (call.id() == null) {
            log.error("Confirmation call has no id, cannot request approval");
            return;
        }
        if (active.toolCalls.containsKey(call.id())) {
            log.debug("Duplicate confirmation call {} ignored", call.id());
            return;
        }
        String originalId = originalCallId(call.args());
        if (originalId == null) {
            log.warn("Confirmation call {} does not name the call it gates, using its own id", call.id());
            originalId = call.id();
        }
        ToolCallRecord record = new ToolCallRecord(call.id(), call.name(), true, originalId);
        record.inputAvailable(call.args());
        record.transition(ToolCallRecord.State.APPROVAL_REQUESTED);
        active.toolCalls.put(call.id(), record);

        ToolCallRecord original = active.toolCalls.get(originalId);
        if (original != null && !original.hasOutput()) {
            original.transition(ToolCallRecord.State.APPROVAL_REQUESTED);
        }
        active.awaitingApproval.add(originalId);
        log.info("Approval requested for tool call {} (approvalId={})", originalId, call.id());
        out.add(ProtocolChunk.toolApprovalRequest(originalId, call.id()));
    }

    private static String originalCallId(Map<String, Object> args) {
        Object original = args.get("originalFunctionCall");
        if (original instanceof Map<?, ?> map) {
            Object id = map.get("id");
            return id != null ? id.toString() : null;
        }
        return null;
    }

    private void processFunctionResponse(Turn active, RuntimeEvent.FunctionResponse response,
            List<ProtocolChunk> out) {
        if (response.name() == null) {
            log.warn("Tool response without a tool name, skipping");
            return;
        }
        if (isConfirmationTool(response.name())) {
            log.debug("Confirmation response {} kept internal", response.id());
            return;
        }
        if (response.id() == null) {
            log.warn("Tool response for {} has no id, skipping", response.name());
            return;
        }

        Map<String, Object> output = response.response();
        String errorText = errorText(output);
        if (CONFIRMATION_PENDING_ERROR.equals(errorText)) {
            log.info("Suppressing confirmation placeholder for {}", response.name());
            return;
        }

        ToolCallRecord record = active.toolCalls.get(response.id());
        active.awaitingApproval.remove(response.id());
        if (errorText != null) {
            log.warn("Tool {} failed: {}", response.name(), errorText);
            out.add(ProtocolChunk.toolOutputError(response.id(), errorText));
            if (record != null) {
                record.transition(ToolCallRecord.State.OUTPUT_ERROR);
            }
        } else {
            out.add(ProtocolChunk.toolOutputAvailable(response.id(), output));
            if (record != null) {
                record.transition(ToolCallRecord.State.OUTPUT_AVAILABLE);
            }
        }
    }

    /**
     * @return the error text when the tool response reports a failure, else null
     */
    private static String errorText(Map<String, Object> output) {
        if (output == null) {
            return null;
        }
        boolean failed = Boolean.FALSE.equals(output.get("success"))
                || (output.containsKey("error") && output.get("result") == null);
        if (!failed) {
            return null;
        }
        Object error = output.get("error");
        return error != null ? error.toString() : "Unknown tool error";
    }

    private boolean isConfirmationTool(String name) {
        return confirmationToolName.equals(name);
    }

    // =========================================================================
    // Inline data
    // =========================================================================

    private void processInlineData(Turn active, RuntimeEvent.InlineData data, List<ProtocolChunk> out) {
        if (data.data() == null) {
            log.warn("Inline data without content, skipping");
            return;
        }
        String mimeType = data.mimeType() != null ? data.mimeType() : "";
        String content = Base64.getEncoder().encodeToString(data.data());

        if (mimeType.startsWith("audio/pcm")) {
            Integer sampleRate = parseSampleRate(mimeType);
            if (sampleRate != null && active.pcmSampleRate == null) {
                active.pcmSampleRate = sampleRate;
            }
            active.pcmChunks++;
            active.pcmBytes += data.data().length;
            out.add(ProtocolChunk.of("data-pcm", "data", mapOf(
                    "content", content,
                    "sampleRate", sampleRate != null ? sampleRate : DEFAULT_PCM_SAMPLE_RATE,
                    "channels", 1,
                    "bitDepth", 16)));
        } else if (mimeType.startsWith("audio/")) {
            out.add(ProtocolChunk.of("data-audio", "data", mapOf("mediaType", mimeType, "content", content)));
        } else if (mimeType.startsWith("image/")) {
            out.add(ProtocolChunk.of("file",
                    "url", "data:" + mimeType + ";base64," + content,
                    "mediaType", mimeType));
        } else {
            log.warn("Unsupported inline data type {} ({} bytes), skipping", mimeType, data.data().length);
        }
    }

    private static Integer parseSampleRate(String mimeType) {
        int idx = mimeType.indexOf(";rate=");
        if (idx < 0) {
            return null;
        }
        try {
            return Integer.parseInt(mimeType.substring(idx + ";rate=".length()).trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid PCM sample rate in {}", mimeType);
            return null;
        }
    }

    // =========================================================================
    // Finish metadata
    // =========================================================================

    private Map<String, Object> buildMessageMetadata(Turn active) {
        Map<String, Object> result = new LinkedHashMap<>();

        if (metadata.usage != null) {
            result.put("usage", mapOf(
                    "promptTokens", metadata.usage.promptTokens(),
                    "completionTokens", metadata.usage.completionTokens(),
                    "totalTokens", metadata.usage.totalTokens()));
        }

        if (active.pcmChunks > 0) {
            int sampleRate = active.pcmSampleRate != null ? active.pcmSampleRate : DEFAULT_PCM_SAMPLE_RATE;
            // PCM16 mono: two bytes per sample
            double duration = active.pcmBytes / (double) (sampleRate * 2);
            result.put("audio", mapOf(
                    "chunks", active.pcmChunks,
                    "bytes", active.pcmBytes,
                    "sampleRate", sampleRate,
                    "duration", duration));
        }

        if (metadata.grounding != null && !metadata.grounding.isEmpty()) {
            List<Map<String, Object>> sources = new ArrayList<>();
            for (RuntimeEvent.GroundingSource source : metadata.grounding) {
                sources.add(mapOf("type", "web",
                        "uri", nullToEmpty(source.uri()),
                        "title", nullToEmpty(source.title())));
            }
            result.put("grounding", mapOf("sources", sources));
        }

        if (metadata.citations != null && !metadata.citations.isEmpty()) {
            List<Map<String, Object>> citations = new ArrayList<>();
            for (RuntimeEvent.Citation citation : metadata.citations) {
                citations.add(mapOf(
                        "startIndex", citation.startIndex(),
                        "endIndex", citation.endIndex(),
                        "uri", nullToEmpty(citation.uri()),
                        "license", nullToEmpty(citation.license())));
            }
            result.put("citations", citations);
        }

        if (metadata.cache != null) {
            result.put("cache", mapOf("hits", metadata.cache.hits(), "misses", metadata.cache.misses()));
        }

        String modelVersion = metadata.modelVersion != null ? metadata.modelVersion : agentModel;
        if (modelVersion != null) {
            result.put("modelVersion", modelVersion);
        }
        return result;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static Map<String, Object> mapOf(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    // =========================================================================
    // State
    // =========================================================================

    private static final class Turn {
        final String messageId;
        final Map<TextChannel, TextBlock> blocks = new EnumMap<>(TextChannel.class);
        final Map<String, ToolCallRecord> toolCalls = new LinkedHashMap<>();
        /** Original tool-call ids with an approval request and no output yet. */
        final Set<String> awaitingApproval = new LinkedHashSet<>();
        final List<String> reasoningTexts = new ArrayList<>();
        boolean completionHeld;
        int reasoningCounter;
        int pcmChunks;
        long pcmBytes;
        Integer pcmSampleRate;

        Turn(String messageId) {
            this.messageId = messageId;
        }

        boolean repeatsReasoning(String text) {
            if (reasoningTexts.isEmpty()) {
                return false;
            }
            return text.equals(String.join("", reasoningTexts)) || reasoningTexts.contains(text);
        }
    }

    private static final class TextBlock {
        final String id;
        final StringBuilder accumulated = new StringBuilder();
        boolean open;

        TextBlock(String id) {
            this.id = id;
        }
    }

    private static final class MetadataAccumulator {
        RuntimeEvent.Usage usage;
        String finishReason;
        List<RuntimeEvent.GroundingSource> grounding;
        List<RuntimeEvent.Citation> citations;
        RuntimeEvent.CacheStats cache;
        String modelVersion;

        void merge(RuntimeEvent.Metadata update) {
            if (update.usage() != null)
                usage = update.usage();
            if (update.finishReason() != null)
                finishReason = update.finishReason();
            if (update.grounding() != null)
                grounding = update.grounding();
            if (update.citations() != null)
                citations = update.citations();
            if (update.cache() != null)
                cache = update.cache();
            if (update.modelVersion() != null)
                modelVersion = update.modelVersion();
        }
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static class Builder {
        private String confirmationToolName = DEFAULT_CONFIRMATION_TOOL;
        private String agentModel;
        private Supplier<String> messageIdGenerator = () -> UUID.randomUUID().toString();

        public Builder confirmationToolName(String v) {
            this.confirmationToolName = v;
            return this;
        }

        public Builder agentModel(String v) {
            this.agentModel = v;
            return this;
        }

        public Builder messageIdGenerator(Supplier<String> v) {
            this.messageIdGenerator = v;
            return this;
        }

        public StreamProtocolConverter build() {
            Objects.requireNonNull(confirmationToolName, "confirmationToolName");
            Objects.requireNonNull(messageIdGenerator, "messageIdGenerator");
            return new StreamProtocolConverter(this);
        }
    }
}
