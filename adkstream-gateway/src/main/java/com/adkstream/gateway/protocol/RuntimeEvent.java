package com.adkstream.gateway.protocol;

import java.util.List;
import java.util.Map;

/**
 * Events emitted by the agent runtime, decoded once at the runtime boundary.
 */
public sealed interface RuntimeEvent permits
        RuntimeEvent.TextDelta,
        RuntimeEvent.Thought,
        RuntimeEvent.FunctionCallStarted,
        RuntimeEvent.FunctionCall,
        RuntimeEvent.FunctionResponse,
        RuntimeEvent.ExecutableCode,
        RuntimeEvent.CodeExecutionResult,
        RuntimeEvent.InlineData,
        RuntimeEvent.Metadata,
        RuntimeEvent.TurnComplete,
        RuntimeEvent.RuntimeError {

    // =========================================================================
    // Factories
    // =========================================================================

    static TextDelta text(String text) {
        return new TextDelta(TextChannel.OUTPUT, text, false);
    }

    static TextDelta text(String text, boolean finished) {
        return new TextDelta(TextChannel.OUTPUT, text, finished);
    }

    static TextDelta inputTranscript(String text, boolean finished) {
        return new TextDelta(TextChannel.INPUT_TRANSCRIPT, text, finished);
    }

    static FunctionCall functionCall(String id, String name, Map<String, Object> args) {
        return new FunctionCall(id, name, args);
    }

    static FunctionResponse functionResponse(String id, String name, Map<String, Object> response) {
        return new FunctionResponse(id, name, response);
    }

    static TurnComplete turnComplete() {
        return TurnComplete.INSTANCE;
    }

    static RuntimeError error(String code, String message) {
        return new RuntimeError(code, message);
    }

    // =========================================================================
    // Event kinds
    // =========================================================================

    /** Streamed text on one channel; {@code finished} closes the block. */
    record TextDelta(TextChannel channel, String text, boolean finished) implements RuntimeEvent {
    }

    /** A reasoning summary part. */
    record Thought(String text) implements RuntimeEvent {
    }

    /** A tool call whose arguments are still streaming. */
    record FunctionCallStarted(String id, String name) implements RuntimeEvent {
    }

    /** A tool call with its complete arguments. */
    record FunctionCall(String id, String name, Map<String, Object> args) implements RuntimeEvent {
        public FunctionCall {
            args = args != null ? args : Map.of();
        }
    }

    record FunctionResponse(String id, String name, Map<String, Object> response) implements RuntimeEvent {
    }

    record ExecutableCode(String language, String code) implements RuntimeEvent {
    }

    record CodeExecutionResult(String outcome, String output) implements RuntimeEvent {
    }

    /** Binary content such as PCM audio or an image. */
    record InlineData(String mimeType, byte[] data) implements RuntimeEvent {
    }

    /**
     * Model metadata; any field may be null and later values replace earlier
     * ones within a turn.
     */
    record Metadata(
            Usage usage,
            String finishReason,
            List<GroundingSource> grounding,
            List<Citation> citations,
            CacheStats cache,
            String modelVersion) implements RuntimeEvent {

        public static Metadata usage(int promptTokens, int completionTokens, int totalTokens) {
            return new Metadata(new Usage(promptTokens, completionTokens, totalTokens),
                    null, null, null, null, null);
        }

        public static Metadata finishReason(String finishReason) {
            return new Metadata(null, finishReason, null, null, null, null);
        }
    }

    record TurnComplete() implements RuntimeEvent {
        static final TurnComplete INSTANCE = new TurnComplete();
    }

    /** The runtime reported a fatal error for this turn. */
    record RuntimeError(String code, String message) implements RuntimeEvent {
    }

    // =========================================================================
    // Metadata payloads
    // =========================================================================

    record Usage(int promptTokens, int completionTokens, int totalTokens) {
    }

    record GroundingSource(String uri, String title) {
    }

    record Citation(int startIndex, int endIndex, String uri, String license) {
    }

    record CacheStats(int hits, int misses) {
    }
}
