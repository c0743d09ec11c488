package com.adkstream.gateway.protocol;

import com.adkstream.gateway.approval.ApprovalRegistry;
import com.adkstream.gateway.approval.ToolApprovalGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StreamProtocolConverterTest {

    private static final String CONFIRMATION_TOOL = "adk_request_confirmation";

    private StreamProtocolConverter converter;

    @BeforeEach
    void setUp() {
        AtomicInteger ids = new AtomicInteger();
        converter = StreamProtocolConverter.builder()
                .messageIdGenerator(() -> "msg-" + ids.incrementAndGet())
                .build();
    }

    private List<ProtocolChunk> feed(RuntimeEvent... events) {
        List<ProtocolChunk> out = new ArrayList<>();
        for (RuntimeEvent event : events) {
            out.addAll(converter.convert(event));
        }
        return out;
    }

    private static List<String> types(List<ProtocolChunk> chunks) {
        return chunks.stream().map(ProtocolChunk::type).toList();
    }

    private static RuntimeEvent.FunctionCall confirmationCall(String id, String originalId) {
        return RuntimeEvent.functionCall(id, CONFIRMATION_TOOL, Map.of("originalFunctionCall",
                Map.of("id", originalId, "name", "process_payment", "args", Map.of())));
    }

    // =========================================================================
    // Text
    // =========================================================================

    @Nested
    class TextStreaming {

        @Test
        void textTurn_emitsStartBlockFinishAndDone() {
            List<ProtocolChunk> chunks = feed(
                    RuntimeEvent.text("Hello"),
                    RuntimeEvent.text(" world"),
                    RuntimeEvent.turnComplete());

            assertEquals(List.of("start", "text-start", "text-delta", "text-delta", "text-end", "finish", "[DONE]"),
                    types(chunks));
            assertEquals("msg-1", chunks.get(0).get("messageId"));
            assertEquals("Hello", chunks.get(2).get("delta"));
            assertEquals(" world", chunks.get(3).get("delta"));
            assertEquals("stop", chunks.get(5).get("finishReason"));
            assertFalse(converter.isActive());
        }

        @Test
        void blockId_isStableAcrossDeltasInTurn() {
            List<ProtocolChunk> chunks = feed(
                    RuntimeEvent.text("a"),
                    RuntimeEvent.text("b", true),
                    RuntimeEvent.text("c"),
                    RuntimeEvent.turnComplete());

            String expected = TextChannel.OUTPUT.blockId("msg-1");
            for (ProtocolChunk chunk : chunks) {
                if (chunk.type().startsWith("text-")) {
                    assertEquals(expected, chunk.get("id"));
                }
            }
        }

        @Test
        void inputTranscript_usesItsOwnBlock() {
            List<ProtocolChunk> chunks = feed(
                    RuntimeEvent.inputTranscript("hi", false),
                    RuntimeEvent.text("hello"));

            assertEquals("msg-1_input_text", chunks.get(1).get("id"));
            assertEquals("msg-1_output_text", chunks.get(3).get("id"));
        }

        @Test
        void finishedSummary_repeatingAccumulatedText_onlyClosesBlock() {
            feed(RuntimeEvent.text("Hello"), RuntimeEvent.text(" there"));

            List<ProtocolChunk> chunks = feed(RuntimeEvent.text("Hello there", true));

            assertEquals(List.of("text-end"), types(chunks));
        }

        @Test
        void thought_emitsReasoningAndSuppressesRepeatedOutput() {
            List<ProtocolChunk> chunks = feed(
                    new RuntimeEvent.Thought("thinking..."),
                    RuntimeEvent.text("thinking..."));

            assertEquals(List.of("start", "reasoning-start", "reasoning-delta", "reasoning-end"), types(chunks));
            assertEquals("msg-1_reasoning_0", chunks.get(1).get("id"));
        }

        @Test
        void turnComplete_closesOpenBlocksBeforeFinish() {
            List<ProtocolChunk> chunks = feed(RuntimeEvent.text("open"), RuntimeEvent.turnComplete());

            assertEquals(List.of("start", "text-start", "text-delta", "text-end", "finish", "[DONE]"),
                    types(chunks));
        }

        @Test
        void secondTurn_getsNewMessageId() {
            feed(RuntimeEvent.text("one"), RuntimeEvent.turnComplete());
            List<ProtocolChunk> chunks = feed(RuntimeEvent.text("two"));

            assertEquals("msg-2", chunks.get(0).get("messageId"));
            assertEquals("msg-2_output_text", chunks.get(1).get("id"));
        }
    }

    // =========================================================================
    // Tools and approvals
    // =========================================================================

    @Nested
    class Tools {

        @Test
        void functionCall_emitsInputStartAndAvailable() {
            List<ProtocolChunk> chunks = feed(
                    new RuntimeEvent.FunctionCallStarted("call-1", "get_weather"),
                    RuntimeEvent.functionCall("call-1", "get_weather", Map.of("city", "Tokyo")),
                    RuntimeEvent.functionResponse("call-1", "get_weather", Map.of("temp", 20)));

            assertEquals(List.of("start", "tool-input-start", "tool-input-available", "tool-output-available"),
                    types(chunks));
            assertEquals(Map.of("city", "Tokyo"), chunks.get(2).get("input"));
            assertEquals(Map.of("temp", 20), chunks.get(3).get("output"));
            assertEquals(ToolCallRecord.State.OUTPUT_AVAILABLE, converter.getToolCall("call-1").get().getState());
        }

        @Test
        void duplicateFunctionCall_isIgnored() {
            feed(RuntimeEvent.functionCall("call-1", "get_weather", Map.of()));

            assertTrue(feed(RuntimeEvent.functionCall("call-1", "get_weather", Map.of())).isEmpty());
        }

        @Test
        void failedResponse_emitsOutputError() {
            List<ProtocolChunk> chunks = feed(
                    RuntimeEvent.functionCall("call-1", "get_weather", Map.of()),
                    RuntimeEvent.functionResponse("call-1", "get_weather",
                            Map.of("success", false, "error", "city not found")));

            ProtocolChunk last = chunks.get(chunks.size() - 1);
            assertEquals("tool-output-error", last.type());
            assertEquals("city not found", last.get("errorText"));
        }

        @Test
        void approvalTurn_holdsCompletionUntilOutput() {
            List<ProtocolChunk> chunks = feed(
                    RuntimeEvent.functionCall("call-1", "process_payment", Map.of("amount", 50)),
                    confirmationCall("confirmation-1", "call-1"),
                    RuntimeEvent.functionResponse("call-1", "process_payment",
                            Map.of("error", StreamProtocolConverter.CONFIRMATION_PENDING_ERROR)),
                    RuntimeEvent.turnComplete());

            assertEquals(List.of("start", "tool-input-start", "tool-input-available", "tool-approval-request"),
                    types(chunks));
            ProtocolChunk request = chunks.get(3);
            assertEquals("call-1", request.get("toolCallId"));
            assertEquals("confirmation-1", request.get("approvalId"));
            assertTrue(converter.isCompletionHeld());
            assertEquals(ToolCallRecord.State.APPROVAL_REQUESTED, converter.getToolCall("call-1").get().getState());

            List<ProtocolChunk> resumed = feed(
                    RuntimeEvent.functionResponse("call-1", "process_payment", Map.of("success", true)),
                    RuntimeEvent.text("Paid."),
                    RuntimeEvent.turnComplete());

            assertEquals(List.of("tool-output-available", "text-start", "text-delta", "text-end", "finish", "[DONE]"),
                    types(resumed));
        }

        @Test
        void complete_releasesHeldTurn() {
            feed(RuntimeEvent.functionCall("call-1", "process_payment", Map.of()),
                    confirmationCall("confirmation-1", "call-1"),
                    RuntimeEvent.turnComplete());

            assertEquals(List.of("finish", "[DONE]"), types(converter.complete()));
            assertFalse(converter.isActive());
        }

        @Test
        void confirmationTool_neverSurfacesAsToolCall() {
            List<ProtocolChunk> chunks = feed(
                    new RuntimeEvent.FunctionCallStarted("confirmation-1", CONFIRMATION_TOOL),
                    confirmationCall("confirmation-1", "call-1"),
                    RuntimeEvent.functionResponse("confirmation-1", CONFIRMATION_TOOL, Map.of("confirmed", true)));

            assertEquals(List.of("start", "tool-approval-request"), types(chunks));
        }

        @Test
        void confirmationWithoutOriginal_fallsBackToOwnId() {
            List<ProtocolChunk> chunks = feed(RuntimeEvent.functionCall("confirmation-9", CONFIRMATION_TOOL, Map.of()));

            ProtocolChunk request = chunks.get(1);
            assertEquals("confirmation-9", request.get("toolCallId"));
            assertEquals("confirmation-9", request.get("approvalId"));
        }

        @Test
        void responseWithoutName_isSkipped() {
            feed(RuntimeEvent.functionCall("call-1", "get_weather", Map.of()));

            assertTrue(feed(RuntimeEvent.functionResponse("call-1", null, Map.of())).isEmpty());
        }
    }

    @Nested
    class ApprovalGateEndToEnd {

        @Test
        void unresolvedApproval_timesOutIntoOutputError() {
            ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
            try {
                ApprovalRegistry registry = new ApprovalRegistry(scheduler);
                ToolApprovalGate gate = new ToolApprovalGate(registry, CONFIRMATION_TOOL, Duration.ofMillis(100));
                List<ProtocolChunk> chunks = new ArrayList<>();

                gate.execute("call-1", "process_payment", Map.of("amount", 50),
                        event -> chunks.addAll(converter.convert(event)),
                        args -> Map.of("success", true));
                chunks.addAll(converter.convert(RuntimeEvent.turnComplete()));

                assertEquals(List.of("start", "tool-input-start", "tool-input-available", "tool-approval-request",
                        "tool-output-error", "finish", "[DONE]"), types(chunks));
                assertEquals("process_payment approval timed out", chunks.get(4).get("errorText"));
                assertEquals(0, registry.getPendingCount());
            } finally {
                scheduler.shutdownNow();
            }
        }
    }

    // =========================================================================
    // Metadata, media, errors
    // =========================================================================

    @Nested
    class FinishMetadata {

        @Test
        void usageAndFinishReason_appearOnFinish() {
            List<ProtocolChunk> chunks = feed(
                    RuntimeEvent.text("hi"),
                    RuntimeEvent.Metadata.usage(3, 2, 5),
                    RuntimeEvent.Metadata.finishReason("MAX_TOKENS"),
                    RuntimeEvent.turnComplete());

            ProtocolChunk finish = chunks.get(chunks.size() - 2);
            assertEquals("length", finish.get("finishReason"));
            Map<?, ?> metadata = (Map<?, ?>) finish.get("messageMetadata");
            assertEquals(Map.of("promptTokens", 3, "completionTokens", 2, "totalTokens", 5), metadata.get("usage"));
        }

        @Test
        void metadataOnly_doesNotStartTurn() {
            assertTrue(feed(RuntimeEvent.Metadata.usage(1, 1, 2)).isEmpty());
            assertFalse(converter.isActive());
        }

        @Test
        void agentModel_isReportedWhenRuntimeGivesNoVersion() {
            converter = StreamProtocolConverter.builder().agentModel("gemini-test").build();

            List<ProtocolChunk> chunks = feed(RuntimeEvent.text("x"), RuntimeEvent.turnComplete());

            Map<?, ?> metadata = (Map<?, ?>) chunks.get(chunks.size() - 2).get("messageMetadata");
            assertEquals("gemini-test", metadata.get("modelVersion"));
        }

        @Test
        void noMetadata_finishHasNoMessageMetadata() {
            List<ProtocolChunk> chunks = feed(RuntimeEvent.text("x"), RuntimeEvent.turnComplete());

            assertNull(chunks.get(chunks.size() - 2).get("messageMetadata"));
        }

        @Test
        void pcmAudio_isStreamedAndSummarised() {
            List<ProtocolChunk> chunks = feed(
                    new RuntimeEvent.InlineData("audio/pcm;rate=16000", new byte[3200]),
                    RuntimeEvent.turnComplete());

            ProtocolChunk pcm = chunks.get(1);
            assertEquals("data-pcm", pcm.type());
            assertEquals(16000, ((Map<?, ?>) pcm.get("data")).get("sampleRate"));

            Map<?, ?> audio = (Map<?, ?>) ((Map<?, ?>) chunks.get(2).get("messageMetadata")).get("audio");
            assertEquals(1, audio.get("chunks"));
            assertEquals(3200L, audio.get("bytes"));
            assertEquals(0.1, (Double) audio.get("duration"), 1e-9);
        }

        @Test
        void image_becomesFileChunk() {
            List<ProtocolChunk> chunks = feed(new RuntimeEvent.InlineData("image/png", new byte[] {1, 2, 3}));

            ProtocolChunk file = chunks.get(1);
            assertEquals("file", file.type());
            assertEquals("image/png", file.get("mediaType"));
            assertEquals("data:image/png;base64,AQID", file.get("url"));
        }
    }

    @Nested
    class Errors {

        @Test
        void runtimeError_emitsErrorAndDoneThenResets() {
            feed(RuntimeEvent.text("partial"));

            List<ProtocolChunk> chunks = feed(RuntimeEvent.error("QUOTA", "quota exceeded"));

            assertEquals(List.of("error", "[DONE]"), types(chunks));
            assertEquals(Map.of("code", "QUOTA", "message", "quota exceeded"), chunks.get(0).get("error"));
            assertFalse(converter.isActive());
        }

        @Test
        void fail_emitsStreamFailure() {
            feed(RuntimeEvent.text("partial"));

            List<ProtocolChunk> chunks = converter.fail(new IllegalStateException("connection reset"));

            assertEquals(List.of("error", "[DONE]"), types(chunks));
            Map<?, ?> error = (Map<?, ?>) chunks.get(0).get("error");
            assertEquals("STREAM_FAILURE", error.get("code"));
            assertEquals("connection reset", error.get("message"));
        }

        @Test
        void complete_whenIdle_emitsNothing() {
            assertTrue(converter.complete().isEmpty());
        }

        @Test
        void turnComplete_whenIdle_emitsEmptyTurn() {
            assertEquals(List.of("start", "finish", "[DONE]"), types(feed(RuntimeEvent.turnComplete())));
        }
    }
}
