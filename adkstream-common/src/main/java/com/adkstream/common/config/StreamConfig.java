package com.adkstream.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Root configuration for the stream bridge, loaded from a JSON file.
 * Every field has a usable default so a missing file still yields a working
 * setup.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamConfig {

    /** Fixed per-subject session key used when a client sends no signature. */
    private String appName = "adk-stream-protocol";

    /** Author recorded on replayed assistant turns. */
    private String agentName = "adk_assistant";

    /** Reported as {@code modelVersion} when the runtime does not send one. */
    private String agentModel;

    /** Name of the runtime's internal approval-gate tool. */
    private String confirmationToolName = "adk_request_confirmation";

    private ApprovalConfig approval = new ApprovalConfig();

    private ChunkLoggerConfig chunkLogger = new ChunkLoggerConfig();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApprovalConfig {
        private long executionTimeoutMs = 30_000;
        private long confirmationTimeoutMs = 60_000;
        private long frontendToolTimeoutMs = 10_000;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkLoggerConfig {
        private boolean enabled;
        private String outputDir = "./chunk_logs";
        /** Recording session name; generated from the start time when empty. */
        private String sessionId;
    }
}
