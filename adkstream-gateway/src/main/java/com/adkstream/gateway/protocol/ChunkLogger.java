package com.adkstream.gateway.protocol;

import com.adkstream.common.config.StreamConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records runtime events and emitted chunks as JSON lines for debugging and
 * replay. Output goes to {@code <outputDir>/<sessionId>/<location>.jsonl},
 * one file per recording point. Disabled instances do nothing.
 */
@Slf4j
public class ChunkLogger implements Closeable {

    public enum Location {
        BACKEND_ADK_EVENT("backend-adk-event"),
        BACKEND_SSE_EVENT("backend-sse-event");

        private final String fileName;

        Location(String fileName) {
            this.fileName = fileName;
        }

        public String fileName() {
            return fileName;
        }
    }

    public enum Direction {
        IN, OUT
    }

    public enum Mode {
        ADK_SSE("adk-sse"),
        ADK_BIDI("adk-bidi");

        private final String label;

        Mode(String label) {
            this.label = label;
        }
    }

    private static final DateTimeFormatter SESSION_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd-HHmmss");

    private final boolean enabled;
    private final Path sessionDir;
    private final String sessionId;
    private final ObjectMapper objectMapper;
    private final Map<Location, Long> sequences = new EnumMap<>(Location.class);
    private final Map<Location, BufferedWriter> writers = new EnumMap<>(Location.class);

    public ChunkLogger(boolean enabled, Path outputDir, String sessionId, ObjectMapper objectMapper) {
        this.enabled = enabled;
        this.sessionId = sessionId != null && !sessionId.isBlank()
                ? sessionId
                : "session-" + ZonedDateTime.now(ZoneOffset.UTC).format(SESSION_FORMAT);
        this.sessionDir = outputDir.resolve(this.sessionId);
        this.objectMapper = objectMapper;
    }

    public static ChunkLogger fromConfig(StreamConfig.ChunkLoggerConfig config, ObjectMapper objectMapper) {
        return new ChunkLogger(config.isEnabled(), Path.of(config.getOutputDir()),
                config.getSessionId(), objectMapper);
    }

    public static ChunkLogger disabled() {
        return new ChunkLogger(false, Path.of("."), "disabled", new ObjectMapper());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void logChunk(Location location, Direction direction, Object chunk, Mode mode) {
        logChunk(location, direction, chunk, mode, null);
    }

    /**
     * Append one entry. Write failures are logged and never reach the caller.
     */
    public synchronized void logChunk(Location location, Direction direction, Object chunk, Mode mode,
            Map<String, Object> metadata) {
        if (!enabled) {
            return;
        }
        long sequence = sequences.merge(location, 1L, Long::sum);

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", System.currentTimeMillis());
        entry.put("session_id", sessionId);
        entry.put("mode", mode.label);
        entry.put("location", location.fileName());
        entry.put("direction", direction.name().toLowerCase());
        entry.put("sequence_number", sequence);
        entry.put("chunk", chunk);
        entry.put("metadata", metadata);

        try {
            BufferedWriter writer = writerFor(location);
            writer.write(objectMapper.writeValueAsString(entry));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            log.warn("Chunk log write failed for {}: {}", location.fileName(), e.getMessage());
        }
    }

    private BufferedWriter writerFor(Location location) throws IOException {
        BufferedWriter writer = writers.get(location);
        if (writer == null) {
            Files.createDirectories(sessionDir);
            writer = Files.newBufferedWriter(sessionDir.resolve(location.fileName() + ".jsonl"),
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            writers.put(location, writer);
        }
        return writer;
    }

    public Path getSessionDir() {
        return sessionDir;
    }

    @Override
    public synchronized void close() {
        for (var entry : writers.entrySet()) {
            try {
                entry.getValue().close();
            } catch (IOException e) {
                log.warn("Failed to close chunk log {}: {}", entry.getKey().fileName(), e.getMessage());
            }
        }
        writers.clear();
    }
}
