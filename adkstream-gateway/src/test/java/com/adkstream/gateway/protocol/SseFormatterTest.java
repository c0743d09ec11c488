package com.adkstream.gateway.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SseFormatterTest {

    private final SseFormatter formatter = new SseFormatter(new ObjectMapper());

    @Test
    void format_writesTypeFirstDataFrame() {
        String frame = formatter.format(ProtocolChunk.textDelta("m_output_text", "hi"));

        assertEquals("data: {\"type\":\"text-delta\",\"id\":\"m_output_text\",\"delta\":\"hi\"}\n\n", frame);
    }

    @Test
    void format_terminator_isDoneFrame() {
        assertEquals("data: [DONE]\n\n", formatter.format(ProtocolChunk.DONE));
        assertEquals(SseFormatter.DONE_FRAME, formatter.format(ProtocolChunk.DONE));
    }

    @Test
    void format_errorChunk_nestsCodeAndMessage() {
        String frame = formatter.format(ProtocolChunk.error("E1", "boom"));

        assertEquals("data: {\"type\":\"error\",\"error\":{\"code\":\"E1\",\"message\":\"boom\"}}\n\n", frame);
    }
}
