package com.adkstream.gateway.protocol;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FinishReasonsTest {

    @ParameterizedTest
    @CsvSource({
            "STOP, stop",
            "FINISH_REASON_UNSPECIFIED, stop",
            "MAX_TOKENS, length",
            "SAFETY, content-filter",
            "RECITATION, content-filter",
            "SPII, content-filter",
            "MALFORMED_FUNCTION_CALL, error",
            "OTHER, other",
            "max_tokens, length",
            "SOMETHING_NEW, something_new"
    })
    void map_knownAndUnknownReasons(String input, String expected) {
        assertEquals(expected, FinishReasons.map(input));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "   " })
    void map_missingReason_isStop(String input) {
        assertEquals("stop", FinishReasons.map(input));
    }
}
