package com.adkstream.gateway.protocol;

import java.util.Locale;
import java.util.Map;

/**
 * Maps model finish reasons onto the protocol's finish reasons.
 */
public final class FinishReasons {

    public static final String STOP = "stop";
    public static final String LENGTH = "length";
    public static final String CONTENT_FILTER = "content-filter";
    public static final String ERROR = "error";
    public static final String OTHER = "other";

    private static final Map<String, String> MAPPING = Map.ofEntries(
            Map.entry("STOP", STOP),
            Map.entry("FINISH_REASON_UNSPECIFIED", STOP),
            Map.entry("MAX_TOKENS", LENGTH),
            Map.entry("SAFETY", CONTENT_FILTER),
            Map.entry("RECITATION", CONTENT_FILTER),
            Map.entry("BLOCKLIST", CONTENT_FILTER),
            Map.entry("PROHIBITED_CONTENT", CONTENT_FILTER),
            Map.entry("SPII", CONTENT_FILTER),
            Map.entry("IMAGE_SAFETY", CONTENT_FILTER),
            Map.entry("IMAGE_RECITATION", CONTENT_FILTER),
            Map.entry("IMAGE_PROHIBITED_CONTENT", CONTENT_FILTER),
            Map.entry("LANGUAGE", CONTENT_FILTER),
            Map.entry("MALFORMED_FUNCTION_CALL", ERROR),
            Map.entry("UNEXPECTED_TOOL_CALL", ERROR),
            Map.entry("NO_IMAGE", ERROR),
            Map.entry("OTHER", OTHER),
            Map.entry("IMAGE_OTHER", OTHER));

    private FinishReasons() {
    }

    /**
     * @param modelReason the runtime's finish reason name, may be null
     * @return the protocol finish reason; unknown names are lower-cased
     */
    public static String map(String modelReason) {
        if (modelReason == null || modelReason.isBlank()) {
            return STOP;
        }
        String key = modelReason.trim().toUpperCase(Locale.ROOT);
        String mapped = MAPPING.get(key);
        return mapped != null ? mapped : modelReason.trim().toLowerCase(Locale.ROOT);
    }
}
