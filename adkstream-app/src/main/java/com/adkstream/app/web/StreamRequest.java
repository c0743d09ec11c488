package com.adkstream.app.web;

import com.adkstream.gateway.session.HistoryMessage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST /api/stream}. The last message is the new input; the
 * earlier ones are the client's view of the conversation so far.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamRequest {
    private String userId;
    /** Optional connection signature; without one the user has a single session. */
    private String sessionId;
    private List<HistoryMessage> messages = new ArrayList<>();
}
