package com.adkstream.gateway.approval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request waiting for a human decision. Name and args are display metadata
 * only.
 */
public record PendingApprovalRequest(
        String requestId,
        String name,
        Map<String, Object> args,
        long createdAtMs) {

    public PendingApprovalRequest {
        args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
    }
}
