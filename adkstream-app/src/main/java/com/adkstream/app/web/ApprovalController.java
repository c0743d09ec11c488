package com.adkstream.app.web;

import com.adkstream.gateway.approval.ApprovalDecision;
import com.adkstream.gateway.approval.ApprovalRegistry;
import com.adkstream.gateway.approval.PendingApprovalRequest;
import com.adkstream.gateway.session.Session;
import com.adkstream.gateway.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Out-of-band approval decisions for sessions driven over SSE. A request may
 * be answered by its tool call id or by the {@code approvalId} carried in the
 * {@code tool-approval-request} chunk.
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions/{sessionId}/approvals")
public class ApprovalController {

    private final SessionStore sessionStore;

    public ApprovalController(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @GetMapping
    public ResponseEntity<?> pending(@PathVariable String sessionId) {
        Optional<Session> session = sessionStore.get(sessionId);
        if (session.isEmpty()) {
            return sessionNotFound(sessionId);
        }
        ApprovalRegistry approvals = session.get().getApprovals();
        List<Map<String, Object>> body = new ArrayList<>();
        for (PendingApprovalRequest request : approvals.getPendingRequests()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("requestId", request.requestId());
            approvals.aliasOf(request.requestId()).ifPresent(alias -> entry.put("approvalId", alias));
            entry.put("name", request.name());
            entry.put("args", request.args());
            entry.put("createdAtMs", request.createdAtMs());
            body.add(entry);
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{requestId}")
    public ResponseEntity<?> decide(@PathVariable String sessionId, @PathVariable String requestId,
            @RequestBody ApprovalVote vote) {
        if (vote.getApproved() == null) {
            return ResponseEntity.badRequest().body(new ErrorResponse("approved is required"));
        }
        Optional<Session> session = sessionStore.get(sessionId);
        if (session.isEmpty()) {
            return sessionNotFound(sessionId);
        }

        ApprovalDecision decision = vote.getApproved()
                ? ApprovalDecision.approve(vote.getReason())
                : ApprovalDecision.deny(vote.getReason());
        if (!session.get().getApprovals().resolve(requestId, decision)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse("No pending approval request: " + requestId));
        }
        return ResponseEntity.ok(Map.of("requestId", requestId, "outcome", decision.outcome()));
    }

    private static ResponseEntity<?> sessionNotFound(String sessionId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("Unknown session: " + sessionId));
    }
}
