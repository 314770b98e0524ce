package com.warden.dispatch.api;

import com.warden.core.confirmation.ConfirmationGateway;
import com.warden.core.confirmation.ConfirmationSnapshot;
import com.warden.core.confirmation.ResponseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST surface of the confirmation gateway: what is waiting for approval, what was decided,
 * and the inbound channel for approvers' answers.
 */
@RestController
@RequestMapping("/api/v1/confirmations")
public class ConfirmationController {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationController.class);

    private final ConfirmationGateway gateway;
    private final SseStreamingService sseStreamingService;

    public ConfirmationController(ConfirmationGateway gateway, SseStreamingService sseStreamingService) {
        this.gateway = gateway;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/confirmations/pending: Requests awaiting a decision, optionally for one plan.
     */
    @GetMapping("/pending")
    public ResponseEntity<List<ConfirmationSnapshot>> listPending(
            @RequestParam(name = "plan_id", required = false) String planId) {
        return ResponseEntity.ok(planId != null ? gateway.listPending(planId) : gateway.listPending());
    }

    /**
     * GET /api/v1/confirmations/history: Most recently resolved requests, oldest first.
     */
    @GetMapping("/history")
    public ResponseEntity<List<ConfirmationSnapshot>> history(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(gateway.getHistory(limit));
    }

    /**
     * GET /api/v1/confirmations/{id}: One request, pending or resolved.
     */
    @GetMapping("/{id}")
    public ResponseEntity<ConfirmationSnapshot> getRequest(@PathVariable String id) {
        return gateway.find(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/confirmations/{id}/response: Approve or deny a pending request.
     * 404 for an unknown id, 409 if it was already resolved.
     */
    @PostMapping("/{id}/response")
    public ResponseEntity<Map<String, Object>> respond(@PathVariable String id,
                                                       @RequestBody ConfirmationResponseRequest body) {
        if (body == null || body.approved() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "approved is required"));
        }
        String resolver = body.resolver() != null && !body.resolver().isBlank() ? body.resolver() : "user";
        ResponseResult result = gateway.submitResponse(id, body.approved(), resolver);
        log.info("Response to {} from {}: approved={} -> {}", id, resolver, body.approved(), result);

        return switch (result) {
            case RESOLVED -> ResponseEntity.ok(Map.of(
                    "request_id", id,
                    "result", result.name(),
                    "approved", body.approved()));
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "request_id", id,
                    "result", result.name(),
                    "error", "No such confirmation request"));
            case ALREADY_RESOLVED -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "request_id", id,
                    "result", result.name(),
                    "error", "Confirmation request already resolved"));
        };
    }

    /**
     * GET /api/v1/confirmations/events: SSE stream of every event, for approver dashboards.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents() {
        return sseStreamingService.createGlobalEmitter();
    }
}
