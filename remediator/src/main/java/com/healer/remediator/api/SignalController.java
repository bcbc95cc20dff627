package com.healer.remediator.api;

import com.healer.remediator.api.dto.IngestResponse;
import com.healer.remediator.api.dto.SignalRequest;
import com.healer.remediator.service.IngestResult;
import com.healer.remediator.service.RemediationOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Entry point for failure signals from CI, platform monitors and QA.
 *
 * POST /signals
 *   201 Created  a new remediation unit was started
 *   200 OK       the signal was suppressed as a duplicate or excluded by label
 *   400          type or target missing
 */
@RestController
@RequestMapping("/signals")
public class SignalController {

    private final RemediationOrchestrator orchestrator;

    public SignalController(RemediationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/signals \
     *     -H "Content-Type: application/json" \
     *     -d '{"type":"a7","target":"pod-123","severity":"high","labels":{"task-id":"42"}}'
     */
    @PostMapping
    public ResponseEntity<IngestResponse> ingest(@RequestBody SignalRequest req) {
        if (req.type() == null || req.type().isBlank() || req.target() == null || req.target().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "type and target are required");
        }
        IngestResult result = orchestrator.ingest(req.toSignal());
        HttpStatus status = result.outcome() == IngestResult.Outcome.ACCEPTED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(IngestResponse.from(result));
    }
}
