package com.healer.remediator.api;

import com.healer.remediator.api.dto.AttemptResponse;
import com.healer.remediator.api.dto.RemediationResponse;
import com.healer.remediator.service.RemediationOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read and cancel remediations.
 *
 * GET  /remediations/{id}               current state of one unit
 * GET  /remediations/{id}/attempts      its attempts, oldest first
 * POST /remediations/cancel/{taskId}    cancel every open unit of a task
 */
@RestController
@RequestMapping("/remediations")
public class RemediationController {

    private final RemediationOrchestrator orchestrator;

    public RemediationController(RemediationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/{id}")
    public RemediationResponse get(@PathVariable UUID id) {
        return orchestrator.findById(id)
                .map(RemediationResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Remediation not found: " + id));
    }

    @GetMapping("/{id}/attempts")
    public List<AttemptResponse> attempts(@PathVariable UUID id) {
        orchestrator.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Remediation not found: " + id));
        return orchestrator.getAttempts(id).stream()
                .map(AttemptResponse::from)
                .toList();
    }

    /** Always 200; cancelled is 0 when the task had nothing open. */
    @PostMapping("/cancel/{taskId}")
    public Map<String, Object> cancel(@PathVariable String taskId) {
        int cancelled = orchestrator.cancel(taskId);
        return Map.of("taskId", taskId, "cancelled", cancelled);
    }
}
