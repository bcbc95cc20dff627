package com.healer.remediator.api;

import com.healer.remediator.model.AttemptOutcome;
import com.healer.remediator.model.RemediationAttempt;
import com.healer.remediator.model.RemediationUnit;
import com.healer.remediator.model.Severity;
import com.healer.remediator.model.Signal;
import com.healer.remediator.service.RemediationOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RemediationController.class)
class RemediationControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean RemediationOrchestrator orchestrator;

    // ------------------------------------------------------------------
    // GET /remediations/{id}
    // ------------------------------------------------------------------

    @Test
    void getRemediation_existingId_returns200() throws Exception {
        RemediationUnit unit = fakeUnit();
        unit.startAttempt("heal-remediation-task42-a7-abcd1234");
        when(orchestrator.findById(unit.getId())).thenReturn(Optional.of(unit));

        mockMvc.perform(get("/remediations/{id}", unit.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IN_PROGRESS"))
                .andExpect(jsonPath("$.attemptCount").value(1))
                .andExpect(jsonPath("$.taskId").value("42"))
                .andExpect(jsonPath("$.jobRef").value("heal-remediation-task42-a7-abcd1234"));
    }

    @Test
    void getRemediation_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(orchestrator.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/remediations/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /remediations/{id}/attempts
    // ------------------------------------------------------------------

    @Test
    void getAttempts_listsAttemptsInOrder() throws Exception {
        RemediationUnit unit = fakeUnit();
        RemediationAttempt first = new RemediationAttempt(unit, 1, "rex", "job-1");
        first.complete(AttemptOutcome.AGENT_FAILED, "boom");
        RemediationAttempt second = new RemediationAttempt(unit, 2, "rex", "job-2");
        when(orchestrator.findById(unit.getId())).thenReturn(Optional.of(unit));
        when(orchestrator.getAttempts(unit.getId())).thenReturn(List.of(first, second));

        mockMvc.perform(get("/remediations/{id}/attempts", unit.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].attemptNumber").value(1))
                .andExpect(jsonPath("$[0].outcome").value("AGENT_FAILED"))
                .andExpect(jsonPath("$[0].failureReason").value("boom"))
                .andExpect(jsonPath("$[1].outcome").doesNotExist());
    }

    @Test
    void getAttempts_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(orchestrator.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/remediations/{id}/attempts", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /remediations/cancel/{taskId}
    // ------------------------------------------------------------------

    @Test
    void cancel_returnsCount() throws Exception {
        when(orchestrator.cancel("42")).thenReturn(2);

        mockMvc.perform(post("/remediations/cancel/{taskId}", "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taskId").value("42"))
                .andExpect(jsonPath("$.cancelled").value(2));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private RemediationUnit fakeUnit() {
        RemediationUnit unit = new RemediationUnit(
                Signal.of("a7", "play-task-42", Severity.HIGH, Map.of(Signal.TASK_LABEL, "42")));
        try {
            var f = unit.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(unit, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return unit;
    }
}
