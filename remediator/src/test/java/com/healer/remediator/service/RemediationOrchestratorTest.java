package com.healer.remediator.service;

import com.healer.remediator.client.ExternalCallException;
import com.healer.remediator.client.JobClient;
import com.healer.remediator.client.JobPhase;
import com.healer.remediator.client.JobSpec;
import com.healer.remediator.client.LogSource;
import com.healer.remediator.client.PullRequestClient;
import com.healer.remediator.client.PullRequestState;
import com.healer.remediator.config.HealerProperties;
import com.healer.remediator.dedup.DeduplicationFilter;
import com.healer.remediator.diagnosis.DiagnosisEngine;
import com.healer.remediator.escalation.AttemptSummary;
import com.healer.remediator.escalation.EscalationDispatcher;
import com.healer.remediator.escalation.FailureDetails;
import com.healer.remediator.model.*;
import com.healer.remediator.naming.RemediationJobNames;
import com.healer.remediator.repository.AlertRepository;
import com.healer.remediator.repository.RemediationAttemptRepository;
import com.healer.remediator.repository.RemediationUnitRepository;
import com.healer.remediator.success.CriterionResult;
import com.healer.remediator.success.EvaluationState;
import com.healer.remediator.success.SuccessAssessment;
import com.healer.remediator.success.SuccessCriterion;
import com.healer.remediator.success.SuccessEvaluator;
import com.healer.remediator.tracker.Batch;
import com.healer.remediator.tracker.BatchTracker;
import com.healer.remediator.tracker.Stage;
import com.healer.remediator.tracker.TaskState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RemediationOrchestrator.
 *
 * Repositories are Mockito mocks backed by in-memory lists so that dedup
 * and the attempt history behave as they would against the database.
 * Job, log and PR clients are plain mocks.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RemediationOrchestratorTest {

    @Mock RemediationUnitRepository    unitRepo;
    @Mock RemediationAttemptRepository attemptRepo;
    @Mock AlertRepository              alertRepo;
    @Mock BatchTracker                 tracker;
    @Mock SuccessEvaluator             successEvaluator;
    @Mock EscalationDispatcher         escalation;
    @Mock JobClient                    jobClient;
    @Mock LogSource                    logSource;
    @Mock PullRequestClient            prClient;

    final List<RemediationUnit>    units    = new ArrayList<>();
    final List<RemediationAttempt> attempts = new ArrayList<>();
    final List<Alert>              alerts   = new ArrayList<>();

    SimpleMeterRegistry     registry = new SimpleMeterRegistry();
    HealerProperties        props    = new HealerProperties();
    RemediationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        wireRepositories();
        when(jobClient.submit(any())).thenAnswer(inv -> ((JobSpec) inv.getArgument(0)).name());
        when(logSource.jobLogs(anyString(), anyInt())).thenReturn("error: test suite failed");

        orchestrator = new RemediationOrchestrator(
                unitRepo, attemptRepo, alertRepo,
                new DeduplicationFilter(unitRepo, alertRepo, registry, props),
                new DiagnosisEngine(),
                tracker, successEvaluator, escalation,
                jobClient, logSource, prClient,
                new RemediationJobNames(63),
                new AgentSelector(props),
                registry, props);
    }

    // ------------------------------------------------------------------
    // ingest()
    // ------------------------------------------------------------------

    @Test
    void duplicateSignal_yieldsOneUnitAndOneJob() {
        IngestResult first  = orchestrator.ingest(signal("a7", "pod-123"));
        IngestResult second = orchestrator.ingest(signal("a7", "pod-123"));

        assertThat(first.outcome()).isEqualTo(IngestResult.Outcome.ACCEPTED);
        assertThat(second.outcome()).isEqualTo(IngestResult.Outcome.SUPPRESSED);
        assertThat(second.unitId()).isEqualTo(first.unitId());
        assertThat(units).hasSize(1);
        verify(jobClient, times(1)).submit(any());
    }

    @Test
    void ingest_startsFirstAttemptWithDiagnosisAndAlert() {
        IngestResult result = orchestrator.ingest(signal("a7", "pod-123"));

        RemediationUnit unit = units.get(0);
        assertThat(result.unitId()).contains(unit.getId());
        assertThat(unit.getStatus()).isEqualTo(RemediationStatus.IN_PROGRESS);
        assertThat(unit.getAttemptCount()).isEqualTo(1);
        assertThat(unit.getDiagnosisSummary()).isEqualTo("Test failure");
        assertThat(attempts).singleElement().satisfies(a -> {
            assertThat(a.getAgent()).isEqualTo("rex");
            assertThat(a.getJobRef()).startsWith("healer-fix-pod-123-");
        });
        assertThat(alerts).singleElement()
                .satisfies(a -> assertThat(a.getTitle()).isEqualTo("[HEAL-A7] Pod Failure: pod-123"));
    }

    @Test
    void excludedSignal_isDroppedWithoutSideEffects() {
        IngestResult result = orchestrator.ingest(Signal.of("a7", "pod-123", Severity.HIGH,
                Map.of(Signal.EXCLUDE_LABEL, "true")));

        assertThat(result.outcome()).isEqualTo(IngestResult.Outcome.EXCLUDED);
        assertThat(units).isEmpty();
        verifyNoInteractions(jobClient);
    }

    @Test
    void unreachableLogSource_degradesAndIsCounted() {
        when(logSource.jobLogs(anyString(), anyInt())).thenThrow(new ExternalCallException("logs down"));

        IngestResult result = orchestrator.ingest(signal("a7", "pod-123"));

        assertThat(result.outcome()).isEqualTo(IngestResult.Outcome.ACCEPTED);
        assertThat(units.get(0).getDiagnosisCategory()).isEqualTo("UNKNOWN");
        assertThat(registry.counter("healer.context.failures", "source", "job-logs").count()).isEqualTo(1.0);
    }

    @Test
    void submissionFailure_countsAsFailedAttempt() {
        when(jobClient.submit(any())).thenThrow(new ExternalCallException("jobs API 503", 503));

        orchestrator.ingest(signal("a7", "pod-123"));

        RemediationUnit unit = units.get(0);
        assertThat(unit.getStatus()).isEqualTo(RemediationStatus.FAILED);
        assertThat(unit.getAttemptCount()).isEqualTo(1);
        assertThat(attempts.get(0).getOutcome()).isEqualTo(AttemptOutcome.AGENT_FAILED);
    }

    @Test
    void plainTaskId_getsRemediationJobNameThatParsesBack() {
        orchestrator.ingest(Signal.of("a7", "play-task-42", Severity.HIGH, Map.of(Signal.TASK_LABEL, "42")));

        String jobRef = attempts.get(0).getJobRef();
        assertThat(jobRef).startsWith("heal-remediation-task42-a7-");
        assertThat(new RemediationJobNames(63).taskId(jobRef)).contains("42");
    }

    @Test
    void taskIdWithSeparator_getsFixJobName() {
        orchestrator.ingest(Signal.of("a7", "play-task-12-a7", Severity.HIGH, Map.of(Signal.TASK_LABEL, "12-a7")));

        assertThat(attempts.get(0).getJobRef()).startsWith("healer-fix-play-task-12-a7-");
    }

    // ------------------------------------------------------------------
    // advance()
    // ------------------------------------------------------------------

    @Test
    void threeFailures_escalateExactlyOnceWithAllAttempts() {
        when(jobClient.getStatus(anyString())).thenReturn(JobPhase.FAILED);
        UUID id = orchestrator.ingest(signal("a7", "pod-123")).unitId().orElseThrow();

        for (int i = 0; i < 10; i++) {
            orchestrator.advance(id);
        }

        RemediationUnit unit = units.get(0);
        assertThat(unit.getStatus()).isEqualTo(RemediationStatus.ESCALATED);
        assertThat(unit.getAttemptCount()).isEqualTo(3);
        verify(jobClient, times(3)).submit(any());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<AttemptSummary>> summaries = ArgumentCaptor.forClass(List.class);
        verify(escalation, times(1)).escalate(any(FailureDetails.class), summaries.capture(), eq("pod-123"));
        assertThat(summaries.getValue()).extracting(AttemptSummary::agent)
                .containsExactly("rex", "rex", "atlas");
        assertThat(summaries.getValue()).extracting(AttemptSummary::outcome)
                .containsOnly(AttemptOutcome.AGENT_FAILED);
    }

    @Test
    void jobSucceeded_withoutPullRequest_succeedsAndClosesAlert() {
        when(jobClient.getStatus(anyString())).thenReturn(JobPhase.SUCCEEDED);
        UUID id = orchestrator.ingest(signal("a7", "pod-123")).unitId().orElseThrow();

        orchestrator.advance(id);

        assertThat(units.get(0).getStatus()).isEqualTo(RemediationStatus.SUCCEEDED);
        assertThat(attempts.get(0).getOutcome()).isEqualTo(AttemptOutcome.SUCCESS);
        assertThat(alerts.get(0).isOpen()).isFalse();
        verifyNoInteractions(successEvaluator);
    }

    @Test
    void jobSucceeded_butCriteriaNotMet_failsWithChecksFailing() {
        props.getTracker().setBatchId("b1");
        TaskState task = TaskState.failed("42", Stage.TESTING, "tests red").withLinks(17, null, null, "org/repo");
        when(tracker.loadBatch("b1")).thenReturn(Batch.of("b1", "org/repo", List.of(task)));
        when(prClient.getPullRequest("org/repo", 17))
                .thenReturn(new PullRequestState(17, "open", true, "abc", 0, 1, 2, List.of("clippy")));
        when(jobClient.getStatus(anyString())).thenReturn(JobPhase.SUCCEEDED);
        SuccessAssessment below = new SuccessAssessment(null,
                List.of(CriterionResult.failed(SuccessCriterion.STATUS_CHECKS_PASSED, "Failed checks: clippy")),
                0.5, false, "Success criteria not fully met (50.0% confidence)");
        when(successEvaluator.evaluate(any(), any())).thenReturn(below);
        when(successEvaluator.breakdown(below)).thenReturn("breakdown text");

        UUID id = orchestrator.ingest(Signal.of("a7", "play-task-42", Severity.HIGH,
                Map.of(Signal.TASK_LABEL, "42"))).unitId().orElseThrow();
        orchestrator.advance(id);

        RemediationUnit unit = units.get(0);
        assertThat(unit.getStatus()).isEqualTo(RemediationStatus.FAILED);
        assertThat(unit.getLastFailureReason()).isEqualTo("breakdown text");
        assertThat(attempts.get(0).getJobRef()).startsWith("heal-remediation-task42-a7-");
        assertThat(attempts.get(0).getOutcome()).isEqualTo(AttemptOutcome.CHECKS_FAILING);

        ArgumentCaptor<EvaluationState> state = ArgumentCaptor.forClass(EvaluationState.class);
        verify(successEvaluator).evaluate(eq(id), state.capture());
        assertThat(state.getValue().prNumber()).contains(17);
        verify(tracker).recordRemediation(eq("b1"), eq("42"), startsWith("heal-remediation-task42-a7-"), eq("Test failure"));
    }

    @Test
    void runningPastTimeout_deletesJobAndFails() {
        when(jobClient.getStatus(anyString())).thenReturn(JobPhase.RUNNING);
        UUID id = orchestrator.ingest(signal("a7", "pod-123")).unitId().orElseThrow();
        attempts.get(0).setStartedAt(Instant.now().minus(2, ChronoUnit.HOURS));

        orchestrator.advance(id);

        verify(jobClient).delete(attempts.get(0).getJobRef());
        assertThat(attempts.get(0).getOutcome()).isEqualTo(AttemptOutcome.TIMEOUT);
        assertThat(units.get(0).getStatus()).isEqualTo(RemediationStatus.FAILED);
    }

    @Test
    void runningWithinTimeout_staysInProgress() {
        when(jobClient.getStatus(anyString())).thenReturn(JobPhase.RUNNING);
        UUID id = orchestrator.ingest(signal("a7", "pod-123")).unitId().orElseThrow();

        orchestrator.advance(id);

        assertThat(units.get(0).getStatus()).isEqualTo(RemediationStatus.IN_PROGRESS);
        assertThat(attempts.get(0).isFinished()).isFalse();
    }

    @Test
    void vanishedJob_cancelsUnit() {
        when(jobClient.getStatus(anyString())).thenReturn(JobPhase.NOT_FOUND);
        UUID id = orchestrator.ingest(signal("a7", "pod-123")).unitId().orElseThrow();

        orchestrator.advance(id);

        assertThat(units.get(0).getStatus()).isEqualTo(RemediationStatus.CANCELLED);
        assertThat(attempts.get(0).getOutcome()).isEqualTo(AttemptOutcome.CANCELLED);
    }

    // ------------------------------------------------------------------
    // cancel()
    // ------------------------------------------------------------------

    @Test
    void cancel_deletesJobsAndCancelsOpenUnits() {
        orchestrator.ingest(Signal.of("a7", "play-task-42", Severity.HIGH, Map.of(Signal.TASK_LABEL, "42")));
        String jobRef = units.get(0).getJobRef();

        int cancelled = orchestrator.cancel("42");

        assertThat(cancelled).isEqualTo(1);
        assertThat(units.get(0).getStatus()).isEqualTo(RemediationStatus.CANCELLED);
        verify(jobClient).delete(jobRef);
        verify(jobClient).deleteMatching(Map.of(Signal.TASK_LABEL, "42"));
        assertThat(orchestrator.openUnitIds()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Signal signal(String type, String target) {
        return Signal.of(type, target, Severity.HIGH, Map.of());
    }

    @SuppressWarnings("unchecked")
    private void wireRepositories() {
        when(unitRepo.save(any())).thenAnswer(inv -> {
            RemediationUnit u = inv.getArgument(0);
            if (u.getId() == null) setId(u, UUID.randomUUID());
            if (!units.contains(u)) units.add(u);
            return u;
        });
        when(unitRepo.findById(any())).thenAnswer(inv ->
                units.stream().filter(u -> u.getId().equals(inv.getArgument(0))).findFirst());
        when(unitRepo.findBySignalTypeAndTargetAndStatusIn(any(), any(), any())).thenAnswer(inv ->
                units.stream()
                        .filter(u -> u.getSignalType().equals(inv.getArgument(0)))
                        .filter(u -> u.getTarget().equals(inv.getArgument(1)))
                        .filter(u -> ((Collection<RemediationStatus>) inv.getArgument(2)).contains(u.getStatus()))
                        .toList());
        when(unitRepo.findByStatusIn(any())).thenAnswer(inv ->
                units.stream()
                        .filter(u -> ((Collection<RemediationStatus>) inv.getArgument(0)).contains(u.getStatus()))
                        .toList());
        when(unitRepo.findByTaskIdAndStatusIn(any(), any())).thenAnswer(inv ->
                units.stream()
                        .filter(u -> inv.getArgument(0).equals(u.getTaskId()))
                        .filter(u -> ((Collection<RemediationStatus>) inv.getArgument(1)).contains(u.getStatus()))
                        .toList());

        when(attemptRepo.save(any())).thenAnswer(inv -> {
            RemediationAttempt a = inv.getArgument(0);
            if (a.getId() == null) setId(a, UUID.randomUUID());
            if (!attempts.contains(a)) attempts.add(a);
            return a;
        });
        when(attemptRepo.findByUnitIdOrderByAttemptNumberAsc(any())).thenAnswer(inv ->
                attemptsOf(inv.getArgument(0)));
        when(attemptRepo.findFirstByUnitIdOrderByAttemptNumberDesc(any())).thenAnswer(inv -> {
            List<RemediationAttempt> list = attemptsOf(inv.getArgument(0));
            return list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1));
        });

        when(alertRepo.save(any())).thenAnswer(inv -> {
            Alert a = inv.getArgument(0);
            if (a.getId() == null) setId(a, UUID.randomUUID());
            if (!alerts.contains(a)) alerts.add(a);
            return a;
        });
        when(alertRepo.findByAlertTypeAndOpenTrueAndCreatedAtAfter(any(), any())).thenAnswer(inv ->
                alerts.stream()
                        .filter(a -> a.getAlertType().equals(inv.getArgument(0)) && a.isOpen())
                        .filter(a -> a.getCreatedAt().isAfter(inv.getArgument(1)))
                        .toList());
        when(alertRepo.findByAlertTypeAndTargetAndOpenTrue(any(), any())).thenAnswer(inv ->
                alerts.stream()
                        .filter(a -> a.getAlertType().equals(inv.getArgument(0)))
                        .filter(a -> a.getTarget().equals(inv.getArgument(1)) && a.isOpen())
                        .toList());
    }

    private List<RemediationAttempt> attemptsOf(UUID unitId) {
        return attempts.stream()
                .filter(a -> a.getUnit().getId().equals(unitId))
                .sorted(Comparator.comparingInt(RemediationAttempt::getAttemptNumber))
                .toList();
    }

    private static void setId(Object entity, UUID id) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
