package com.healer.remediator.service;

import com.healer.remediator.client.ExternalCallException;
import com.healer.remediator.client.JobClient;
import com.healer.remediator.client.JobPhase;
import com.healer.remediator.client.JobSpec;
import com.healer.remediator.client.LogSource;
import com.healer.remediator.client.PullRequestClient;
import com.healer.remediator.client.PullRequestState;
import com.healer.remediator.config.HealerProperties;
import com.healer.remediator.dedup.DedupDecision;
import com.healer.remediator.dedup.DeduplicationFilter;
import com.healer.remediator.diagnosis.Diagnosis;
import com.healer.remediator.diagnosis.DiagnosisContext;
import com.healer.remediator.diagnosis.DiagnosisEngine;
import com.healer.remediator.escalation.AttemptSummary;
import com.healer.remediator.escalation.EscalationDispatcher;
import com.healer.remediator.escalation.FailureDetails;
import com.healer.remediator.model.*;
import com.healer.remediator.naming.RemediationJobNames;
import com.healer.remediator.repository.AlertRepository;
import com.healer.remediator.repository.RemediationAttemptRepository;
import com.healer.remediator.repository.RemediationUnitRepository;
import com.healer.remediator.success.EvaluationState;
import com.healer.remediator.success.SuccessAssessment;
import com.healer.remediator.success.SuccessEvaluator;
import com.healer.remediator.tracker.Batch;
import com.healer.remediator.tracker.BatchTracker;
import com.healer.remediator.tracker.TaskState;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives remediation units through their lifecycle.
 *
 *   ingest()   signal → dedup → new unit → first attempt
 *   advance()  one poll step for one unit:
 *                IN_PROGRESS  read the job phase, score success, close the attempt
 *                FAILED       start the next attempt, or escalate once attempts run out
 *                PENDING      start the first attempt (recovers a unit saved before its job)
 *   cancel()   stop every open unit of a task
 *
 * Attempts for one unit are strictly sequential: the next job is only
 * spawned after the previous attempt has an outcome.
 */
@Service
public class RemediationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RemediationOrchestrator.class);

    static final int LOG_TAIL_LINES   = 200;
    static final int ERROR_TAIL_LINES = 50;

    static final Set<RemediationStatus> OPEN = EnumSet.of(
            RemediationStatus.PENDING, RemediationStatus.IN_PROGRESS, RemediationStatus.FAILED);

    private final RemediationUnitRepository    unitRepo;
    private final RemediationAttemptRepository attemptRepo;
    private final AlertRepository              alertRepo;
    private final DeduplicationFilter          dedup;
    private final DiagnosisEngine              diagnosisEngine;
    private final BatchTracker                 tracker;
    private final SuccessEvaluator             successEvaluator;
    private final EscalationDispatcher         escalation;
    private final JobClient                    jobClient;
    private final LogSource                    logSource;
    private final PullRequestClient            prClient;
    private final RemediationJobNames          names;
    private final AgentSelector                agentSelector;
    private final MeterRegistry                meterRegistry;
    private final HealerProperties             props;

    public RemediationOrchestrator(RemediationUnitRepository unitRepo,
                                   RemediationAttemptRepository attemptRepo,
                                   AlertRepository alertRepo,
                                   DeduplicationFilter dedup,
                                   DiagnosisEngine diagnosisEngine,
                                   BatchTracker tracker,
                                   SuccessEvaluator successEvaluator,
                                   EscalationDispatcher escalation,
                                   JobClient jobClient,
                                   LogSource logSource,
                                   PullRequestClient prClient,
                                   RemediationJobNames names,
                                   AgentSelector agentSelector,
                                   MeterRegistry meterRegistry,
                                   HealerProperties props) {
        this.unitRepo         = unitRepo;
        this.attemptRepo      = attemptRepo;
        this.alertRepo        = alertRepo;
        this.dedup            = dedup;
        this.diagnosisEngine  = diagnosisEngine;
        this.tracker          = tracker;
        this.successEvaluator = successEvaluator;
        this.escalation       = escalation;
        this.jobClient        = jobClient;
        this.logSource        = logSource;
        this.prClient         = prClient;
        this.names            = names;
        this.agentSelector    = agentSelector;
        this.meterRegistry    = meterRegistry;
        this.props            = props;
    }

    // ------------------------------------------------------------------
    // Ingestion
    // ------------------------------------------------------------------

    /**
     * Admit a signal.
     *
     * Steps:
     *  1. Drop signals carrying the exclude label
     *  2. Ask the dedup filter; suppress if either check fires
     *  3. Save a new PENDING unit and open a human-facing alert for it
     *  4. Start the first attempt
     */
    @Transactional
    public IngestResult ingest(Signal signal) {
        if (signal.excluded()) {
            log.debug("Ignoring excluded signal {} ({})", signal.fingerprint(), signal.target());
            return IngestResult.excluded();
        }

        DedupDecision decision = dedup.check(signal);
        if (decision.shouldSuppress()) {
            return IngestResult.suppressed(decision);
        }

        RemediationUnit unit = unitRepo.save(new RemediationUnit(signal));
        alertRepo.save(new Alert(signal.type(), signal.target(),
                AlertType.alertTitle(signal.type(), signal.target())));
        meterRegistry.counter("healer.remediation.units",
                "type", signal.type(), "family", Fingerprints.workflowFamily(signal.target())).increment();
        log.info("Remediation {} created for {} on {} (task={})",
                unit.getId(), signal.type(), signal.target(), unit.getTaskId());

        startAttempt(unit, currentBatch());
        return IngestResult.accepted(unit.getId());
    }

    // ------------------------------------------------------------------
    // Poll step
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public List<UUID> openUnitIds() {
        return unitRepo.findByStatusIn(OPEN).stream().map(RemediationUnit::getId).toList();
    }

    /** Move one unit forward by at most one step. Unknown or terminal units are ignored. */
    @Transactional
    public void advance(UUID unitId) {
        RemediationUnit unit = unitRepo.findById(unitId).orElse(null);
        if (unit == null || unit.getStatus().isTerminal()) {
            return;
        }
        switch (unit.getStatus()) {
            case PENDING     -> startAttempt(unit, currentBatch());
            case IN_PROGRESS -> checkAttempt(unit);
            case FAILED      -> retryOrEscalate(unit);
            default          -> { }
        }
    }

    /**
     * Look at the running job of an IN_PROGRESS unit and close the attempt
     * if the job has finished, timed out or disappeared.
     */
    void checkAttempt(RemediationUnit unit) {
        Optional<RemediationAttempt> current =
                attemptRepo.findFirstByUnitIdOrderByAttemptNumberDesc(unit.getId());
        if (current.isEmpty() || current.get().isFinished()) {
            log.warn("Remediation {} is IN_PROGRESS without a running attempt, marking failed", unit.getId());
            fail(unit, current.orElse(null), AttemptOutcome.AGENT_FAILED, "Attempt record missing");
            return;
        }
        RemediationAttempt attempt = current.get();
        Duration timeout = props.getRemediation().getAttemptTimeout();

        JobPhase phase;
        try {
            phase = jobClient.getStatus(attempt.getJobRef());
        } catch (ExternalCallException e) {
            log.warn("Remediation {}: status of job {} unavailable: {}",
                    unit.getId(), attempt.getJobRef(), e.getMessage());
            meterRegistry.counter("healer.context.failures", "source", "job-status").increment();
            if (attempt.duration().compareTo(timeout) > 0) {
                timeOut(unit, attempt, timeout);
            }
            return;
        }

        switch (phase) {
            case PENDING, RUNNING -> {
                if (attempt.duration().compareTo(timeout) > 0) {
                    timeOut(unit, attempt, timeout);
                }
            }
            case SUCCEEDED -> jobSucceeded(unit, attempt);
            case FAILED    -> fail(unit, attempt, AttemptOutcome.AGENT_FAILED,
                    "Job " + attempt.getJobRef() + " failed\n" + jobLogTail(attempt.getJobRef()));
            case NOT_FOUND -> {
                // deleted out of band, most likely a cancellation that has not reached us yet
                log.info("Remediation {}: job {} no longer exists, treating as cancelled",
                        unit.getId(), attempt.getJobRef());
                attempt.complete(AttemptOutcome.CANCELLED, "Job disappeared");
                attemptRepo.save(attempt);
                unit.transitionTo(RemediationStatus.CANCELLED);
                unitRepo.save(unit);
            }
        }
    }

    private void jobSucceeded(RemediationUnit unit, RemediationAttempt attempt) {
        EvaluationState state = evaluationState(unit);
        if (!state.hasPullRequest()) {
            succeed(unit, attempt, "Job completed; no pull request to verify");
            return;
        }
        SuccessAssessment assessment = successEvaluator.evaluate(unit.getId(), state);
        if (assessment.success()) {
            succeed(unit, attempt, assessment.summary());
        } else {
            fail(unit, attempt, AttemptOutcome.CHECKS_FAILING, successEvaluator.breakdown(assessment));
        }
    }

    private void succeed(RemediationUnit unit, RemediationAttempt attempt, String detail) {
        attempt.complete(AttemptOutcome.SUCCESS, null);
        attemptRepo.save(attempt);
        unit.transitionTo(RemediationStatus.SUCCEEDED);
        unitRepo.save(unit);
        closeAlerts(unit);
        meterRegistry.counter("healer.remediation.outcomes", "status", "succeeded").increment();
        log.info("Remediation {} SUCCEEDED after {} attempt(s): {}", unit.getId(), unit.getAttemptCount(), detail);
    }

    private void fail(RemediationUnit unit, RemediationAttempt attempt, AttemptOutcome outcome, String reason) {
        if (attempt != null && !attempt.isFinished()) {
            attempt.complete(outcome, reason);
            attemptRepo.save(attempt);
        }
        unit.setLastFailureReason(reason);
        unit.transitionTo(RemediationStatus.FAILED);
        unitRepo.save(unit);
        log.warn("Remediation {} attempt {}/{} failed ({})",
                unit.getId(), unit.getAttemptCount(), props.getRemediation().getMaxAttempts(), outcome);
    }

    private void timeOut(RemediationUnit unit, RemediationAttempt attempt, Duration timeout) {
        try {
            jobClient.delete(attempt.getJobRef());
        } catch (ExternalCallException e) {
            log.warn("Remediation {}: could not delete timed-out job {}: {}",
                    unit.getId(), attempt.getJobRef(), e.getMessage());
        }
        fail(unit, attempt, AttemptOutcome.TIMEOUT,
                "Job " + attempt.getJobRef() + " did not finish within " + timeout.toMinutes() + " minutes");
    }

    /** FAILED unit: spawn the next attempt, or escalate when the budget is spent. */
    void retryOrEscalate(RemediationUnit unit) {
        int max = props.getRemediation().getMaxAttempts();
        if (unit.getAttemptCount() >= max) {
            escalate(unit);
        } else {
            startAttempt(unit, currentBatch());
        }
    }

    private void escalate(RemediationUnit unit) {
        List<RemediationAttempt> attempts = attemptRepo.findByUnitIdOrderByAttemptNumberAsc(unit.getId());
        unit.transitionTo(RemediationStatus.ESCALATED);
        unitRepo.save(unit);
        meterRegistry.counter("healer.remediation.outcomes", "status", "escalated").increment();
        log.error("Remediation {} ESCALATED after {} attempts on {}",
                unit.getId(), attempts.size(), unit.getTarget());

        escalation.escalate(failureDetails(unit),
                attempts.stream().map(AttemptSummary::from).toList(),
                unit.getTarget());
    }

    // ------------------------------------------------------------------
    // Attempts
    // ------------------------------------------------------------------

    /**
     * Diagnose and spawn the next corrective job.
     *
     * The attempt count goes up even when submission fails, so a job API
     * that keeps rejecting submissions still ends in escalation.
     */
    void startAttempt(RemediationUnit unit, Optional<Batch> batch) {
        DiagnosisContext context = gatherContext(unit, batch);
        Diagnosis diagnosis = diagnose(context);
        unit.setDiagnosisCategory(diagnosis.category().name());
        unit.setDiagnosisSummary(diagnosis.summary());
        unit.setSuggestedFix(diagnosis.suggestedFix());

        List<RemediationAttempt> previous = attemptRepo.findByUnitIdOrderByAttemptNumberAsc(unit.getId());
        String workflow = batch.flatMap(b -> Optional.ofNullable(unit.getTaskId()).flatMap(b::task))
                .map(TaskState::workflowName)
                .orElse(null);
        String agent = agentSelector.select(
                new RoutingContext(diagnosis.category(), workflow, context.logs(), diagnosis.relevantFiles()),
                previous);
        JobSpec spec = buildJobSpec(unit, diagnosis, agent, unit.getAttemptCount() + 1);

        String jobRef;
        try {
            jobRef = jobClient.submit(spec);
        } catch (ExternalCallException e) {
            log.warn("Remediation {}: job submission failed: {}", unit.getId(), e.getMessage());
            meterRegistry.counter("healer.context.failures", "source", "job-submit").increment();
            unit.startAttempt(spec.name());
            RemediationAttempt attempt = attemptRepo.save(
                    new RemediationAttempt(unit, unit.getAttemptCount(), agent, spec.name()));
            fail(unit, attempt, AttemptOutcome.AGENT_FAILED, "Job submission failed: " + e.getMessage());
            return;
        }

        unit.startAttempt(jobRef);
        unitRepo.save(unit);
        attemptRepo.save(new RemediationAttempt(unit, unit.getAttemptCount(), agent, jobRef));
        log.info("Remediation {} attempt {} spawned job {} (agent={}, diagnosis={})",
                unit.getId(), unit.getAttemptCount(), jobRef, agent, diagnosis.summary());
        recordOnTask(unit, jobRef, diagnosis);
    }

    /**
     * Collect logs, failure text and PR state for diagnosis.
     *
     * Job logs are tried first, workflow logs second. Each source fails on
     * its own and leaves its part of the context empty.
     */
    public DiagnosisContext gatherContext(RemediationUnit unit, Optional<Batch> batch) {
        Optional<TaskState> task = batch.flatMap(b -> Optional.ofNullable(unit.getTaskId()).flatMap(b::task));

        String jobRef = task.map(TaskState::jobRef).orElse(unit.getTarget());
        String logs = "";
        if (jobRef != null) {
            logs = quietly("job-logs", unit, () -> logSource.jobLogs(jobRef, LOG_TAIL_LINES));
        }
        String workflow = task.map(TaskState::workflowName).orElse(null);
        if (logs.isBlank() && workflow != null) {
            logs = quietly("workflow-logs", unit, () -> logSource.workflowLogs(workflow, LOG_TAIL_LINES));
        }

        String agentOutput = Optional.ofNullable(unit.getLastFailureReason())
                .or(() -> task.map(TaskState::failureReason))
                .orElse("");

        Optional<PullRequestState> pr = Optional.empty();
        String repository = repositoryFor(task, batch);
        if (task.flatMap(TaskState::pr).isPresent() && !repository.isBlank()) {
            int number = task.get().prNumber();
            try {
                pr = Optional.of(prClient.getPullRequest(repository, number));
            } catch (ExternalCallException e) {
                contextFailure("pull-request", unit, e);
            }
        }
        return new DiagnosisContext(logs, agentOutput, pr);
    }

    public Diagnosis diagnose(DiagnosisContext context) {
        return diagnosisEngine.diagnose(context);
    }

    /**
     * Build and submit a corrective job for the given task outside the unit
     * lifecycle. Used for one-off fixes; the job is labelled with the task id
     * so cancel() can find it.
     */
    public String spawnFix(String taskId, Diagnosis diagnosis) {
        String agent = agentSelector.select(
                new RoutingContext(diagnosis.category(), null, "", diagnosis.relevantFiles()), List.of());
        String name = names.fixJobName("task" + taskId, shortId()).value();
        Map<String, String> labels = new HashMap<>();
        labels.put(Signal.TASK_LABEL, RemediationJobNames.sanitizeLabelValue(taskId));
        labels.put("remediation", "true");
        JobSpec spec = new JobSpec(name, props.getRemediation().getNamespace(), agent,
                prompt(taskId, diagnosis), labels, Map.of("diagnosis-category", diagnosis.category().name()));
        return jobClient.submit(spec);
    }

    JobSpec buildJobSpec(RemediationUnit unit, Diagnosis diagnosis, String agent, int attemptNumber) {
        String taskId = unit.getTaskId();
        String name = RemediationJobNames.isNameable(taskId, unit.getSignalType())
                ? names.remediationJobName(taskId, unit.getSignalType(), shortId()).value()
                : names.fixJobName(unit.getTarget(), shortId()).value();

        Map<String, String> labels = new HashMap<>();
        if (taskId != null) {
            labels.put(Signal.TASK_LABEL, RemediationJobNames.sanitizeLabelValue(taskId));
        }
        labels.put("alert-type",  RemediationJobNames.sanitizeLabelValue(unit.getSignalType()));
        labels.put("target-pod",  RemediationJobNames.sanitizeLabelValue(unit.getTarget()));
        labels.put("remediation", "true");
        labels.put("unit-id",     String.valueOf(unit.getId()));
        labels.put("attempt",     String.valueOf(attemptNumber));

        Map<String, String> params = new HashMap<>();
        params.put("diagnosis-category", diagnosis.category().name());
        params.put("max-attempts", String.valueOf(props.getRemediation().getMaxAttempts()));
        if (!diagnosis.relevantFiles().isEmpty()) {
            params.put("relevant-files", String.join(",", diagnosis.relevantFiles()));
        }
        return new JobSpec(name, props.getRemediation().getNamespace(), agent,
                prompt(taskId != null ? taskId : unit.getTarget(), diagnosis), labels, params);
    }

    static String prompt(String subject, Diagnosis diagnosis) {
        String files = diagnosis.relevantFiles().isEmpty()
                ? "(none identified)"
                : String.join("\n", diagnosis.relevantFiles().stream().map(f -> "- " + f).toList());
        return """
                # Remediation for %s

                ## Diagnosis
                - **Category**: %s
                - **Summary**: %s

                ## Suggested Fix
                %s

                ## Relevant Files
                %s

                ## Instructions
                1. Analyze the issue described above
                2. Implement the suggested fix
                3. Run tests to verify the fix
                4. Push changes to the existing PR branch
                """.formatted(subject, diagnosis.category(), diagnosis.summary(),
                diagnosis.suggestedFix(), files);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Stop every open unit of a task. The running job is deleted first; a
     * job deleted here but still visible to a concurrent poll is seen as
     * NOT_FOUND and handled there.
     *
     * @return number of units cancelled
     */
    @Transactional
    public int cancel(String taskId) {
        List<RemediationUnit> units = unitRepo.findByTaskIdAndStatusIn(taskId, OPEN);
        for (RemediationUnit unit : units) {
            if (unit.getJobRef() != null) {
                try {
                    jobClient.delete(unit.getJobRef());
                } catch (ExternalCallException e) {
                    log.warn("Cancel task {}: could not delete job {}: {}", taskId, unit.getJobRef(), e.getMessage());
                }
            }
            attemptRepo.findFirstByUnitIdOrderByAttemptNumberDesc(unit.getId())
                    .filter(a -> !a.isFinished())
                    .ifPresent(a -> {
                        a.complete(AttemptOutcome.CANCELLED, "Cancelled");
                        attemptRepo.save(a);
                    });
            unit.transitionTo(RemediationStatus.CANCELLED);
            unitRepo.save(unit);
            closeAlerts(unit);
        }
        try {
            jobClient.deleteMatching(Map.of(Signal.TASK_LABEL, RemediationJobNames.sanitizeLabelValue(taskId)));
        } catch (ExternalCallException e) {
            log.warn("Cancel task {}: label sweep failed: {}", taskId, e.getMessage());
        }
        String batchId = props.getTracker().getBatchId();
        if (batchId != null && !batchId.isBlank()) {
            try {
                tracker.clearRemediation(batchId, taskId);
            } catch (RuntimeException e) {
                log.warn("Cancel task {}: could not clear remediation on task record: {}", taskId, e.getMessage());
            }
        }
        log.info("Cancelled {} remediation(s) for task {}", units.size(), taskId);
        return units.size();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<RemediationUnit> findById(UUID id) {
        return unitRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public List<RemediationAttempt> getAttempts(UUID unitId) {
        return attemptRepo.findByUnitIdOrderByAttemptNumberAsc(unitId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Optional<Batch> currentBatch() {
        String batchId = props.getTracker().getBatchId();
        if (batchId == null || batchId.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(tracker.loadBatch(batchId));
        } catch (RuntimeException e) {
            log.warn("Batch {} unavailable, continuing without task context: {}", batchId, e.getMessage());
            meterRegistry.counter("healer.context.failures", "source", "batch").increment();
            return Optional.empty();
        }
    }

    private void recordOnTask(RemediationUnit unit, String jobRef, Diagnosis diagnosis) {
        String batchId = props.getTracker().getBatchId();
        if (unit.getTaskId() == null || batchId == null || batchId.isBlank()) {
            return;
        }
        try {
            tracker.recordRemediation(batchId, unit.getTaskId(), jobRef, diagnosis.summary());
        } catch (RuntimeException e) {
            // the next poll sees the unit through dedup anyway
            log.warn("Could not record remediation {} on task {}: {}", jobRef, unit.getTaskId(), e.getMessage());
        }
    }

    private EvaluationState evaluationState(RemediationUnit unit) {
        Optional<Batch> batch = currentBatch();
        Optional<TaskState> task = batch.flatMap(b -> Optional.ofNullable(unit.getTaskId()).flatMap(b::task));
        return new EvaluationState(repositoryFor(task, batch), task.flatMap(TaskState::pr));
    }

    private FailureDetails failureDetails(RemediationUnit unit) {
        Optional<Batch> batch = currentBatch();
        Optional<TaskState> task = batch.flatMap(b -> Optional.ofNullable(unit.getTaskId()).flatMap(b::task));
        String repository = repositoryFor(task, batch);
        return new FailureDetails(
                unit.getSignalType(),
                unit.getTarget(),
                unit.getSeverity(),
                unit.getTaskId(),
                repository.isBlank() ? null : repository,
                task.map(TaskState::prNumber).orElse(null),
                task.map(TaskState::workflowName).orElse(null),
                unit.getDiagnosisSummary(),
                null);
    }

    private String repositoryFor(Optional<TaskState> task, Optional<Batch> batch) {
        return task.map(TaskState::repository)
                .or(() -> batch.map(Batch::repository))
                .filter(r -> !r.isBlank())
                .orElse(props.getEscalation().getRepository());
    }

    private void closeAlerts(RemediationUnit unit) {
        try {
            alertRepo.findByAlertTypeAndTargetAndOpenTrue(unit.getSignalType(), unit.getTarget())
                    .forEach(a -> {
                        a.close();
                        alertRepo.save(a);
                    });
        } catch (RuntimeException e) {
            log.warn("Could not close alerts for remediation {}: {}", unit.getId(), e.getMessage());
        }
    }

    private String jobLogTail(String jobRef) {
        try {
            return logSource.jobLogs(jobRef, ERROR_TAIL_LINES);
        } catch (ExternalCallException e) {
            meterRegistry.counter("healer.context.failures", "source", "job-logs").increment();
            return "(logs unavailable: " + e.getMessage() + ")";
        }
    }

    private String quietly(String source, RemediationUnit unit, Supplier<String> fetch) {
        try {
            String s = fetch.get();
            return s == null ? "" : s;
        } catch (ExternalCallException e) {
            contextFailure(source, unit, e);
            return "";
        }
    }

    private void contextFailure(String source, RemediationUnit unit, ExternalCallException e) {
        log.warn("Remediation {}: {} unavailable: {}", unit.getId(), source, e.getMessage());
        meterRegistry.counter("healer.context.failures", "source", source).increment();
    }

    private static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
