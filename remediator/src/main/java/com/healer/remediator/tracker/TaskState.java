package com.healer.remediator.tracker;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Reconstructed state of one task.
 *
 * Which fields are meaningful depends on {@link #status()}:
 * <ul>
 *   <li>IN_PROGRESS: stage, stageStartedAt</li>
 *   <li>COMPLETED: nothing beyond the common fields</li>
 *   <li>FAILED: stage, failureReason, remediation (null when none is running)</li>
 * </ul>
 * prNumber, jobRef, workflowName and repository are common and may be null.
 */
public record TaskState(
        String            id,
        TaskStatus        status,
        Stage             stage,
        Instant           stageStartedAt,
        String            failureReason,
        ActiveRemediation remediation,
        Integer           prNumber,
        String            jobRef,
        String            workflowName,
        String            repository
) {
    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    public static TaskState inProgress(String id, Stage stage, Instant stageStartedAt) {
        return new TaskState(id, TaskStatus.IN_PROGRESS, stage, stageStartedAt,
                null, null, null, null, null, null);
    }

    public static TaskState completed(String id) {
        return new TaskState(id, TaskStatus.COMPLETED, Stage.COMPLETED, null,
                null, null, null, null, null, null);
    }

    public static TaskState failed(String id, Stage stage, String reason) {
        return new TaskState(id, TaskStatus.FAILED, stage, null,
                reason, null, null, null, null, null);
    }

    public TaskState withLinks(Integer prNumber, String jobRef, String workflowName, String repository) {
        return new TaskState(id, status, stage, stageStartedAt, failureReason, remediation,
                prNumber, jobRef, workflowName, repository);
    }

    public TaskState withRemediation(ActiveRemediation remediation) {
        return new TaskState(id, status, stage, stageStartedAt, failureReason, remediation,
                prNumber, jobRef, workflowName, repository);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public boolean isCompleted()  { return status == TaskStatus.COMPLETED; }
    public boolean isFailed()     { return status == TaskStatus.FAILED; }
    public boolean isRunning()    { return status == TaskStatus.IN_PROGRESS; }

    public boolean hasActiveRemediation() {
        return isFailed() && remediation != null;
    }

    /** Time spent in the current stage; empty unless IN_PROGRESS. */
    public Optional<Duration> stageDuration(Instant now) {
        if (!isRunning() || stageStartedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(stageStartedAt, now));
    }

    public Optional<Integer> pr() {
        return Optional.ofNullable(prNumber);
    }
}
