package com.healer.remediator.api.dto;

import com.healer.remediator.tracker.Batch;
import com.healer.remediator.tracker.BatchTracker;
import com.healer.remediator.tracker.TaskState;

import java.util.List;

/**
 * Response body for GET /batches/{id}: aggregate status plus one line per task.
 */
public record BatchResponse(
        String          id,
        String          repository,
        String          status,
        int             completed,
        int             total,
        double          progress,
        List<String>    failedTaskIds,
        List<TaskView>  tasks
) {
    public record TaskView(String id, String status, String stage, String agent, String health,
                           Integer prNumber, String failureReason, String remediationJob) {}

    public static BatchResponse from(Batch batch, BatchTracker tracker) {
        List<TaskView> tasks = batch.tasks().stream()
                .map(t -> view(t, tracker))
                .toList();
        return new BatchResponse(
                batch.id(),
                batch.repository(),
                batch.status().kind().name(),
                batch.status().completed(),
                batch.status().total(),
                tracker.progress(batch),
                batch.status().failedTaskIds(),
                tasks
        );
    }

    private static TaskView view(TaskState t, BatchTracker tracker) {
        return new TaskView(
                t.id(),
                t.status().name(),
                t.stage() == null ? null : t.stage().displayName(),
                t.stage() == null ? null : t.stage().agent().orElse(null),
                tracker.healthIndicator(t),
                t.prNumber(),
                t.failureReason(),
                t.hasActiveRemediation() ? t.remediation().jobRef() : null
        );
    }
}
