package com.healer.remediator.tracker;

import java.util.List;

/**
 * Aggregate status of a batch.
 *
 * COMPLETED   all tasks completed (and there is at least one)
 * FAILED      every task is terminal and at least one failed
 * IN_PROGRESS anything else; carries completed/total
 */
public record BatchStatus(
        Kind         kind,
        int          completed,
        int          total,
        List<String> failedTaskIds
) {
    public enum Kind { IN_PROGRESS, COMPLETED, FAILED }

    public BatchStatus {
        failedTaskIds = List.copyOf(failedTaskIds);
    }

    public static BatchStatus of(List<TaskState> tasks) {
        int total     = tasks.size();
        int completed = (int) tasks.stream().filter(TaskState::isCompleted).count();
        List<String> failed = tasks.stream().filter(TaskState::isFailed).map(TaskState::id).toList();

        Kind kind;
        if (!failed.isEmpty() && completed + failed.size() == total) {
            kind = Kind.FAILED;
        } else if (total > 0 && completed == total) {
            kind = Kind.COMPLETED;
        } else {
            kind = Kind.IN_PROGRESS;
        }
        return new BatchStatus(kind, completed, total, failed);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case COMPLETED   -> "Completed";
            case FAILED      -> "Failed (" + String.join(", ", failedTaskIds) + ")";
            case IN_PROGRESS -> "In progress (" + completed + "/" + total + ")";
        };
    }
}
