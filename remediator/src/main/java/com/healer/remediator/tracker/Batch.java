package com.healer.remediator.tracker;

import java.util.List;
import java.util.Optional;

/**
 * Ordered task list plus the aggregate status derived from it.
 */
public record Batch(
        String          id,
        String          repository,
        List<TaskState> tasks,
        BatchStatus     status
) {
    public Batch {
        tasks = List.copyOf(tasks);
    }

    public static Batch of(String id, String repository, List<TaskState> tasks) {
        return new Batch(id, repository, tasks, BatchStatus.of(tasks));
    }

    public Optional<TaskState> task(String taskId) {
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    public int size() {
        return tasks.size();
    }
}
