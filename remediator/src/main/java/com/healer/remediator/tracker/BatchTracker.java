package com.healer.remediator.tracker;

import com.healer.remediator.config.HealerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.healer.remediator.tracker.TaskRecordStore.*;

/**
 * Rebuilds batch state from task records and answers questions about it.
 *
 * Loading is forgiving: a record with a missing or unreadable field still
 * produces a task (IN_PROGRESS at PENDING by default) so one bad writer
 * cannot hide the rest of the batch. Everything except {@link #loadBatch}
 * and {@link #recordRemediation} is pure.
 */
@Component
public class BatchTracker {

    private static final Logger log = LoggerFactory.getLogger(BatchTracker.class);

    static final String UNKNOWN_ERROR = "Unknown error";

    private final TaskRecordStore store;
    private final Duration        stageTimeout;
    private final Clock           clock;

    @Autowired
    public BatchTracker(TaskRecordStore store, HealerProperties props) {
        this(store, props.getTracker().getStageTimeout(), Clock.systemUTC());
    }

    public BatchTracker(TaskRecordStore store, Duration stageTimeout, Clock clock) {
        this.store        = store;
        this.stageTimeout = stageTimeout;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Load
    // ------------------------------------------------------------------

    /** Read the batch's records from the store and rebuild it. */
    public Batch loadBatch(String batchId) {
        return load(batchId, store.loadBatch(batchId));
    }

    /**
     * Rebuild a batch from raw records (taskId → fields). Tasks are ordered
     * by id, numerically when both ids are numbers.
     */
    public Batch load(String batchId, Map<String, Map<String, String>> records) {
        List<TaskState> tasks = new ArrayList<>();
        String repository = "";
        for (var entry : records.entrySet()) {
            Map<String, String> fields = entry.getValue() == null ? Map.of() : entry.getValue();
            TaskState task = toTaskState(entry.getKey(), fields);
            tasks.add(task);
            if (repository.isEmpty() && task.repository() != null) {
                repository = task.repository();
            }
        }
        tasks.sort(Comparator.comparing(TaskState::id, BatchTracker::compareIds));
        return Batch.of(batchId, repository, tasks);
    }

    TaskState toTaskState(String taskId, Map<String, String> fields) {
        Stage stage = Optional.ofNullable(fields.get(STAGE))
                .flatMap(Stage::fromRecordValue)
                .orElse(Stage.PENDING);
        String status = Optional.ofNullable(fields.get(STATUS)).orElse("").trim().toLowerCase();

        TaskState task = switch (status) {
            case "completed", "done" -> TaskState.completed(taskId);
            case "failed", "error"   -> TaskState.failed(taskId, stage,
                    blankToNull(fields.get(ERROR)) == null ? UNKNOWN_ERROR : fields.get(ERROR));
            default -> TaskState.inProgress(taskId, stage, parseInstant(taskId, fields.get(LAST_UPDATED)));
        };

        task = task.withLinks(
                parsePrNumber(taskId, fields.get(PR_NUMBER)),
                blankToNull(fields.get(JOB_NAME)),
                blankToNull(fields.get(WORKFLOW_NAME)),
                blankToNull(fields.get(REPOSITORY)));

        String remediationJob = blankToNull(fields.get(REMEDIATION_JOB));
        if (task.isFailed() && remediationJob != null) {
            Instant startedAt = parseInstant(taskId, fields.get(REMEDIATION_AT));
            task = task.withRemediation(new ActiveRemediation(
                    remediationJob, Optional.ofNullable(fields.get(REMEDIATION_NOTE)).orElse(""), startedAt));
        }
        return task;
    }

    // ------------------------------------------------------------------
    // Aggregate
    // ------------------------------------------------------------------

    /** Recompute the aggregate status from the task list. */
    public Batch updateStatus(Batch batch) {
        return Batch.of(batch.id(), batch.repository(), batch.tasks());
    }

    /** Completed fraction in [0,1]; 0 for an empty batch. */
    public double progress(Batch batch) {
        if (batch.tasks().isEmpty()) {
            return 0.0;
        }
        return (double) batch.status().completed() / batch.size();
    }

    // ------------------------------------------------------------------
    // Per-task predicates
    // ------------------------------------------------------------------

    /** A running task that has been in its current stage longer than the stage timeout. */
    public boolean isStuck(TaskState task) {
        return task.stageDuration(clock.instant())
                .map(d -> d.compareTo(stageTimeout) > 0)
                .orElse(false);
    }

    /** Failed with nothing working on it yet, or stuck. */
    public boolean needsRemediation(TaskState task) {
        return (task.isFailed() && !task.hasActiveRemediation()) || isStuck(task);
    }

    public String healthIndicator(TaskState task) {
        if (task.isCompleted()) {
            return "healthy";
        }
        if (needsRemediation(task)) {
            return "critical";
        }
        if (task.hasActiveRemediation()) {
            return "warning";
        }
        if (task.isRunning() && task.stage() == Stage.PENDING) {
            return "pending";
        }
        return "healthy";
    }

    public List<TaskState> stuckTasks(Batch batch) {
        return batch.tasks().stream().filter(this::isStuck).toList();
    }

    public List<TaskState> tasksNeedingRemediation(Batch batch) {
        return batch.tasks().stream().filter(this::needsRemediation).toList();
    }

    public List<TaskState> runningTasks(Batch batch) {
        return batch.tasks().stream().filter(TaskState::isRunning).toList();
    }

    // ------------------------------------------------------------------
    // Write-back
    // ------------------------------------------------------------------

    /** Mark a task as being worked on by {@code jobRef}. Single-record upsert. */
    public void recordRemediation(String batchId, String taskId, String jobRef, String diagnosis) {
        Map<String, String> fields = new HashMap<>();
        fields.put(REMEDIATION_JOB,  jobRef);
        fields.put(REMEDIATION_NOTE, diagnosis);
        fields.put(REMEDIATION_AT,   clock.instant().toString());
        store.upsert(batchId, taskId, fields);
    }

    /** Forget the remediation on a task so the next poll can pick it up again. */
    public void clearRemediation(String batchId, String taskId) {
        Map<String, String> fields = new HashMap<>();
        fields.put(REMEDIATION_JOB,  null);
        fields.put(REMEDIATION_NOTE, null);
        fields.put(REMEDIATION_AT,   null);
        store.upsert(batchId, taskId, fields);
    }

    public Duration stageTimeout() {
        return stageTimeout;
    }

    // ------------------------------------------------------------------
    // Parsing helpers
    // ------------------------------------------------------------------

    private Instant parseInstant(String taskId, String raw) {
        if (blankToNull(raw) == null) {
            return clock.instant();
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            log.debug("Task {}: unreadable timestamp '{}', using now", taskId, raw);
            return clock.instant();
        }
    }

    private static Integer parsePrNumber(String taskId, String raw) {
        if (blankToNull(raw) == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim().replaceFirst("^#", ""));
        } catch (NumberFormatException e) {
            log.debug("Task {}: ignoring malformed pr-number '{}'", taskId, raw);
            return null;
        }
    }

    /** Numeric ids first in numeric order, then the rest lexicographically. */
    static int compareIds(String a, String b) {
        boolean an = isSmallNumber(a);
        boolean bn = isSmallNumber(b);
        if (an && bn) {
            return Integer.compare(Integer.parseInt(a), Integer.parseInt(b));
        }
        if (an != bn) {
            return an ? -1 : 1;
        }
        return a.compareTo(b);
    }

    private static boolean isSmallNumber(String s) {
        return !s.isEmpty() && s.length() < 10 && s.chars().allMatch(Character::isDigit);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
