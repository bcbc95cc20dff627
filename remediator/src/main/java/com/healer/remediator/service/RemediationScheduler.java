package com.healer.remediator.service;

import com.healer.remediator.config.HealerProperties;
import com.healer.remediator.model.AlertType;
import com.healer.remediator.model.Severity;
import com.healer.remediator.model.Signal;
import com.healer.remediator.tracker.Batch;
import com.healer.remediator.tracker.BatchTracker;
import com.healer.remediator.tracker.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Background loop that keeps remediations moving.
 *
 * Each tick:
 *   1. Sweep the configured batch (if any) and turn every task that needs
 *      remediation into a signal. Dedup keeps a task from being remediated twice.
 *   2. Advance every open remediation unit by one step.
 *
 * Ticks never overlap (fixedDelay), so a unit is never advanced concurrently
 * by this process.
 */
@Component
@EnableScheduling
public class RemediationScheduler {

    private static final Logger log = LoggerFactory.getLogger(RemediationScheduler.class);

    static final String TASK_TARGET_PREFIX = "play-task-";

    private final RemediationOrchestrator orchestrator;
    private final BatchTracker            tracker;
    private final HealerProperties        props;

    public RemediationScheduler(RemediationOrchestrator orchestrator,
                                BatchTracker tracker,
                                HealerProperties props) {
        this.orchestrator = orchestrator;
        this.tracker      = tracker;
        this.props        = props;
    }

    @Scheduled(fixedDelayString = "${healer.poll-interval:30000}")
    public void tick() {
        sweepBatch();
        pollActiveUnits();
    }

    /** Ingest a signal for every failed or stuck task of the configured batch. */
    void sweepBatch() {
        String batchId = props.getTracker().getBatchId();
        if (batchId == null || batchId.isBlank()) {
            return;
        }
        Batch batch;
        try {
            batch = tracker.loadBatch(batchId);
        } catch (RuntimeException e) {
            log.warn("Batch sweep skipped, could not load batch {}: {}", batchId, e.getMessage());
            return;
        }
        List<TaskState> needing = tracker.tasksNeedingRemediation(batch);
        log.debug("Batch {}: {}/{} completed, {} running, {} stuck, {} need remediation",
                batchId, batch.status().completed(), batch.size(), tracker.runningTasks(batch).size(),
                tracker.stuckTasks(batch).size(), needing.size());
        for (TaskState task : needing) {
            try {
                IngestResult result = orchestrator.ingest(signalFor(task));
                log.debug("Task {} ({}): {}", task.id(), task.status(), result.reason());
            } catch (RuntimeException e) {
                log.error("Could not ingest signal for task {}: {}", task.id(), e.getMessage(), e);
            }
        }
    }

    void pollActiveUnits() {
        List<UUID> open = orchestrator.openUnitIds();
        for (UUID id : open) {
            try {
                orchestrator.advance(id);
            } catch (RuntimeException e) {
                // one broken unit must not stall the others
                log.error("Unhandled error advancing remediation {}: {}", id, e.getMessage(), e);
            }
        }
    }

    /** Failed tasks raise a pod-failure signal, stuck ones a step-timeout signal. */
    static Signal signalFor(TaskState task) {
        AlertType type = task.isFailed() ? AlertType.A7 : AlertType.A8;
        Severity severity = task.isFailed() ? Severity.HIGH : Severity.MEDIUM;
        return Signal.of(type.code(), TASK_TARGET_PREFIX + task.id(), severity,
                Map.of(Signal.TASK_LABEL, task.id()));
    }
}
