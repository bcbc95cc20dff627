package com.healer.remediator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One attempt-chain for resolving a single diagnosed issue.
 *
 * Keyed for dedup by (signalType, target). Status only moves forward
 * (see {@link RemediationStatus#canTransitionTo}) and attemptCount only grows.
 *
 * DB table: remediation_units  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "remediation_units")
public class RemediationUnit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String fingerprint;

    @Column(name = "signal_type", nullable = false)
    private String signalType;

    @Column(nullable = false)
    private String target;

    // Null for signals that are not tied to a tracked task.
    @Column(name = "task_id")
    private String taskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity = Severity.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RemediationStatus status = RemediationStatus.PENDING;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount = 0;

    // Latest diagnosis, refreshed before every attempt.
    @Column(name = "diagnosis_category")
    private String diagnosisCategory;

    @Column(name = "diagnosis_summary", columnDefinition = "TEXT")
    private String diagnosisSummary;

    @Column(name = "suggested_fix", columnDefinition = "TEXT")
    private String suggestedFix;

    // Name of the currently running corrective job, null between attempts.
    @Column(name = "job_ref")
    private String jobRef;

    @Column(name = "last_failure_reason", columnDefinition = "TEXT")
    private String lastFailureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected RemediationUnit() {}   // required by JPA

    public RemediationUnit(Signal signal) {
        this.fingerprint = signal.fingerprint();
        this.signalType  = signal.type();
        this.target      = signal.target();
        this.taskId      = signal.taskId();
        this.severity    = signal.severity();
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    /**
     * Move to {@code next}.
     *
     * @throws IllegalStateException if the move would go backwards
     */
    public void transitionTo(RemediationStatus next) {
        if (next == RemediationStatus.IN_PROGRESS) {
            throw new IllegalStateException("Use startAttempt() to enter IN_PROGRESS");
        }
        requireTransition(next);
        this.status = next;
        this.jobRef = null;   // the job that ran the attempt is finished or abandoned
    }

    /** Begin the next attempt: bump the counter and enter IN_PROGRESS together. */
    public void startAttempt(String jobRef) {
        requireTransition(RemediationStatus.IN_PROGRESS);
        this.attemptCount++;
        this.status = RemediationStatus.IN_PROGRESS;
        this.jobRef = jobRef;
    }

    private void requireTransition(RemediationStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Remediation " + id + ": illegal transition " + status + " → " + next);
        }
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID              getId()                { return id; }
    public String            getFingerprint()       { return fingerprint; }
    public String            getSignalType()        { return signalType; }
    public String            getTarget()            { return target; }
    public String            getTaskId()            { return taskId; }
    public Severity          getSeverity()          { return severity; }
    public RemediationStatus getStatus()            { return status; }
    public int               getAttemptCount()      { return attemptCount; }
    public String            getJobRef()            { return jobRef; }
    public Instant           getCreatedAt()         { return createdAt; }
    public Instant           getUpdatedAt()         { return updatedAt; }

    public String getDiagnosisCategory()                { return diagnosisCategory; }
    public void setDiagnosisCategory(String v)          { this.diagnosisCategory = v; }
    public String getDiagnosisSummary()                 { return diagnosisSummary; }
    public void setDiagnosisSummary(String v)           { this.diagnosisSummary = v; }
    public String getSuggestedFix()                     { return suggestedFix; }
    public void setSuggestedFix(String v)               { this.suggestedFix = v; }
    public String getLastFailureReason()                { return lastFailureReason; }
    public void setLastFailureReason(String v)          { this.lastFailureReason = v; }
    public void setTaskId(String taskId)                { this.taskId = taskId; }
}
