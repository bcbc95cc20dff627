package com.healer.remediator.model;

import jakarta.persistence.*;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One corrective job spawned for a remediation unit.
 *
 * DB table: remediation_attempts
 */
@Entity
@Table(name = "remediation_attempts")
public class RemediationAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "unit_id", nullable = false)
    private RemediationUnit unit;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Column(nullable = false)
    private String agent;

    @Column(name = "job_ref")
    private String jobRef;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    // Null while the job is still running.
    @Enumerated(EnumType.STRING)
    private AttemptOutcome outcome;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    protected RemediationAttempt() {}   // required by JPA

    public RemediationAttempt(RemediationUnit unit, int attemptNumber, String agent, String jobRef) {
        this.unit          = unit;
        this.attemptNumber = attemptNumber;
        this.agent         = agent;
        this.jobRef        = jobRef;
    }

    public void complete(AttemptOutcome outcome, String failureReason) {
        this.outcome       = outcome;
        this.failureReason = failureReason;
        this.completedAt   = Instant.now();
    }

    public boolean isFinished() {
        return outcome != null;
    }

    /** Elapsed time; for a running attempt, time so far. */
    public Duration duration() {
        Instant end = completedAt != null ? completedAt : Instant.now();
        return Duration.between(startedAt, end);
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID            getId()             { return id; }
    public RemediationUnit getUnit()           { return unit; }
    public int             getAttemptNumber()  { return attemptNumber; }
    public String          getAgent()          { return agent; }
    public String          getJobRef()         { return jobRef; }
    public Instant         getStartedAt()      { return startedAt; }
    public Instant         getCompletedAt()    { return completedAt; }
    public AttemptOutcome  getOutcome()        { return outcome; }
    public String          getFailureReason()  { return failureReason; }

    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
}
