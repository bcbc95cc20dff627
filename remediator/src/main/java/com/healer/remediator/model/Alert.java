package com.healer.remediator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A human-facing alert raised when remediation starts for a signal.
 * Type-level dedup looks at open alerts of the same type.
 *
 * DB table: alerts
 */
@Entity
@Table(name = "alerts")
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "alert_type", nullable = false)
    private String alertType;

    @Column(nullable = false)
    private String target;

    @Column(nullable = false)
    private String title;

    @Column(name = "is_open", nullable = false)
    private boolean open = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "closed_at")
    private Instant closedAt;

    protected Alert() {}   // required by JPA

    public Alert(String alertType, String target, String title) {
        this.alertType = alertType;
        this.target    = target;
        this.title     = title;
    }

    public void close() {
        this.open     = false;
        this.closedAt = Instant.now();
    }

    public UUID    getId()        { return id; }
    public String  getAlertType() { return alertType; }
    public String  getTarget()    { return target; }
    public String  getTitle()     { return title; }
    public boolean isOpen()       { return open; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getClosedAt()  { return closedAt; }
}
