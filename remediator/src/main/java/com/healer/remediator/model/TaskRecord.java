package com.healer.remediator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Flat, string-keyed state record for one task of a batch.
 *
 * Fields are whatever the writers put there (stage, status, error,
 * pr-number, workflow-name, job-name, repository, last-updated); the
 * tracker tolerates any of them being absent or malformed.
 *
 * DB tables: task_records, task_record_fields
 */
@Entity
@Table(name = "task_records",
       uniqueConstraints = @UniqueConstraint(columnNames = {"batch_id", "task_id"}))
public class TaskRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "batch_id", nullable = false)
    private String batchId;

    @Column(name = "task_id", nullable = false)
    private String taskId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "task_record_fields", joinColumns = @JoinColumn(name = "record_id"))
    @MapKeyColumn(name = "field_key")
    @Column(name = "field_value", columnDefinition = "TEXT")
    private Map<String, String> fields = new HashMap<>();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected TaskRecord() {}   // required by JPA

    public TaskRecord(String batchId, String taskId) {
        this.batchId = batchId;
        this.taskId  = taskId;
    }

    public UUID                getId()        { return id; }
    public String              getBatchId()   { return batchId; }
    public String              getTaskId()    { return taskId; }
    public Map<String, String> getFields()    { return fields; }
    public Instant             getUpdatedAt() { return updatedAt; }
}
