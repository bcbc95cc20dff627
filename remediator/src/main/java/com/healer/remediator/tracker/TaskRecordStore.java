package com.healer.remediator.tracker;

import java.util.Map;

/**
 * Persisted per-task records, keyed by batch then task id.
 *
 * Writes are single-record merges; concurrent writers to the same record
 * resolve last-write-wins.
 */
public interface TaskRecordStore {

    String STAGE            = "stage";
    String STATUS           = "status";
    String ERROR            = "error";
    String PR_NUMBER        = "pr-number";
    String WORKFLOW_NAME    = "workflow-name";
    String JOB_NAME         = "job-name";
    String REPOSITORY       = "repository";
    String LAST_UPDATED     = "last-updated";
    String REMEDIATION_JOB  = "remediation-job";
    String REMEDIATION_NOTE = "remediation-diagnosis";
    String REMEDIATION_AT   = "remediation-started";

    /** taskId → fields, in no particular order. */
    Map<String, Map<String, String>> loadBatch(String batchId);

    /** Merge {@code fields} into the record, creating it if missing. A null value removes the key. */
    void upsert(String batchId, String taskId, Map<String, String> fields);
}
