package com.healer.remediator.client;

/**
 * Best-effort access to recent log lines.
 */
public interface LogSource {

    String jobLogs(String jobRef, int tailLines);

    String workflowLogs(String workflowName, int tailLines);
}
