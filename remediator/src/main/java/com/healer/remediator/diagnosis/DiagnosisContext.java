package com.healer.remediator.diagnosis;

import com.healer.remediator.client.PullRequestState;

import java.util.Optional;

/**
 * Everything the diagnosis rules look at. Any source that could not be
 * fetched is an empty string or an empty Optional, never null.
 */
public record DiagnosisContext(
        String                     logs,
        String                     agentOutput,
        Optional<PullRequestState> pullRequest
) {
    public DiagnosisContext {
        logs        = logs == null ? "" : logs;
        agentOutput = agentOutput == null ? "" : agentOutput;
        pullRequest = pullRequest == null ? Optional.empty() : pullRequest;
    }

    public static DiagnosisContext empty() {
        return new DiagnosisContext("", "", Optional.empty());
    }

    public boolean isEmpty() {
        return logs.isBlank() && agentOutput.isBlank() && pullRequest.isEmpty();
    }
}
