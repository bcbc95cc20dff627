package com.healer.remediator.escalation;

import com.healer.remediator.model.AttemptOutcome;
import com.healer.remediator.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EscalationReportTest {

    static final FailureDetails FAILURE = new FailureDetails(
            "a7", "play-task-42", Severity.HIGH, "42", "org/repo", 17, "play-task-42-wf",
            "Test failure", "https://ci.example.com/runs/9");

    @Test
    void render_sectionsAppearInOrder() {
        String md = EscalationReport.render(FAILURE, List.of(
                new AttemptSummary(1, "rex",   AttemptOutcome.CHECKS_FAILING, Duration.ofSeconds(95), "checks red"),
                new AttemptSummary(2, "rex",   AttemptOutcome.AGENT_FAILED,   Duration.ofSeconds(30), "agent crashed"),
                new AttemptSummary(3, "atlas", AttemptOutcome.TIMEOUT,        null, "timed out")));

        assertThat(md).containsSubsequence(
                "## 🚨 Remediation Escalation",
                "Automated remediation failed after **3 attempts**.",
                "### Failure Details",
                "- **Type**: a7",
                "- **Pull Request**: #17",
                "- **[View Run](https://ci.example.com/runs/9)**",
                "### Remediation Attempts",
                "| # | Agent | Outcome | Duration |",
                "| 1 | rex | ❌ Checks still failing | 1m 35s |",
                "| 3 | atlas | ⏱️ Timeout | N/A |",
                "### Last Error",
                "timed out",
                "---",
                EscalationReport.CALL_TO_ACTION);
    }

    @Test
    void render_skipsMissingDetailsAndEmptyError() {
        FailureDetails bare = new FailureDetails("a9", "job-x", null, null, null, null, null, null, null);

        String md = EscalationReport.render(bare, List.of(
                new AttemptSummary(1, "rex", AttemptOutcome.AGENT_FAILED, Duration.ofSeconds(5), null)));

        assertThat(md).contains("after **1 attempt**.")
                .doesNotContain("**Repository**")
                .doesNotContain("View Run")
                .doesNotContain("### Last Error");
    }

    @Test
    void lastError_isTruncated() {
        String longError = "e".repeat(2500);

        String md = EscalationReport.render(FAILURE, List.of(
                new AttemptSummary(1, "rex", AttemptOutcome.AGENT_FAILED, Duration.ofSeconds(5), longError)));

        assertThat(md).contains("e".repeat(2000) + "...(truncated)")
                .doesNotContain("e".repeat(2001));
    }

    @Test
    void title_namesTypeAndTarget() {
        assertThat(EscalationReport.title(FAILURE))
                .isEqualTo("[Healer] Remediation Failed: a7 on play-task-42");
    }
}
