package com.healer.remediator.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.healer.remediator.model.RemediationStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemediationUnitTest {

    @Test
    void newUnit_isPendingWithTaskFromLabel() {
        RemediationUnit unit = new RemediationUnit(
                Signal.of("a7", "pod-123", Severity.HIGH, Map.of(Signal.TASK_LABEL, "42")));

        assertThat(unit.getStatus()).isEqualTo(PENDING);
        assertThat(unit.getAttemptCount()).isZero();
        assertThat(unit.getTaskId()).isEqualTo("42");
        assertThat(unit.getFingerprint()).isEqualTo(Fingerprints.of("a7", "pod-123"));
    }

    @Test
    void retryCycle_incrementsAttemptsAndClearsJobRef() {
        RemediationUnit unit = unit();

        unit.startAttempt("job-1");
        unit.transitionTo(FAILED);
        assertThat(unit.getJobRef()).isNull();
        unit.startAttempt("job-2");

        assertThat(unit.getStatus()).isEqualTo(IN_PROGRESS);
        assertThat(unit.getAttemptCount()).isEqualTo(2);
        assertThat(unit.getJobRef()).isEqualTo("job-2");
    }

    @Test
    void inProgress_onlyViaStartAttempt() {
        RemediationUnit unit = unit();

        assertThatThrownBy(() -> unit.transitionTo(IN_PROGRESS))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void terminalStates_acceptNoFurtherTransition() {
        RemediationUnit unit = unit();
        unit.startAttempt("job-1");
        unit.transitionTo(SUCCEEDED);

        assertThatThrownBy(() -> unit.transitionTo(CANCELLED)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> unit.startAttempt("job-2")).isInstanceOf(IllegalStateException.class);
        assertThat(unit.getAttemptCount()).isEqualTo(1);
    }

    @Test
    void transitionTable() {
        assertThat(PENDING.canTransitionTo(IN_PROGRESS)).isTrue();
        assertThat(PENDING.canTransitionTo(SUCCEEDED)).isFalse();
        assertThat(IN_PROGRESS.canTransitionTo(ESCALATED)).isFalse();
        assertThat(FAILED.canTransitionTo(ESCALATED)).isTrue();
        assertThat(FAILED.canTransitionTo(SUCCEEDED)).isFalse();
        assertThat(IN_PROGRESS.canTransitionTo(CANCELLED)).isTrue();
        assertThat(ESCALATED.canTransitionTo(CANCELLED)).isFalse();
        assertThat(ESCALATED.isTerminal()).isTrue();
        assertThat(FAILED.isTerminal()).isFalse();
    }

    private static RemediationUnit unit() {
        return new RemediationUnit(Signal.of("a7", "pod-123", Severity.HIGH, Map.of()));
    }
}
