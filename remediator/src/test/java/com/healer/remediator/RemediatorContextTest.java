package com.healer.remediator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healer.remediator.client.GitHubClient;
import com.healer.remediator.client.HttpJobClient;
import com.healer.remediator.client.HttpLogSource;
import com.healer.remediator.config.HealerProperties;
import com.healer.remediator.config.InvalidConfigurationException;
import com.healer.remediator.config.RemediatorConfiguration;
import com.healer.remediator.dedup.DeduplicationFilter;
import com.healer.remediator.diagnosis.Diagnosis;
import com.healer.remediator.diagnosis.DiagnosisCategory;
import com.healer.remediator.diagnosis.DiagnosisContext;
import com.healer.remediator.diagnosis.DiagnosisEngine;
import com.healer.remediator.diagnosis.DiagnosisRule;
import com.healer.remediator.escalation.DiscordWebhookChannel;
import com.healer.remediator.escalation.EscalationChannel;
import com.healer.remediator.escalation.EscalationDispatcher;
import com.healer.remediator.escalation.GitHubIssueChannel;
import com.healer.remediator.escalation.PullRequestCommentChannel;
import com.healer.remediator.escalation.SlackWebhookChannel;
import com.healer.remediator.naming.RemediationJobNames;
import com.healer.remediator.repository.AlertRepository;
import com.healer.remediator.repository.RemediationAttemptRepository;
import com.healer.remediator.repository.RemediationUnitRepository;
import com.healer.remediator.repository.TaskRecordRepository;
import com.healer.remediator.service.AgentSelector;
import com.healer.remediator.service.RemediationOrchestrator;
import com.healer.remediator.service.RemediationScheduler;
import com.healer.remediator.success.Checks;
import com.healer.remediator.success.SuccessCheck;
import com.healer.remediator.success.SuccessEvaluator;
import com.healer.remediator.tracker.BatchTracker;
import com.healer.remediator.tracker.JpaTaskRecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Builds the real service bean graph over mocked repositories, so a bean
 * Spring cannot construct fails here rather than at deployment.
 */
class RemediatorContextTest {

    @Configuration
    @EnableConfigurationProperties
    static class PropertyBinding {}

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withPropertyValues(
                    "healer.jobs.base-url=http://127.0.0.1:1",
                    "healer.logs.base-url=http://127.0.0.1:1",
                    "healer.poll-interval=3600000")
            .withBean(RemediationUnitRepository.class, () -> mock(RemediationUnitRepository.class))
            .withBean(RemediationAttemptRepository.class, () -> mock(RemediationAttemptRepository.class))
            .withBean(AlertRepository.class, () -> mock(AlertRepository.class))
            .withBean(TaskRecordRepository.class, () -> mock(TaskRecordRepository.class))
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withUserConfiguration(
                    PropertyBinding.class,
                    HealerProperties.class,
                    RemediatorConfiguration.class,
                    RemediationJobNames.class,
                    DeduplicationFilter.class,
                    JpaTaskRecordStore.class,
                    BatchTracker.class,
                    Checks.FeedbackResolved.class,
                    Checks.PullRequestApproved.class,
                    Checks.StatusChecksPassed.class,
                    Checks.NoCriticalIssues.class,
                    Checks.ManualSuccessSignal.class,
                    SuccessEvaluator.class,
                    HttpJobClient.class,
                    HttpLogSource.class,
                    GitHubClient.class,
                    SlackWebhookChannel.class,
                    DiscordWebhookChannel.class,
                    GitHubIssueChannel.class,
                    PullRequestCommentChannel.class,
                    EscalationDispatcher.class,
                    AgentSelector.class,
                    RemediationOrchestrator.class,
                    RemediationScheduler.class);

    @Test
    void contextStarts_withEveryServiceBean() {
        runner.run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).hasSingleBean(DeduplicationFilter.class);
            assertThat(ctx).hasSingleBean(RemediationOrchestrator.class);
            assertThat(ctx).hasSingleBean(RemediationScheduler.class);
            assertThat(ctx.getBeansOfType(SuccessCheck.class)).hasSize(5);
            assertThat(ctx.getBeansOfType(EscalationChannel.class)).hasSize(4);
            assertThat(ctx.getBean(DiagnosisEngine.class).rules())
                    .hasSize(DiagnosisEngine.defaultRules().size());
        });
    }

    @Test
    void customDiagnosisRule_runsBeforeBuiltInRules() {
        DiagnosisRule custom = new DiagnosisRule() {
            @Override public String name() { return "custom"; }

            @Override
            public Optional<Diagnosis> match(DiagnosisContext context) {
                return Optional.of(new Diagnosis(DiagnosisCategory.INFRA_ISSUE, "custom", "fix", List.of()));
            }
        };

        runner.withBean(DiagnosisRule.class, () -> custom).run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx.getBean(DiagnosisEngine.class).rules()).first().isSameAs(custom);
        });
    }

    @Test
    void invalidLimits_failStartup() {
        runner.withPropertyValues("healer.remediation.max-attempts=0").run(ctx ->
                assertThat(ctx).getFailure()
                        .rootCause()
                        .isInstanceOf(InvalidConfigurationException.class)
                        .hasMessageContaining("max-attempts"));
    }
}
