package com.healer.remediator.escalation;

import com.healer.remediator.model.AttemptOutcome;
import com.healer.remediator.model.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class EscalationDispatcherTest {

    static final FailureDetails FAILURE = new FailureDetails(
            "a7", "pod-123", null, "42", "org/repo", 17, null, "Test failure", null);

    static final List<AttemptSummary> ATTEMPTS = List.of(
            new AttemptSummary(1, "rex",   AttemptOutcome.AGENT_FAILED, Duration.ofSeconds(10), "boom"),
            new AttemptSummary(2, "atlas", AttemptOutcome.TIMEOUT,      Duration.ofSeconds(20), "slow"));

    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    ExecutorService     workers  = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void failingChannel_doesNotStopTheOthers() {
        RecordingChannel a = new RecordingChannel("a", true, true);
        RecordingChannel b = new RecordingChannel("b", true, false);
        EscalationDispatcher dispatcher = new EscalationDispatcher(List.of(a, b), registry, workers);

        List<ChannelResult> results = dispatcher.escalateAndWait(FAILURE, ATTEMPTS, "pod-123");

        assertThat(results).extracting(ChannelResult::status)
                .containsExactly(ChannelResult.Status.FAILED, ChannelResult.Status.SENT);
        assertThat(results.get(0).error()).isEqualTo("a is down");
        assertThat(b.received).hasSize(1);
        assertThat(registry.counter("healer.escalation.deliveries", "channel", "a", "status", "failed").count())
                .isEqualTo(1.0);
        assertThat(registry.counter("healer.escalation.deliveries", "channel", "b", "status", "sent").count())
                .isEqualTo(1.0);
    }

    @Test
    void disabledChannel_isSkipped() {
        RecordingChannel off = new RecordingChannel("off", false, false);
        EscalationDispatcher dispatcher = new EscalationDispatcher(List.of(off), registry, workers);

        List<ChannelResult> results = dispatcher.escalateAndWait(FAILURE, ATTEMPTS, "pod-123");

        assertThat(results).extracting(ChannelResult::status).containsExactly(ChannelResult.Status.SKIPPED);
        assertThat(off.received).isEmpty();
    }

    @Test
    void escalate_deliversInTheBackground() throws Exception {
        RecordingChannel a = new RecordingChannel("a", true, true);
        RecordingChannel b = new RecordingChannel("b", true, false);
        EscalationDispatcher dispatcher = new EscalationDispatcher(List.of(a, b), registry, workers);

        dispatcher.escalate(FAILURE, ATTEMPTS, "pod-123");

        workers.shutdown();
        assertThat(workers.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(b.received).hasSize(1);
    }

    @Test
    void notification_carriesDetailsAndDefaultsToCritical() {
        EscalationNotification n = EscalationDispatcher.buildNotification(FAILURE, ATTEMPTS, "pod-123");

        assertThat(n.id()).startsWith("ESC-").hasSize(12);
        assertThat(n.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(n.title()).isEqualTo("[Healer] Remediation Failed: a7 on pod-123");
        assertThat(n.details())
                .containsEntry("attempts", "2")
                .containsEntry("agents", "rex → atlas")
                .containsEntry("repository", "org/repo")
                .containsEntry("pr-number", "17")
                .doesNotContainKey("url");
    }

    @Test
    void missingTypeAndTarget_stillDeliverDegradedReport() {
        RecordingChannel a = new RecordingChannel("a", true, false);
        EscalationDispatcher dispatcher = new EscalationDispatcher(List.of(a), registry, workers);
        FailureDetails bare = new FailureDetails(null, null, null, null, null, null, null, null, null);

        List<ChannelResult> results = dispatcher.escalateAndWait(bare, null, null);

        assertThat(results).extracting(ChannelResult::status).containsExactly(ChannelResult.Status.SENT);
        assertThat(a.received).singleElement().satisfies(n -> {
            assertThat(n.title()).isEqualTo("[Healer] Remediation Failed: unknown on unknown");
            assertThat(n.details())
                    .containsEntry("type", "unknown")
                    .containsEntry("target", "unknown")
                    .containsEntry("attempts", "0");
        });
    }

    @Test
    void slackPayload_usesSeverityColourAndTitle() {
        EscalationNotification n = EscalationDispatcher.buildNotification(FAILURE, ATTEMPTS, "pod-123");

        Map<String, Object> payload = SlackWebhookChannel.payload(n);

        assertThat(payload.get("text")).isEqualTo("🚨 [Healer] Remediation Failed: a7 on pod-123");
        @SuppressWarnings("unchecked")
        Map<String, Object> attachment = ((List<Map<String, Object>>) payload.get("attachments")).get(0);
        assertThat(attachment).containsEntry("color", "#dc3545");
    }

    @Test
    void discordPayload_mentionsAndCapsDescription() {
        EscalationNotification n = new EscalationNotification("ESC-1", Severity.HIGH, "t",
                "x".repeat(5000), Map.of(), Instant.EPOCH);

        Map<String, Object> payload = DiscordWebhookChannel.payload(n, "@oncall");

        assertThat(payload).containsEntry("content", "@oncall");
        @SuppressWarnings("unchecked")
        Map<String, Object> embed = ((List<Map<String, Object>>) payload.get("embeds")).get(0);
        assertThat((String) embed.get("description")).hasSize(4096).endsWith("...");
        assertThat(embed).containsEntry("color", 0xff8c00);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static class RecordingChannel implements EscalationChannel {
        final String  name;
        final boolean enabled;
        final boolean fails;
        final List<EscalationNotification> received = new CopyOnWriteArrayList<>();

        RecordingChannel(String name, boolean enabled, boolean fails) {
            this.name    = name;
            this.enabled = enabled;
            this.fails   = fails;
        }

        @Override public String name()     { return name; }
        @Override public boolean enabled() { return enabled; }

        @Override
        public ChannelResult send(EscalationNotification n) {
            if (fails) {
                throw new IllegalStateException(name + " is down");
            }
            received.add(n);
            return ChannelResult.sent(name);
        }
    }
}
