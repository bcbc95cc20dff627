package com.healer.remediator.escalation;

import com.healer.remediator.config.HealerProperties;
import com.healer.remediator.model.Severity;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Builds one escalation report and delivers it to every enabled channel.
 *
 * Channels are independent: a disabled channel is skipped, a failing one
 * is logged and counted, and neither affects delivery to the others.
 * Nothing here throws to the caller.
 *
 * Two modes:
 *   escalate()        fire-and-forget on a small worker pool
 *   escalateAndWait() deliver on the calling thread and return per-channel results
 */
@Component
public class EscalationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EscalationDispatcher.class);

    private final List<EscalationChannel> channels;
    private final MeterRegistry           meterRegistry;
    private final ExecutorService         workers;

    @Autowired
    public EscalationDispatcher(List<EscalationChannel> channels,
                                MeterRegistry meterRegistry,
                                HealerProperties props) {
        this(channels, meterRegistry,
                Executors.newFixedThreadPool(Math.max(1, props.getEscalation().getWorkerThreads())));
    }

    public EscalationDispatcher(List<EscalationChannel> channels,
                                MeterRegistry meterRegistry,
                                ExecutorService workers) {
        this.channels      = List.copyOf(channels);
        this.meterRegistry = meterRegistry;
        this.workers       = workers;
        log.info("Escalation channels: {}", channels.stream()
                .map(c -> c.name() + (c.enabled() ? "" : " (disabled)"))
                .collect(Collectors.joining(", ")));
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /** Fire-and-forget. Outcomes are logged, never returned. */
    public void escalate(FailureDetails failure, List<AttemptSummary> attempts, String target) {
        try {
            EscalationNotification n = buildNotification(failure, attempts, target);
            workers.submit(() -> {
                try {
                    deliver(n);
                } catch (RuntimeException e) {
                    log.error("Escalation {} delivery aborted: {}", n.id(), e.getMessage(), e);
                }
            });
        } catch (RuntimeException e) {
            log.error("Could not dispatch escalation for {}: {}", target, e.getMessage(), e);
        }
    }

    /** Deliver synchronously and return one result per channel, in channel order. */
    public List<ChannelResult> escalateAndWait(FailureDetails failure, List<AttemptSummary> attempts,
                                               String target) {
        try {
            return deliver(buildNotification(failure, attempts, target));
        } catch (RuntimeException e) {
            log.error("Could not build escalation for {}: {}", target, e.getMessage(), e);
            return List.of();
        }
    }

    /** Deliver an already-built notification to every channel. */
    public List<ChannelResult> deliver(EscalationNotification n) {
        log.warn("Escalating {} ({}): {}", n.id(), n.severity(), n.title());
        List<ChannelResult> results = new ArrayList<>();
        for (EscalationChannel channel : channels) {
            ChannelResult r = deliverTo(channel, n);
            meterRegistry.counter("healer.escalation.deliveries",
                    "channel", channel.name(), "status", r.status().name().toLowerCase()).increment();
            results.add(r);
        }
        long sent = results.stream().filter(ChannelResult::isSent).count();
        long failed = results.stream().filter(r -> r.status() == ChannelResult.Status.FAILED).count();
        log.info("Escalation {} delivered to {}/{} channels ({} failed)", n.id(), sent, results.size(), failed);
        return results;
    }

    private ChannelResult deliverTo(EscalationChannel channel, EscalationNotification n) {
        String name = safeName(channel);
        try {
            if (!channel.enabled()) {
                return ChannelResult.skipped(name, "disabled");
            }
            ChannelResult r = channel.send(n);
            if (r == null) {
                return ChannelResult.sent(name);
            }
            if (r.status() == ChannelResult.Status.FAILED) {
                log.warn("Escalation channel '{}' failed for {}: {}", name, n.id(), r.error());
            }
            return r;
        } catch (RuntimeException e) {
            log.warn("Escalation channel '{}' failed for {}: {}", name, n.id(), e.getMessage());
            return ChannelResult.failed(name, e.getMessage());
        }
    }

    private static String safeName(EscalationChannel channel) {
        try {
            return channel.name();
        } catch (RuntimeException e) {
            return channel.getClass().getSimpleName();
        }
    }

    // ------------------------------------------------------------------
    // Notification
    // ------------------------------------------------------------------

    static EscalationNotification buildNotification(FailureDetails failure,
                                                    List<AttemptSummary> attempts,
                                                    String target) {
        List<AttemptSummary> history = attempts == null ? List.of() : attempts;
        Map<String, String> details = new LinkedHashMap<>();
        details.put(EscalationNotification.TYPE,     failure.signalType());
        details.put(EscalationNotification.TARGET,   orUnknown(target));
        details.put(EscalationNotification.ATTEMPTS, String.valueOf(history.size()));
        details.put(EscalationNotification.AGENTS,   history.stream()
                .map(AttemptSummary::agent).collect(Collectors.joining(" → ")));
        putIfPresent(details, EscalationNotification.REPOSITORY, failure.repository());
        putIfPresent(details, EscalationNotification.PR_NUMBER,
                failure.prNumber() == null ? null : String.valueOf(failure.prNumber()));
        putIfPresent(details, EscalationNotification.URL, failure.url());

        return new EscalationNotification(
                "ESC-" + UUID.randomUUID().toString().substring(0, 8),
                failure.severity() == null ? Severity.CRITICAL : failure.severity(),
                EscalationReport.title(failure),
                EscalationReport.render(failure, history),
                details,
                Instant.now());
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }
}
