package com.healer.remediator.dedup;

import com.healer.remediator.config.HealerProperties;
import com.healer.remediator.model.Alert;
import com.healer.remediator.model.RemediationStatus;
import com.healer.remediator.model.RemediationUnit;
import com.healer.remediator.model.Signal;
import com.healer.remediator.repository.AlertRepository;
import com.healer.remediator.repository.RemediationUnitRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Decides whether an incoming signal duplicates work already under way.
 *
 * Two independent lookups:
 *   1. exact key  : a non-terminal remediation unit for the same (type, target)
 *   2. type window: an open alert of the same type raised inside the window,
 *                   whatever its target, so one root cause hitting many pods
 *                   raises one alert
 *
 * Both lookups fail open. If the store cannot be read the check reports
 * "not found" and remediation goes ahead; a duplicate spawn during an outage
 * is preferred over a blocked pipeline.
 */
@Component
public class DeduplicationFilter {

    private static final Logger log = LoggerFactory.getLogger(DeduplicationFilter.class);

    static final Set<RemediationStatus> ACTIVE = EnumSet.of(
            RemediationStatus.PENDING,
            RemediationStatus.IN_PROGRESS,
            RemediationStatus.FAILED);   // FAILED units are waiting for their next attempt

    private final RemediationUnitRepository unitRepo;
    private final AlertRepository           alertRepo;
    private final MeterRegistry             meterRegistry;
    private final Duration                  window;
    private final Clock                     clock;

    @Autowired
    public DeduplicationFilter(RemediationUnitRepository unitRepo,
                               AlertRepository alertRepo,
                               MeterRegistry meterRegistry,
                               HealerProperties props) {
        this(unitRepo, alertRepo, meterRegistry, props.getDedup().getWindow(), Clock.systemUTC());
    }

    DeduplicationFilter(RemediationUnitRepository unitRepo,
                        AlertRepository alertRepo,
                        MeterRegistry meterRegistry,
                        Duration window,
                        Clock clock) {
        this.unitRepo      = unitRepo;
        this.alertRepo     = alertRepo;
        this.meterRegistry = meterRegistry;
        this.window        = window;
        this.clock         = clock;
    }

    public boolean shouldSuppress(Signal signal) {
        return check(signal).shouldSuppress();
    }

    public DedupDecision check(Signal signal) {
        DedupDecision decision = new DedupDecision(
                findActiveRemediation(signal.type(), signal.target()),
                findRecentAlert(signal.type()));

        if (decision.shouldSuppress()) {
            log.info("Suppressing signal {} (type={}, target={}): {}",
                    signal.fingerprint(), signal.type(), signal.target(), decision.reason());
            meterRegistry.counter("healer.dedup.suppressed", "reason", decision.reason()).increment();
        }
        return decision;
    }

    // ------------------------------------------------------------------
    // Lookups
    // ------------------------------------------------------------------

    /** Exact-key check. Empty on lookup failure. */
    public Optional<UUID> findActiveRemediation(String type, String target) {
        try {
            List<RemediationUnit> active =
                    unitRepo.findBySignalTypeAndTargetAndStatusIn(type, target, ACTIVE);
            return active.stream().findFirst().map(RemediationUnit::getId);
        } catch (RuntimeException e) {
            lookupFailed("active-remediation", type, e);
            return Optional.empty();
        }
    }

    /** Type-level windowed check. Empty on lookup failure. */
    public Optional<UUID> findRecentAlert(String type) {
        Instant since = clock.instant().minus(window);
        try {
            List<Alert> recent = alertRepo.findByAlertTypeAndOpenTrueAndCreatedAtAfter(type, since);
            return recent.stream().findFirst().map(Alert::getId);
        } catch (RuntimeException e) {
            lookupFailed("recent-alert", type, e);
            return Optional.empty();
        }
    }

    private void lookupFailed(String check, String type, RuntimeException e) {
        log.warn("Dedup lookup '{}' failed for type {}; allowing remediation: {}",
                check, type, e.getMessage());
        meterRegistry.counter("healer.dedup.lookup.failures", "check", check).increment();
    }
}
