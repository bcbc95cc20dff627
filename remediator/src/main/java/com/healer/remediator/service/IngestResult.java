package com.healer.remediator.service;

import com.healer.remediator.dedup.DedupDecision;

import java.util.Optional;
import java.util.UUID;

/**
 * What happened to an ingested signal.
 */
public record IngestResult(Outcome outcome, Optional<UUID> unitId, String reason) {

    public enum Outcome { ACCEPTED, SUPPRESSED, EXCLUDED }

    public static IngestResult accepted(UUID unitId) {
        return new IngestResult(Outcome.ACCEPTED, Optional.ofNullable(unitId), "new remediation");
    }

    public static IngestResult suppressed(DedupDecision decision) {
        return new IngestResult(Outcome.SUPPRESSED, decision.activeUnitId(), decision.reason());
    }

    public static IngestResult excluded() {
        return new IngestResult(Outcome.EXCLUDED, Optional.empty(), "excluded by label");
    }
}
