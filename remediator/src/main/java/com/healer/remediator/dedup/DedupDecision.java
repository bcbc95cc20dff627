package com.healer.remediator.dedup;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of both dedup checks for one signal.
 *
 * @param activeUnitId   the non-terminal unit that already covers (type, target), if any
 * @param recentAlertId  an open alert of the same type inside the window, if any
 */
public record DedupDecision(
        Optional<UUID> activeUnitId,
        Optional<UUID> recentAlertId
) {
    public static DedupDecision admit() {
        return new DedupDecision(Optional.empty(), Optional.empty());
    }

    public boolean duplicateRemediation() { return activeUnitId.isPresent(); }
    public boolean duplicateAlert()       { return recentAlertId.isPresent(); }

    public boolean shouldSuppress() {
        return duplicateRemediation() || duplicateAlert();
    }

    public String reason() {
        if (duplicateRemediation()) return "active-remediation";
        if (duplicateAlert())       return "recent-alert";
        return "none";
    }
}
