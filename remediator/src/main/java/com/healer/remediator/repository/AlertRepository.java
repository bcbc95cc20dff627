package com.healer.remediator.repository;

import com.healer.remediator.model.Alert;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface AlertRepository extends JpaRepository<Alert, UUID> {

    /** Type-level dedup: open alerts of this type raised after {@code since}. */
    List<Alert> findByAlertTypeAndOpenTrueAndCreatedAtAfter(String alertType, Instant since);

    List<Alert> findByAlertTypeAndTargetAndOpenTrue(String alertType, String target);
}
