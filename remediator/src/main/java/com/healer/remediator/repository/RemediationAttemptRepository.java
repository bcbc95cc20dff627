package com.healer.remediator.repository;

import com.healer.remediator.model.RemediationAttempt;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RemediationAttemptRepository extends JpaRepository<RemediationAttempt, UUID> {

    /** All attempts for a unit, oldest first. */
    List<RemediationAttempt> findByUnitIdOrderByAttemptNumberAsc(UUID unitId);

    Optional<RemediationAttempt> findFirstByUnitIdOrderByAttemptNumberDesc(UUID unitId);
}
