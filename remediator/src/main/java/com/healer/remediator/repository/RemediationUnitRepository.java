package com.healer.remediator.repository;

import com.healer.remediator.model.RemediationStatus;
import com.healer.remediator.model.RemediationUnit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + lookup queries for the remediation_units table.
 */
public interface RemediationUnitRepository extends JpaRepository<RemediationUnit, UUID> {

    /** Exact-key dedup lookup: units for (type, target) in any of the given states. */
    List<RemediationUnit> findBySignalTypeAndTargetAndStatusIn(
            String signalType, String target, Collection<RemediationStatus> statuses);

    /** Units the poll loop must look at (IN_PROGRESS, FAILED awaiting a retry). */
    List<RemediationUnit> findByStatusIn(Collection<RemediationStatus> statuses);

    List<RemediationUnit> findByTaskIdAndStatusIn(String taskId, Collection<RemediationStatus> statuses);
}
