package com.healer.remediator.repository;

import com.healer.remediator.model.TaskRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TaskRecordRepository extends JpaRepository<TaskRecord, UUID> {

    List<TaskRecord> findByBatchId(String batchId);

    Optional<TaskRecord> findByBatchIdAndTaskId(String batchId, String taskId);
}
