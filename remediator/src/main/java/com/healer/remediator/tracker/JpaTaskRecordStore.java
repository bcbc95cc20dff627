package com.healer.remediator.tracker;

import com.healer.remediator.model.TaskRecord;
import com.healer.remediator.repository.TaskRecordRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class JpaTaskRecordStore implements TaskRecordStore {

    private final TaskRecordRepository repo;

    public JpaTaskRecordStore(TaskRecordRepository repo) {
        this.repo = repo;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Map<String, String>> loadBatch(String batchId) {
        Map<String, Map<String, String>> out = new LinkedHashMap<>();
        for (TaskRecord r : repo.findByBatchId(batchId)) {
            out.put(r.getTaskId(), new HashMap<>(r.getFields()));
        }
        return out;
    }

    @Override
    @Transactional
    public void upsert(String batchId, String taskId, Map<String, String> fields) {
        TaskRecord record = repo.findByBatchIdAndTaskId(batchId, taskId)
                .orElseGet(() -> new TaskRecord(batchId, taskId));
        fields.forEach((k, v) -> {
            if (v == null) {
                record.getFields().remove(k);
            } else {
                record.getFields().put(k, v);
            }
        });
        repo.save(record);
    }
}
