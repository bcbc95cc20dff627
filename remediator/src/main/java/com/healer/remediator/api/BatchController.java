package com.healer.remediator.api;

import com.healer.remediator.api.dto.BatchResponse;
import com.healer.remediator.tracker.Batch;
import com.healer.remediator.tracker.BatchTracker;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * GET /batches/{id}: progress, aggregate status and per-task health of a batch.
 * A batch with no task records is reported as not found.
 */
@RestController
@RequestMapping("/batches")
public class BatchController {

    private final BatchTracker tracker;

    public BatchController(BatchTracker tracker) {
        this.tracker = tracker;
    }

    @GetMapping("/{id}")
    public BatchResponse get(@PathVariable String id) {
        Batch batch = tracker.loadBatch(id);
        if (batch.size() == 0) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Batch not found: " + id);
        }
        return BatchResponse.from(batch, tracker);
    }
}
