package com.healer.remediator.api.dto;

import com.healer.remediator.service.IngestResult;

import java.util.UUID;

public record IngestResponse(String outcome, UUID unitId, String reason) {

    public static IngestResponse from(IngestResult r) {
        return new IngestResponse(r.outcome().name(), r.unitId().orElse(null), r.reason());
    }
}
