package com.botops.executionlog.dto;

import com.botops.executionlog.model.ExecutionOutcome;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record ExecutionLogResponse(
        UUID id,
        String jobId,
        String tenantId,
        String channel,
        ExecutionOutcome outcome,
        Instant executedAt,
        String error,
        JsonNode requestPayload,
        JsonNode responsePayload
) {
}
