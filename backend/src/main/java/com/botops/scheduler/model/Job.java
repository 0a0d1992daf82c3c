package com.botops.scheduler.model;

import java.util.Map;

public record Job(
        String id,
        String tenantId,
        long scheduledFor,
        Channel channel,
        Map<String, Object> payload,
        JobStatus status,
        int attempts,
        int maxAttempts,
        Recurrence recurrence,
        String campaignId,
        Map<String, Object> metadata
) {

    public Job {
        payload = payload == null ? Map.of() : payload;
        status = status == null ? JobStatus.PENDING : status;
    }

    public Job rescheduled(long nextScheduledFor, int nextAttempts) {
        return new Job(id, tenantId, nextScheduledFor, channel, payload, JobStatus.PENDING,
                nextAttempts, maxAttempts, recurrence, campaignId, metadata);
    }

    public Job withPayload(Map<String, Object> nextPayload) {
        return new Job(id, tenantId, scheduledFor, channel, nextPayload, status,
                attempts, maxAttempts, recurrence, campaignId, metadata);
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        return text.isBlank() ? null : text;
    }
}
