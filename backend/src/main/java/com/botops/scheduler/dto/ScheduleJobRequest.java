package com.botops.scheduler.dto;

import com.botops.scheduler.model.Channel;
import com.botops.scheduler.model.Recurrence;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Either {@code scheduledFor} (epoch millis) or {@code delayMs} may be given; with neither the job is due now.
 */
public record ScheduleJobRequest(
        @Size(max = 64) String id,
        @NotBlank @Size(max = 128) String tenantId,
        @NotNull Channel channel,
        Map<String, Object> payload,
        @PositiveOrZero Long scheduledFor,
        @PositiveOrZero Long delayMs,
        Recurrence recurrence,
        String campaignId,
        @Positive Integer maxAttempts,
        Map<String, Object> metadata
) {
}
