package com.botops.campaigns.dto;

import java.time.Instant;
import java.util.UUID;

public record CampaignResponse(
        UUID id,
        String tenantId,
        String name,
        String segment,
        UUID botId,
        String status,
        String frequency,
        String startTime,
        int totalTargeted,
        int totalSent,
        int totalFailed,
        String schedulerJobId,
        Instant createdAt,
        Instant updatedAt
) {
}
